package tech.demoserver.platform.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for token issuance and verification.
 *
 * Example configuration:
 * <pre>
 * demoserver.auth.jwt.secret=${JWT_SECRET}
 * demoserver.auth.jwt.algorithm=HS256
 * demoserver.auth.jwt.access-token-expire-minutes=30
 * </pre>
 *
 * Values are read once at startup and stay constant for the process lifetime.
 */
@StaticInitSafe
@ConfigMapping(prefix = "demoserver.auth")
public interface AuthConfig {

    /**
     * JWT signing configuration.
     */
    JwtConfig jwt();

    interface JwtConfig {
        /**
         * HMAC signing secret. Must be at least as long as the algorithm's
         * digest (32 bytes for HS256).
         */
        @WithDefault("your-super-secret-key-change-this-in-production")
        String secret();

        /**
         * One of HS256, HS384, HS512.
         */
        @WithDefault("HS256")
        String algorithm();

        /**
         * Lifetime of access tokens issued by the login endpoint.
         */
        @WithName("access-token-expire-minutes")
        @WithDefault("30")
        int accessTokenExpireMinutes();
    }
}
