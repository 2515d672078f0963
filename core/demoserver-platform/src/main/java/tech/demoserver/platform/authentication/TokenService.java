package tech.demoserver.platform.authentication;

import io.quarkus.runtime.Startup;
import io.smallrye.jwt.algorithm.SignatureAlgorithm;
import io.smallrye.jwt.build.Jwt;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.common.errors.UseCaseError;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Issues and verifies HMAC-signed JWT access tokens.
 *
 * <p>Tokens carry {@code sub}, {@code iat}, {@code exp} and {@link #EXPIRES_AT_MILLIS_CLAIM}.
 * The standard claims have whole-second precision, so the exact expiry instant
 * travels in the signed millisecond claim and is what {@link #verify} checks.
 * Nothing is stored server side, so a token stays valid until it expires.
 */
@Startup
@ApplicationScoped
public class TokenService {

    private static final Logger LOG = Logger.getLogger(TokenService.class);

    public static final String TOKEN_MALFORMED = "TOKEN_MALFORMED";
    public static final String TOKEN_EXPIRED = "TOKEN_EXPIRED";

    /** Expiry in epoch milliseconds. */
    public static final String EXPIRES_AT_MILLIS_CLAIM = "exp_ms";

    @Inject
    AuthConfig authConfig;

    @Inject
    Clock clock;

    private SignatureAlgorithm algorithm;
    private SecretKey signingKey;
    private JwtConsumer consumer;

    @PostConstruct
    void init() {
        AuthConfig.JwtConfig jwt = authConfig.jwt();
        this.algorithm = parseAlgorithm(jwt.algorithm());

        byte[] secret = jwt.secret().getBytes(StandardCharsets.UTF_8);
        int minLength = minimumSecretLength(algorithm);
        if (secret.length < minLength) {
            throw new IllegalStateException(String.format(
                "demoserver.auth.jwt.secret must be at least %d bytes for %s (got %d)",
                minLength, algorithm.getAlgorithm(), secret.length));
        }
        if (jwt.accessTokenExpireMinutes() <= 0) {
            throw new IllegalStateException("demoserver.auth.jwt.access-token-expire-minutes must be positive");
        }

        this.signingKey = new SecretKeySpec(secret, jcaName(algorithm));
        this.consumer = new JwtConsumerBuilder()
            .setSkipAllValidators()
            .setVerificationKey(signingKey)
            .setJwsAlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT, algorithm.getAlgorithm())
            .build();

        LOG.infof("Token service initialized: algorithm=%s, access token ttl=%d min",
            algorithm.getAlgorithm(), jwt.accessTokenExpireMinutes());
    }

    /**
     * Issue a signed token for {@code subject}, valid for {@code now' < now + ttl}.
     *
     * @param now issue time; {@code iat} is truncated to whole seconds and
     *            {@code exp} rounded up, the exact expiry goes in {@code exp_ms}
     * @param ttl lifetime
     */
    public String issue(String subject, Instant now, Duration ttl) {
        Instant expiresAt = now.plus(ttl);
        Instant expiresAtSeconds = expiresAt.truncatedTo(ChronoUnit.SECONDS);
        if (expiresAtSeconds.isBefore(expiresAt)) {
            expiresAtSeconds = expiresAtSeconds.plusSeconds(1);
        }
        return Jwt.subject(subject)
            .issuedAt(now.truncatedTo(ChronoUnit.SECONDS))
            .expiresAt(expiresAtSeconds)
            .claim(EXPIRES_AT_MILLIS_CLAIM, expiresAt.toEpochMilli())
            .jws()
            .algorithm(algorithm)
            .sign(signingKey);
    }

    /**
     * Issue a token for the login endpoint using the configured lifetime.
     */
    public IssuedToken issueAccessToken(String subject) {
        Duration ttl = accessTokenTtl();
        return IssuedToken.bearer(issue(subject, clock.instant(), ttl), ttl.toSeconds());
    }

    /**
     * Verify a token's signature and expiry.
     *
     * @return the subject on success; {@link #TOKEN_MALFORMED} if the token can not be
     *         parsed, is signed differently or lacks sub/exp; {@link #TOKEN_EXPIRED}
     *         once {@code now} reaches the expiry instant
     */
    public Result<String> verify(String token, Instant now) {
        if (token == null || token.isBlank()) {
            return malformed("Token is empty");
        }

        JwtClaims claims;
        try {
            claims = consumer.processToClaims(token);
        } catch (InvalidJwtException e) {
            return malformed("Token could not be verified");
        }

        String subject;
        NumericDate expiration;
        Long expiresAtMillis;
        try {
            subject = claims.getSubject();
            expiration = claims.getExpirationTime();
            expiresAtMillis = claims.getClaimValue(EXPIRES_AT_MILLIS_CLAIM, Long.class);
        } catch (MalformedClaimException e) {
            return malformed("Token claims are malformed");
        }
        if (subject == null || subject.isBlank() || expiration == null) {
            return malformed("Token is missing sub or exp");
        }

        Instant expiresAt = expiresAtMillis != null
            ? Instant.ofEpochMilli(expiresAtMillis)
            : Instant.ofEpochSecond(expiration.getValue());
        if (!now.isBefore(expiresAt)) {
            return Result.failure(new UseCaseError.AuthenticationError(
                TOKEN_EXPIRED,
                "Token has expired",
                Map.of("expiredAt", expiresAt.toString())
            ));
        }
        return Result.success(subject);
    }

    public Duration accessTokenTtl() {
        return Duration.ofMinutes(authConfig.jwt().accessTokenExpireMinutes());
    }

    public String algorithm() {
        return algorithm.getAlgorithm();
    }

    private static <T> Result<T> malformed(String message) {
        return Result.failure(new UseCaseError.AuthenticationError(TOKEN_MALFORMED, message, Map.of()));
    }

    static SignatureAlgorithm parseAlgorithm(String value) {
        if (value != null) {
            switch (value.trim().toUpperCase()) {
                case "HS256":
                    return SignatureAlgorithm.HS256;
                case "HS384":
                    return SignatureAlgorithm.HS384;
                case "HS512":
                    return SignatureAlgorithm.HS512;
                default:
                    break;
            }
        }
        throw new IllegalStateException(
            "Unsupported demoserver.auth.jwt.algorithm '" + value + "', expected HS256, HS384 or HS512");
    }

    private static int minimumSecretLength(SignatureAlgorithm algorithm) {
        switch (algorithm) {
            case HS384:
                return 48;
            case HS512:
                return 64;
            default:
                return 32;
        }
    }

    private static String jcaName(SignatureAlgorithm algorithm) {
        switch (algorithm) {
            case HS384:
                return "HmacSHA384";
            case HS512:
                return "HmacSHA512";
            default:
                return "HmacSHA256";
        }
    }
}
