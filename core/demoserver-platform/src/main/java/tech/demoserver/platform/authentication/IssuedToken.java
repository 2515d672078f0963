package tech.demoserver.platform.authentication;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Token handed to a client after a successful login.
 */
@Schema(description = "Access token response")
public record IssuedToken(
    @JsonProperty("access_token")
    String accessToken,
    @JsonProperty("token_type")
    @Schema(example = "bearer")
    String tokenType,
    @JsonProperty("expires_in")
    @Schema(description = "Token lifetime in seconds", example = "1800")
    long expiresIn
) {

    public static final String BEARER = "bearer";

    public static IssuedToken bearer(String accessToken, long expiresIn) {
        return new IssuedToken(accessToken, BEARER, expiresIn);
    }
}
