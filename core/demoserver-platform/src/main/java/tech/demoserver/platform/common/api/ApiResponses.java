package tech.demoserver.platform.common.api;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * Standard API response DTOs shared by every resource.
 */
public final class ApiResponses {

    private ApiResponses() {} // Prevent instantiation

    // ========================================================================
    // Success Responses
    // ========================================================================

    /**
     * Simple message response for operations that don't return an entity.
     */
    @Schema(description = "Simple message response")
    public record MessageResponse(
        @Schema(description = "Human-readable message", example = "User deleted successfully")
        String message,
        @Schema(description = "Whether the operation succeeded", example = "true")
        boolean success
    ) {
        public MessageResponse(String message) {
            this(message, true);
        }
    }

    // ========================================================================
    // Error Responses
    // ========================================================================

    /**
     * Standard error body for every 4xx/5xx produced by the API.
     */
    @Schema(description = "Error response")
    public record ErrorResponse(
        @Schema(description = "Error code for programmatic handling", example = "DUPLICATE_USERNAME")
        String code,
        @Schema(description = "Human-readable error message", example = "Username already registered")
        String message,
        @Schema(description = "Additional error details")
        Map<String, Object> details
    ) {
        public ErrorResponse(String code, String message) {
            this(code, message, Map.of());
        }
    }
}
