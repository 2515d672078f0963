package tech.demoserver.platform.principal;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;

/**
 * Public projection of an {@link Account}. Carries no password material.
 */
@Schema(description = "User account")
public record AccountView(
    @Schema(example = "1")
    long id,
    @Schema(example = "john_doe")
    String username,
    @Schema(example = "john@example.com")
    String email,
    @JsonProperty("full_name")
    @Schema(example = "John Doe")
    String fullName,
    Role role,
    @JsonProperty("is_active")
    boolean active,
    @JsonProperty("created_at")
    Instant createdAt,
    @JsonProperty("updated_at")
    Instant updatedAt
) {}
