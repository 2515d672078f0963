package tech.demoserver.platform.upload;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Outcome of one uploaded file. {@code file_url} is null when the file was rejected.
 */
@Schema(description = "File upload result")
public record UploadResponse(
    String message,
    @JsonProperty("file_info")
    FileInfo fileInfo,
    @JsonProperty("file_url")
    String fileUrl
) {}
