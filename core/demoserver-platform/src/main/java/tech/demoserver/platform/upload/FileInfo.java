package tech.demoserver.platform.upload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record FileInfo(
    String filename,
    @JsonProperty("content_type")
    String contentType,
    long size,
    @JsonProperty("uploaded_at")
    Instant uploadedAt
) {}
