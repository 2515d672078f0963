package tech.demoserver.platform.upload;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.multipart.FileUpload;
import tech.demoserver.platform.authorization.AccessContext;
import tech.demoserver.platform.authorization.AccessRequirement;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.common.api.ApiResponses.ErrorResponse;
import tech.demoserver.platform.common.api.ErrorResponses;
import tech.demoserver.platform.common.errors.UseCaseError;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Multipart file uploads. Uploading needs an active account; the limits
 * endpoint is public.
 */
@Path("/api/v1/upload")
@Tag(name = "Files", description = "File uploads")
@Produces(MediaType.APPLICATION_JSON)
public class UploadResource {

    private static final Logger LOG = Logger.getLogger(UploadResource.class);
    private static final String UNKNOWN = "unknown";

    @Inject
    FileStorage fileStorage;

    @Inject
    UploadConfig config;

    @Inject
    AccessContext accessContext;

    @Inject
    Clock clock;

    @POST
    @Path("/single")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    @Operation(summary = "Upload a single file")
    @APIResponse(responseCode = "200", description = "File stored")
    @APIResponse(responseCode = "400", description = "Missing file, type not allowed or too large")
    public Response uploadFile(@RestForm("file") FileUpload file) {
        accessContext.require(AccessRequirement.active());

        if (file == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ErrorResponse("MISSING_FILE", "No file provided"))
                    .build();
        }

        Result<UploadResponse> result = storeOne(file);
        if (result instanceof Result.Failure<UploadResponse> f) {
            return ErrorResponses.toResponse(f.error());
        }
        return Response.ok(result.orElseThrow()).build();
    }

    /**
     * Rejected files are reported in the returned list instead of failing
     * the whole request.
     */
    @POST
    @Path("/multiple")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    @Operation(summary = "Upload several files at once")
    @APIResponse(responseCode = "200", description = "One result per file")
    @APIResponse(responseCode = "400", description = "No files or too many files")
    public Response uploadFiles(@RestForm("files") List<FileUpload> files) {
        accessContext.require(AccessRequirement.active());

        if (files == null || files.isEmpty()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ErrorResponse("MISSING_FILE", "No files provided"))
                    .build();
        }
        if (files.size() > config.maxFilesPerRequest()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ErrorResponse("TOO_MANY_FILES",
                            "Maximum " + config.maxFilesPerRequest() + " files allowed per request"))
                    .build();
        }

        List<UploadResponse> responses = new ArrayList<>(files.size());
        for (FileUpload file : files) {
            Result<UploadResponse> result = storeOne(file);
            if (result instanceof Result.Failure<UploadResponse> f) {
                responses.add(rejected(file, f.error()));
            } else {
                responses.add(result.orElseThrow());
            }
        }
        return Response.ok(responses).build();
    }

    @GET
    @Path("/info")
    @Operation(summary = "Upload limits")
    public UploadInfo info() {
        return new UploadInfo(
                fileStorage.maxFileSizeMb(),
                config.allowedExtensions(),
                config.maxFilesPerRequest()
        );
    }

    private Result<UploadResponse> storeOne(FileUpload file) {
        return fileStorage.validate(file.fileName(), file.size()).map(extension -> {
            String storedName;
            try {
                storedName = fileStorage.store(file.uploadedFile(), extension);
            } catch (IOException e) {
                LOG.errorf(e, "Failed to store upload '%s'", file.fileName());
                throw new UncheckedIOException(e);
            }
            FileInfo info = new FileInfo(
                    file.fileName(),
                    file.contentType() != null ? file.contentType() : MediaType.APPLICATION_OCTET_STREAM,
                    file.size(),
                    clock.instant()
            );
            return new UploadResponse("File uploaded successfully", info, FileStorage.FILES_URL_PREFIX + storedName);
        });
    }

    private UploadResponse rejected(FileUpload file, UseCaseError error) {
        String name = file.fileName() != null && !file.fileName().isBlank() ? file.fileName() : UNKNOWN;
        return new UploadResponse(
                "Error uploading " + name + ": " + error.message(),
                new FileInfo(name, UNKNOWN, file.size(), clock.instant()),
                null
        );
    }

    public record UploadInfo(
            @JsonProperty("max_file_size_mb") long maxFileSizeMb,
            @JsonProperty("allowed_extensions") List<String> allowedExtensions,
            @JsonProperty("max_files_per_request") int maxFilesPerRequest
    ) {}
}
