package tech.demoserver.platform.upload;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.demoserver.platform.common.api.ApiResponses.ErrorResponse;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Optional;

/**
 * Serves previously uploaded files by their stored name.
 */
@Path("/files")
@Tag(name = "Files")
public class FileResource {

    @Inject
    FileStorage fileStorage;

    @GET
    @Path("/{name}")
    @Operation(summary = "Download an uploaded file")
    public Response download(@PathParam("name") String name) throws IOException {
        Optional<java.nio.file.Path> file = fileStorage.resolve(name);
        if (file.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .type(MediaType.APPLICATION_JSON)
                    .entity(new ErrorResponse("FILE_NOT_FOUND", "File not found"))
                    .build();
        }

        String contentType = Files.probeContentType(file.get());
        return Response.ok(file.get().toFile())
                .type(contentType != null ? contentType : MediaType.APPLICATION_OCTET_STREAM)
                .build();
    }
}
