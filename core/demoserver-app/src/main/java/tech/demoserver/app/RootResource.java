package tech.demoserver.app;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Welcome document and API directory.
 */
@Path("/")
@Tag(name = "Root")
@Produces(MediaType.APPLICATION_JSON)
public class RootResource {

    @ConfigProperty(name = "demoserver.app-name", defaultValue = "Demo Server")
    String appName;

    @ConfigProperty(name = "demoserver.version", defaultValue = "1.0.0")
    String version;

    @ConfigProperty(name = "demoserver.api-prefix", defaultValue = "/api/v1")
    String apiPrefix;

    @ConfigProperty(name = "quarkus.swagger-ui.path", defaultValue = "/docs")
    String docsPath;

    @GET
    @Operation(summary = "Welcome message")
    public Welcome root() {
        return new Welcome("Welcome to " + appName, version, docsPath, "/openapi", apiPrefix);
    }

    @GET
    @Path("/api/v1")
    @Operation(summary = "API directory")
    public ApiInfo apiInfo() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("authentication", apiPrefix + "/auth");
        endpoints.put("users", apiPrefix + "/users");
        endpoints.put("products", apiPrefix + "/products");
        endpoints.put("files", apiPrefix + "/upload");
        endpoints.put("misc", apiPrefix + "/misc");

        Map<String, String> documentation = new LinkedHashMap<>();
        documentation.put("swagger", docsPath);
        documentation.put("openapi", "/openapi");

        return new ApiInfo(appName + " API " + apiPrefix, version, endpoints, documentation);
    }

    public record Welcome(
            String message,
            String version,
            @JsonProperty("docs_url") String docsUrl,
            @JsonProperty("openapi_url") String openapiUrl,
            @JsonProperty("api_prefix") String apiPrefix
    ) {}

    public record ApiInfo(
            String message,
            String version,
            Map<String, String> endpoints,
            Map<String, String> documentation
    ) {}
}
