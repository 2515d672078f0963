package tech.demoserver.platform.misc;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.demoserver.platform.common.api.ApiResponses.ErrorResponse;
import tech.demoserver.platform.common.api.ApiResponses.MessageResponse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Public demo endpoints for connectivity, timing and error-handling checks.
 */
@Path("/api/v1/misc")
@Tag(name = "Misc", description = "Demo and diagnostic endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class MiscResource {

    private static final DateTimeFormatter FORMATTED_UTC =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private static final List<String> WEATHER_CONDITIONS =
            List.of("sunny", "cloudy", "rainy", "partly cloudy", "clear");

    private static final Map<Integer, String> ERROR_MESSAGES = Map.of(
            400, "Bad Request",
            401, "Unauthorized",
            403, "Forbidden",
            404, "Not Found",
            500, "Internal Server Error",
            502, "Bad Gateway",
            503, "Service Unavailable"
    );

    @ConfigProperty(name = "demoserver.version", defaultValue = "1.0.0")
    String version;

    @Inject
    QuoteClient quoteClient;

    @Inject
    Clock clock;

    @GET
    @Path("/health")
    @Operation(summary = "Health check")
    public HealthStatus health() {
        return new HealthStatus("healthy", clock.instant(), version);
    }

    @GET
    @Path("/ping")
    @Operation(summary = "Connectivity check")
    public Map<String, String> ping() {
        return Map.of("message", "pong");
    }

    @GET
    @Path("/time")
    @Operation(summary = "Current server time in several formats")
    public ServerTime time() {
        Instant now = clock.instant();
        return new ServerTime(now, now.getEpochSecond(), FORMATTED_UTC.format(now), "UTC");
    }

    @GET
    @Path("/echo")
    @Operation(summary = "Echo a query parameter")
    public Echo echo(@QueryParam("message") @NotNull String message) {
        return new Echo(message, clock.instant(), message.length());
    }

    @POST
    @Path("/echo")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Echo a JSON object")
    public MessageResponse echoPost(@NotNull Map<String, Object> data) {
        return new MessageResponse("Received data: " + data);
    }

    @GET
    @Path("/random-quote")
    @Operation(summary = "Random quote from an external service, with a fixed fallback")
    public Quote randomQuote() {
        return quoteClient.randomQuote();
    }

    @GET
    @Path("/weather")
    @Operation(summary = "Mock weather for a city")
    public Weather weather(@QueryParam("city") @NotBlank String city) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return new Weather(
                city,
                roundToTenth(random.nextDouble(-10, 35)),
                WEATHER_CONDITIONS.get(random.nextInt(WEATHER_CONDITIONS.size())),
                random.nextInt(30, 91),
                roundToTenth(random.nextDouble(0, 25)),
                clock.instant(),
                "This is mock data for demo purposes"
        );
    }

    @GET
    @Path("/slow")
    @Operation(summary = "Respond after a delay, for timeout testing")
    public Map<String, Object> slow(@QueryParam("delay") @DefaultValue("5") @Min(1) @Max(30) int delay)
            throws InterruptedException {
        Thread.sleep(Duration.ofSeconds(delay).toMillis());
        return Map.of(
                "message", "Waited for " + delay + " seconds",
                "completed_at", clock.instant().toString()
        );
    }

    @GET
    @Path("/error")
    @Operation(summary = "Respond with the requested error status")
    public Response error(@QueryParam("status_code") @DefaultValue("500") @Min(400) @Max(599) int statusCode) {
        String message = ERROR_MESSAGES.getOrDefault(statusCode, "HTTP Error");
        return Response.status(statusCode)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse("HTTP_" + statusCode, message))
                .build();
    }

    private static double roundToTenth(double value) {
        return Math.round(value * 10) / 10.0;
    }

    // ==================== DTOs ====================

    public record HealthStatus(String status, Instant timestamp, String version) {}

    public record ServerTime(
            Instant utc,
            @JsonProperty("unix_timestamp") long unixTimestamp,
            String formatted,
            String timezone
    ) {}

    public record Echo(
            @JsonProperty("original_message") String originalMessage,
            @JsonProperty("echoed_at") Instant echoedAt,
            int length
    ) {}

    public record Weather(
            String city,
            double temperature,
            String condition,
            int humidity,
            @JsonProperty("wind_speed") double windSpeed,
            Instant timestamp,
            String note
    ) {}
}
