package tech.demoserver.platform.misc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches a random quote from an external service. Never fails: any
 * problem yields one of the fixed fallback quotes.
 */
@ApplicationScoped
public class QuoteClient {

    private static final Logger LOG = Logger.getLogger(QuoteClient.class);

    @ConfigProperty(name = "demoserver.quotes.url", defaultValue = "https://api.quotable.io/random")
    String quotesUrl;

    @ConfigProperty(name = "demoserver.quotes.timeout", defaultValue = "PT5S")
    Duration timeout;

    @Inject
    ObjectMapper objectMapper;

    private HttpClient httpClient;

    @PostConstruct
    void init() {
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
    }

    public Quote randomQuote() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(quotesUrl))
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                LOG.warnf("Quote service returned HTTP %d, using fallback", response.statusCode());
                return Quote.UNAVAILABLE;
            }
            return parse(response.body());
        } catch (IOException | IllegalArgumentException e) {
            LOG.warnf("Quote service unreachable (%s), using fallback", e.getMessage());
            return Quote.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Quote.FAILED;
        }
    }

    private Quote parse(String body) throws IOException {
        JsonNode json = objectMapper.readTree(body);
        JsonNode content = json.get("content");
        JsonNode author = json.get("author");
        if (content == null || !content.isTextual() || author == null || !author.isTextual()) {
            LOG.warn("Quote service response is missing content or author, using fallback");
            return Quote.FAILED;
        }

        List<String> tags = new ArrayList<>();
        json.path("tags").forEach(tag -> tags.add(tag.asText()));
        return new Quote(content.asText(), author.asText(), List.copyOf(tags));
    }
}
