package tech.demoserver.app;

import io.quarkus.vertx.http.runtime.filters.Filters;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * CORS filter for the API, driven by {@link CorsConfig}.
 *
 * Features:
 * - Only applies to /api/ and /files/ paths
 * - Answers preflight (OPTIONS) requests directly with 204
 * - Requests from unknown origins pass through without CORS headers
 */
@ApplicationScoped
public class CorsFilter {

    private static final Logger LOG = Logger.getLogger(CorsFilter.class);

    @Inject
    CorsConfig corsConfig;

    public void registerFilter(@Observes Filters filters) {
        filters.register(rc -> {
            HttpServerRequest request = rc.request();
            HttpServerResponse response = rc.response();
            String path = request.path();

            if (!path.startsWith("/api/") && !path.startsWith("/files/")) {
                rc.next();
                return;
            }

            String origin = request.getHeader("Origin");

            // No Origin header = same-origin request
            if (origin == null || origin.isBlank()) {
                rc.next();
                return;
            }

            if (!isOriginAllowed(origin)) {
                LOG.debugf("CORS rejected origin: %s for path: %s", origin, path);
                // Browser blocks the response without CORS headers
                rc.next();
                return;
            }

            response.putHeader("Access-Control-Allow-Origin", origin);
            response.putHeader("Access-Control-Allow-Credentials", "true");
            response.putHeader("Vary", "Origin");

            if (request.method() == HttpMethod.OPTIONS) {
                response.putHeader("Access-Control-Allow-Methods", "GET, POST, PUT, DELETE, PATCH, OPTIONS");
                response.putHeader("Access-Control-Allow-Headers",
                    "Content-Type, Authorization, Accept, X-Requested-With");
                response.putHeader("Access-Control-Max-Age", "86400"); // 24 hours

                response.setStatusCode(204).end();
                return;
            }

            rc.next();
        }, 8000);

        LOG.infof("CORS filter registered for origins: %s", corsConfig.allowedOrigins());
    }

    boolean isOriginAllowed(String origin) {
        return corsConfig.allowedOrigins().contains(origin) || corsConfig.allowedOrigins().contains("*");
    }
}
