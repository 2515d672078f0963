package tech.demoserver.platform.authorization;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * JAX-RS filter that copies the bearer token from the Authorization header
 * into {@link AccessContext}. Validation happens lazily when a resource
 * declares its requirements.
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class AccessContextFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(AccessContextFilter.class);
    private static final String BEARER_PREFIX = "bearer ";

    @Inject
    AccessContext accessContext;

    @Override
    public void filter(ContainerRequestContext ctx) {
        String token = extractBearerToken(ctx.getHeaderString(HttpHeaders.AUTHORIZATION));
        if (token != null) {
            accessContext.setBearerToken(token);
            LOG.debugf("Bearer token present for path: %s", ctx.getUriInfo().getPath());
        }
    }

    /**
     * @return the token after a case-insensitive "Bearer " scheme, or null
     */
    static String extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.length() <= BEARER_PREFIX.length()) {
            return null;
        }
        if (!authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
