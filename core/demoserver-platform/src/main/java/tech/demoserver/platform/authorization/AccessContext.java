package tech.demoserver.platform.authorization;

import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ForbiddenException;
import jakarta.ws.rs.NotAuthorizedException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import tech.demoserver.platform.common.Result;
import tech.demoserver.platform.common.api.ErrorResponses;
import tech.demoserver.platform.common.errors.UseCaseError;
import tech.demoserver.platform.principal.AccountView;

import java.util.Optional;

/**
 * Request-scoped holder of the caller's bearer token and, once checked, the
 * resolved principal.
 *
 * Populated by {@link AccessContextFilter}; resource methods call
 * {@link #require(AccessRequirement...)} before doing any work.
 */
@RequestScoped
public class AccessContext {

    @Inject
    AccessGuard accessGuard;

    private String bearerToken;
    private AccountView principal;

    public void setBearerToken(String bearerToken) {
        this.bearerToken = bearerToken;
    }

    /**
     * Resolve the principal and check it against {@code requirements}.
     *
     * @throws NotAuthorizedException (401) if the token is missing or invalid
     * @throws ForbiddenException (403) if a requirement is not met
     */
    public AccountView require(AccessRequirement... requirements) {
        Result<AccountView> result = accessGuard.require(bearerToken, requirements);
        if (result instanceof Result.Failure<AccountView> f) {
            throw toException(f.error());
        }
        principal = result.orElseThrow();
        return principal;
    }

    /**
     * The principal from the last successful {@link #require} call in this request.
     */
    public Optional<AccountView> currentPrincipal() {
        return Optional.ofNullable(principal);
    }

    private static WebApplicationException toException(UseCaseError error) {
        Response response = ErrorResponses.toResponse(error);
        if (response.getStatus() == Response.Status.UNAUTHORIZED.getStatusCode()) {
            return new NotAuthorizedException(response);
        }
        if (response.getStatus() == Response.Status.FORBIDDEN.getStatusCode()) {
            return new ForbiddenException(response);
        }
        return new WebApplicationException(response);
    }
}
