package tech.demoserver.platform.common.api;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import tech.demoserver.platform.common.errors.UseCaseError;

/**
 * Maps {@link UseCaseError} variants to HTTP responses.
 *
 * <ul>
 *   <li>ValidationError - 400</li>
 *   <li>AuthenticationError - 401 with {@code WWW-Authenticate: Bearer}</li>
 *   <li>AuthorizationError - 403</li>
 *   <li>NotFoundError - 404</li>
 *   <li>BusinessRuleViolation - 409</li>
 * </ul>
 */
public final class ErrorResponses {

    public static final String BEARER_CHALLENGE = "Bearer";

    private ErrorResponses() {}

    public static Response toResponse(UseCaseError error) {
        Response.Status status = statusOf(error);
        Response.ResponseBuilder builder = Response.status(status)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ApiResponses.ErrorResponse(error.code(), error.message(), error.details()));
        if (status == Response.Status.UNAUTHORIZED) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE);
        }
        return builder.build();
    }

    public static Response.Status statusOf(UseCaseError error) {
        if (error instanceof UseCaseError.ValidationError) {
            return Response.Status.BAD_REQUEST;
        }
        if (error instanceof UseCaseError.AuthenticationError) {
            return Response.Status.UNAUTHORIZED;
        }
        if (error instanceof UseCaseError.AuthorizationError) {
            return Response.Status.FORBIDDEN;
        }
        if (error instanceof UseCaseError.NotFoundError) {
            return Response.Status.NOT_FOUND;
        }
        if (error instanceof UseCaseError.BusinessRuleViolation) {
            return Response.Status.CONFLICT;
        }
        return Response.Status.INTERNAL_SERVER_ERROR;
    }
}
