package tech.demoserver.platform.common.errors;

import java.util.Map;

/**
 * Why an operation failed.
 *
 * <p>Every variant carries a stable machine-readable {@code code}, a message
 * safe to show to the caller and optional structured {@code details}. Stores
 * and services return these inside a {@code Result}; only the HTTP layer
 * ({@code ErrorResponses}) turns a variant into a status code.
 */
public sealed interface UseCaseError
    permits UseCaseError.ValidationError,
            UseCaseError.BusinessRuleViolation,
            UseCaseError.NotFoundError,
            UseCaseError.AuthenticationError,
            UseCaseError.AuthorizationError {

    String code();

    String message();

    Map<String, Object> details();

    /** Bad input: weak password, negative price, disallowed file type. 400. */
    record ValidationError(String code, String message, Map<String, Object> details)
        implements UseCaseError {}

    /** Conflicts with existing state, e.g. a taken username or email. 409. */
    record BusinessRuleViolation(String code, String message, Map<String, Object> details)
        implements UseCaseError {}

    /** 404. */
    record NotFoundError(String code, String message, Map<String, Object> details)
        implements UseCaseError {}

    /** Missing, invalid or expired credentials. 401. */
    record AuthenticationError(String code, String message, Map<String, Object> details)
        implements UseCaseError {}

    /** Known caller, not allowed: inactive account or wrong role. 403. */
    record AuthorizationError(String code, String message, Map<String, Object> details)
        implements UseCaseError {}
}
