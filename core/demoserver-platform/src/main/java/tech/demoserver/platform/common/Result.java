package tech.demoserver.platform.common;

import tech.demoserver.platform.common.errors.UseCaseError;

import java.util.function.Function;

/**
 * Result type for core operations.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - contains the successful result value</li>
 *   <li>{@link Failure} - contains the error details</li>
 * </ul>
 *
 * <p>Expected outcomes such as a duplicate username or an expired token are
 * returned as failures, never thrown. The API layer maps them to responses:
 * <pre>{@code
 * if (result instanceof Result.Failure<AccountView> f) {
 *     return ErrorResponses.toResponse(f.error());
 * }
 * return Response.ok(result.orElseThrow()).build();
 * }</pre>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    boolean isSuccess();
    boolean isFailure();

    /**
     * Successful result containing the value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(UseCaseError error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(UseCaseError error) {
        return new Failure<>(error);
    }

    /**
     * Transform the success value, passing failures through untouched.
     */
    default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Success<T> s) {
            return success(mapper.apply(s.value()));
        }
        return failure(((Failure<T>) this).error());
    }

    /**
     * Chain another operation that itself may fail.
     */
    default <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        if (this instanceof Success<T> s) {
            return mapper.apply(s.value());
        }
        return failure(((Failure<T>) this).error());
    }

    /**
     * The success value.
     *
     * @throws IllegalStateException if this is a failure
     */
    default T orElseThrow() {
        if (this instanceof Success<T> s) {
            return s.value();
        }
        UseCaseError error = ((Failure<T>) this).error();
        throw new IllegalStateException("Result is a failure: " + error.code() + " - " + error.message());
    }

    /**
     * The error, or {@code null} for a success.
     */
    default UseCaseError errorOrNull() {
        return this instanceof Failure<T> f ? f.error() : null;
    }
}
