package net.findmybook.googlebooks.resolve;

import jakarta.annotation.Nullable;
import net.findmybook.googlebooks.exception.GoogleBooksApiException;
import net.findmybook.googlebooks.exception.GoogleBooksErrorKind;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of one Google Books round trip: either the decoded payload or a classified failure.
 * Success is all-or-nothing; a failure never carries a partial payload.
 *
 * @param <T> decoded payload type
 * @author William Callahan
 */
public sealed interface ResolvedResult<T> permits ResolvedResult.Success, ResolvedResult.Failure {

    static <T> ResolvedResult<T> success(T payload) {
        return new Success<>(payload);
    }

    static <T> ResolvedResult<T> failure(GoogleBooksErrorKind kind, String message) {
        return new Failure<>(kind, message, null);
    }

    static <T> ResolvedResult<T> failure(GoogleBooksErrorKind kind, RemoteApiErrorDetails details) {
        return new Failure<>(kind, details.message(), details);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /** Payload when successful, empty otherwise. */
    default Optional<T> toOptional() {
        if (this instanceof Success<T> success) {
            return Optional.of(success.payload());
        }
        return Optional.empty();
    }

    /** Transforms the payload of a success; failures pass through unchanged. */
    default <R> ResolvedResult<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.payload()));
        }
        Failure<T> failure = (Failure<T>) this;
        return new Failure<>(failure.kind(), failure.message(), failure.details());
    }

    /**
     * Returns the payload or throws a {@link GoogleBooksApiException} of the failure's kind.
     */
    default T orElseThrow() {
        if (this instanceof Success<T> success) {
            return success.payload();
        }
        Failure<T> failure = (Failure<T>) this;
        RemoteApiErrorDetails details = failure.details();
        throw new GoogleBooksApiException(
                failure.kind(),
                failure.message(),
                details == null ? null : details.code(),
                details == null ? null : details.reason());
    }

    record Success<T>(T payload) implements ResolvedResult<T> {
        public Success {
            Objects.requireNonNull(payload, "payload");
        }
    }

    /**
     * @param details envelope data for {@code RATE_LIMIT_EXCEEDED} and {@code REMOTE_API_ERROR}, null otherwise
     */
    record Failure<T>(GoogleBooksErrorKind kind, String message, @Nullable RemoteApiErrorDetails details)
            implements ResolvedResult<T> {
        public Failure {
            Objects.requireNonNull(kind, "kind");
            message = message == null || message.isBlank() ? kind.defaultMessage() : message;
        }
    }
}
