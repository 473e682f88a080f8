package net.findmybook.googlebooks.exception;

import java.util.Objects;

/**
 * Base type for failures raised by the Google Books client.
 * Carries the {@link GoogleBooksErrorKind} so callers can branch without instanceof chains.
 *
 * @author William Callahan
 */
public abstract class GoogleBooksException extends RuntimeException {

    private final GoogleBooksErrorKind kind;

    protected GoogleBooksException(GoogleBooksErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public GoogleBooksErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.callerMayRetry();
    }
}
