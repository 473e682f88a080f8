package net.findmybook.googlebooks.exception;

import jakarta.annotation.Nullable;

/**
 * Thrown when a caller unwraps a failed {@code ResolvedResult}.
 * Remote failures keep the envelope code and reason for programmatic handling.
 *
 * @author William Callahan
 */
public class GoogleBooksApiException extends GoogleBooksException {

    @Nullable
    private final Integer code;

    @Nullable
    private final String reason;

    public GoogleBooksApiException(GoogleBooksErrorKind kind, String message, @Nullable Integer code, @Nullable String reason) {
        super(kind, message, null);
        this.code = code;
        this.reason = reason;
    }

    /** Envelope code, or null when the failure did not come from an error envelope. */
    @Nullable
    public Integer getCode() {
        return code;
    }

    /** First machine-readable reason from the envelope, when present. */
    @Nullable
    public String getReason() {
        return reason;
    }
}
