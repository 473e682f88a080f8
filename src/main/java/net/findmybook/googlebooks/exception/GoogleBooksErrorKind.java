package net.findmybook.googlebooks.exception;

/**
 * Classification of every failure the Google Books client can report.
 *
 * <p>The client never retries on its own. {@link #callerMayRetry()} only tells callers
 * whether repeating the same request later can reasonably succeed.</p>
 *
 * @author William Callahan
 */
public enum GoogleBooksErrorKind {
    /** Malformed input to a query constructor, such as an empty seed. */
    INVALID_ARGUMENT("invalid_argument", "Invalid query argument", false),
    /** Configured base URL cannot produce a valid request URL. */
    URL_CONSTRUCTION_ERROR("url_construction_error", "Request URL could not be built", false),
    /** Network call did not complete (connect failure, timeout, reset). */
    TRANSPORT_ERROR("transport_error", "Google Books request did not complete", true),
    /** Body did not match the schema expected for its status class. */
    DESERIALIZATION_ERROR("deserialization_error", "Google Books response could not be decoded", false),
    /** Error envelope reported code 429. */
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", "Google Books quota exceeded", true),
    /** Any other non-success response carrying an error envelope. */
    REMOTE_API_ERROR("remote_api_error", "Google Books returned an error", false);

    private final String wireValue;
    private final String defaultMessage;
    private final boolean callerMayRetry;

    GoogleBooksErrorKind(String wireValue, String defaultMessage, boolean callerMayRetry) {
        this.wireValue = wireValue;
        this.defaultMessage = defaultMessage;
        this.callerMayRetry = callerMayRetry;
    }

    public String wireValue() {
        return wireValue;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean callerMayRetry() {
        return callerMayRetry;
    }
}
