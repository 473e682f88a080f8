package net.findmybook.googlebooks.exception;

/**
 * HTTP exchange with Google Books did not complete (network error, timeout, premature close).
 * RETRYABLE: Yes (transient network issues), but never retried by the client itself
 *
 * @author William Callahan
 */
public class GoogleBooksTransportException extends GoogleBooksException {

    private final String url;

    public GoogleBooksTransportException(String url, Throwable cause) {
        super(GoogleBooksErrorKind.TRANSPORT_ERROR,
              "Google Books request failed for " + url + ": " + (cause == null ? "unknown cause" : cause.getMessage()),
              cause);
        this.url = url;
    }

    /** Returns the request URL with the API key redacted. */
    public String getUrl() {
        return url;
    }
}
