package net.findmybook.googlebooks.exception;

/**
 * Query input rejected before any request was built (blank seed, blank volume ID).
 * RETRYABLE: No (same input fails again)
 *
 * @author William Callahan
 */
public class InvalidVolumeQueryException extends GoogleBooksException {
    public InvalidVolumeQueryException(String message) {
        super(GoogleBooksErrorKind.INVALID_ARGUMENT, message, null);
    }
}
