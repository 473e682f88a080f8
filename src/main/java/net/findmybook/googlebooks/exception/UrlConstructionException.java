package net.findmybook.googlebooks.exception;

/**
 * Base URL configuration cannot be turned into a request URL.
 * RETRYABLE: No (configuration bug)
 *
 * @author William Callahan
 */
public class UrlConstructionException extends GoogleBooksException {

    private final String baseUrl;

    public UrlConstructionException(String baseUrl, String reason) {
        this(baseUrl, reason, null);
    }

    public UrlConstructionException(String baseUrl, String reason, Throwable cause) {
        super(GoogleBooksErrorKind.URL_CONSTRUCTION_ERROR,
              "Cannot build Google Books URL from base '" + baseUrl + "': " + reason, cause);
        this.baseUrl = baseUrl;
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}
