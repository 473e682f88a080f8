package net.findmybook.googlebooks.util;

import java.util.regex.Pattern;
import org.slf4j.Logger;

/**
 * Console logging for outbound Google Books calls.
 *
 * <p>Every URL passes through {@link #redact(String)} first, so API keys never reach the logs.</p>
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";
    private static final String API_NAME = "GoogleBooks";
    private static final Pattern KEY_PARAM = Pattern.compile("([?&]key=)[^&#]*");

    private ExternalApiLogger() {
    }

    /**
     * Log an HTTP request about to be sent.
     */
    public static void logHttpRequest(Logger log, String operation, String method, String url, boolean authenticated) {
        String authType = authenticated ? "AUTHENTICATED" : "UNAUTHENTICATED";
        log.info(String.format("%s [%s] %s %s %s request to: %s",
            PREFIX, API_NAME, operation, authType, method, redact(url)));
    }

    /**
     * Log HTTP response status and size.
     */
    public static void logHttpResponse(Logger log, String operation, int statusCode, String url, int bodySize) {
        log.info(String.format("%s [%s] %s Response: status=%d, url=%s, bodySize=%d bytes",
            PREFIX, API_NAME, operation, statusCode, redact(url), bodySize));
    }

    /**
     * Log a resolved success.
     */
    public static void logApiCallSuccess(Logger log, String operation, String target, int resultCount) {
        log.info(String.format("%s [%s] SUCCESS: %s returned %d result(s) for '%s'",
            PREFIX, API_NAME, operation, resultCount, target));
    }

    /**
     * Log a classified failure.
     */
    public static void logApiCallFailure(Logger log, String operation, String target, String kind, String reason) {
        log.warn(String.format("%s [%s] FAILURE: %s %s for '%s' - %s",
            PREFIX, API_NAME, operation, kind, target, reason));
    }

    /**
     * Masks the value of any {@code key} query parameter.
     */
    public static String redact(String url) {
        if (url == null) {
            return null;
        }
        return KEY_PARAM.matcher(url).replaceAll("$1***");
    }
}
