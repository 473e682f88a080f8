package net.findmybook.googlebooks.query;

import jakarta.annotation.Nullable;
import net.findmybook.googlebooks.exception.InvalidVolumeQueryException;
import net.findmybook.googlebooks.exception.UrlConstructionException;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds request URLs for the Google Books volumes endpoints.
 *
 * <p>Parameters are always emitted in the same order: {@code q}, {@code maxResults},
 * {@code startIndex}, {@code langRestrict}, {@code projection}, {@code printType},
 * {@code key}. Values go through URI-variable expansion so every reserved character is
 * percent-encoded ({@code isbn:123} becomes {@code isbn%3A123}).</p>
 *
 * <p>{@code printType} has its own parameter name. Older clients sent it under
 * {@code projection}, which the service reads as an invalid projection.</p>
 */
public final class VolumeUrlBuilder {

    /** Public Google APIs root used when no base URL is configured. */
    public static final String DEFAULT_BASE_URL = "https://www.googleapis.com";

    static final String VOLUMES_PATH = "/books/v1/volumes";

    private VolumeUrlBuilder() {
        // Utility class
    }

    /**
     * Builds {@code <baseUrl>/books/v1/volumes?q=...} for a search.
     *
     * @param query search criteria
     * @param baseUrl service root, trailing slashes tolerated
     * @param apiKey optional key, omitted when null or blank
     * @return the encoded URL
     * @throws UrlConstructionException when {@code baseUrl} has no scheme or host
     */
    public static String buildSearchUrl(VolumeQuery query, String baseUrl, @Nullable String apiKey) {
        Objects.requireNonNull(query, "query");
        UriComponentsBuilder builder = baseBuilder(baseUrl).path(VOLUMES_PATH);
        Map<String, Object> values = new LinkedHashMap<>();

        addParam(builder, values, "q", query.term());
        if (query.maxResults() != null) {
            addParam(builder, values, "maxResults", query.maxResults());
        }
        if (query.startIndex() != null) {
            addParam(builder, values, "startIndex", query.startIndex());
        }
        if (query.languageRestrict() != null) {
            addParam(builder, values, "langRestrict", query.languageRestrict());
        }
        if (query.projection() != null) {
            addParam(builder, values, "projection", query.projection().wireValue());
        }
        if (query.printType() != null) {
            addParam(builder, values, "printType", query.printType().wireValue());
        }
        addKey(builder, values, apiKey);

        return expand(builder, values, baseUrl);
    }

    /**
     * Builds {@code <baseUrl>/books/v1/volumes/<volumeId>}. The ID is encoded as a single
     * path segment.
     *
     * @throws InvalidVolumeQueryException when {@code volumeId} is null or blank
     */
    public static String buildVolumeUrl(String volumeId, String baseUrl, @Nullable String apiKey) {
        if (volumeId == null || volumeId.isBlank()) {
            throw new InvalidVolumeQueryException("Volume ID must not be blank");
        }
        UriComponentsBuilder builder = baseBuilder(baseUrl)
                .path(VOLUMES_PATH)
                .pathSegment("{volumeId}");
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("volumeId", volumeId);
        addKey(builder, values, apiKey);
        return expand(builder, values, baseUrl);
    }

    private static UriComponentsBuilder baseBuilder(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new UrlConstructionException(String.valueOf(baseUrl), "base URL is blank");
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }

        UriComponents parsed;
        try {
            parsed = UriComponentsBuilder.fromUriString(trimmed).build();
        } catch (IllegalArgumentException e) {
            throw new UrlConstructionException(baseUrl, e.getMessage(), e);
        }
        if (parsed.getScheme() == null || parsed.getHost() == null || parsed.getHost().isEmpty()) {
            throw new UrlConstructionException(baseUrl, "scheme and host are required");
        }
        if (parsed.getQuery() != null || parsed.getFragment() != null) {
            throw new UrlConstructionException(baseUrl, "query and fragment are not allowed");
        }
        return UriComponentsBuilder.fromUriString(trimmed);
    }

    private static void addParam(UriComponentsBuilder builder, Map<String, Object> values, String name, Object value) {
        builder.queryParam(name, "{" + name + "}");
        values.put(name, value);
    }

    private static void addKey(UriComponentsBuilder builder, Map<String, Object> values, @Nullable String apiKey) {
        if (apiKey != null && !apiKey.isBlank()) {
            addParam(builder, values, "key", apiKey.trim());
        }
    }

    private static String expand(UriComponentsBuilder builder, Map<String, Object> values, String baseUrl) {
        try {
            return builder.encode().buildAndExpand(values).toUriString();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new UrlConstructionException(baseUrl, e.getMessage(), e);
        }
    }
}
