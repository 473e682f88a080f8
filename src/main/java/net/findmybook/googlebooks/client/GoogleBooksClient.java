/**
 * Entry point for calling the Google Books volumes API.
 * Composes URL building, one HTTP GET and response resolution:
 * - {@link #search(VolumeQuery)} for {@code /books/v1/volumes?q=...}
 * - {@link #fetchById(String)} for {@code /books/v1/volumes/{id}}
 *
 * Configuration (base URL, API key) is fixed at construction, so one instance can serve
 * concurrent callers. Nothing is cached or retried.
 *
 * @author William Callahan
 */
package net.findmybook.googlebooks.client;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.findmybook.googlebooks.exception.InvalidVolumeQueryException;
import net.findmybook.googlebooks.model.Volume;
import net.findmybook.googlebooks.model.VolumeResponse;
import net.findmybook.googlebooks.query.VolumeQuery;
import net.findmybook.googlebooks.query.VolumeUrlBuilder;
import net.findmybook.googlebooks.resolve.ResolvedResult;
import net.findmybook.googlebooks.resolve.ResponseResolver;
import net.findmybook.googlebooks.transport.TransportResponse;
import net.findmybook.googlebooks.transport.VolumeTransport;
import net.findmybook.googlebooks.util.ExternalApiLogger;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.ToIntFunction;

@Slf4j
public class GoogleBooksClient {

    private static final String SEARCH_OPERATION = "SEARCH_VOLUMES";
    private static final String FETCH_OPERATION = "FETCH_VOLUME";

    private final VolumeTransport transport;
    private final ResponseResolver resolver;
    private final String baseUrl;

    @Nullable
    private final String apiKey;

    /**
     * Creates an unauthenticated client for the public Google APIs host.
     */
    public GoogleBooksClient(VolumeTransport transport, ResponseResolver resolver) {
        this(transport, resolver, VolumeUrlBuilder.DEFAULT_BASE_URL, null);
    }

    /**
     * @param transport HTTP collaborator
     * @param resolver response classifier
     * @param baseUrl service root; null or blank falls back to {@link VolumeUrlBuilder#DEFAULT_BASE_URL}
     * @param apiKey optional API key, blank treated as absent
     */
    public GoogleBooksClient(VolumeTransport transport,
                             ResponseResolver resolver,
                             @Nullable String baseUrl,
                             @Nullable String apiKey) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.baseUrl = (baseUrl == null || baseUrl.isBlank()) ? VolumeUrlBuilder.DEFAULT_BASE_URL : baseUrl.trim();
        this.apiKey = (apiKey == null || apiKey.isBlank()) ? null : apiKey.trim();
    }

    /**
     * Searches volumes.
     *
     * @param query search criteria
     * @return cold publisher emitting exactly one result; errors only for invalid input,
     *         URL construction and transport failures
     */
    public Mono<ResolvedResult<VolumeResponse>> search(VolumeQuery query) {
        if (query == null) {
            return Mono.error(new InvalidVolumeQueryException("Query must not be null"));
        }
        return Mono.defer(() -> {
            String url = VolumeUrlBuilder.buildSearchUrl(query, baseUrl, apiKey);
            return execute(SEARCH_OPERATION, query.term(), url, resolver::resolveSearch,
                    response -> response.itemsOrEmpty().size());
        });
    }

    /**
     * Fetches one volume by its Google Books ID (e.g. {@code zyTCAlFPjgYC}).
     *
     * @param volumeId opaque, non-blank volume ID
     */
    public Mono<ResolvedResult<Volume>> fetchById(String volumeId) {
        return Mono.defer(() -> {
            String url = VolumeUrlBuilder.buildVolumeUrl(volumeId, baseUrl, apiKey);
            return execute(FETCH_OPERATION, volumeId, url, resolver::resolveVolume, volume -> 1);
        });
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public boolean isApiKeyAvailable() {
        return apiKey != null;
    }

    private <T> Mono<ResolvedResult<T>> execute(String operation,
                                               String target,
                                               String url,
                                               BiFunction<Integer, byte[], ResolvedResult<T>> resolve,
                                               ToIntFunction<T> resultCount) {
        ExternalApiLogger.logHttpRequest(log, operation, "GET", url, apiKey != null);
        return transport.get(url)
                .doOnNext(response -> ExternalApiLogger.logHttpResponse(
                        log, operation, response.statusCode(), url, response.bodySize()))
                .map(response -> resolveResponse(response, resolve))
                .doOnNext(result -> logOutcome(operation, target, result, resultCount));
    }

    private static <T> ResolvedResult<T> resolveResponse(TransportResponse response,
                                                         BiFunction<Integer, byte[], ResolvedResult<T>> resolve) {
        return resolve.apply(response.statusCode(), response.body());
    }

    private static <T> void logOutcome(String operation, String target, ResolvedResult<T> result, ToIntFunction<T> resultCount) {
        if (result instanceof ResolvedResult.Success<T> success) {
            ExternalApiLogger.logApiCallSuccess(log, operation, target, resultCount.applyAsInt(success.payload()));
        } else if (result instanceof ResolvedResult.Failure<T> failure) {
            ExternalApiLogger.logApiCallFailure(log, operation, target, failure.kind().wireValue(), failure.message());
        }
    }
}
