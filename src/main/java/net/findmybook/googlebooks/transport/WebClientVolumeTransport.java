package net.findmybook.googlebooks.transport;

import lombok.extern.slf4j.Slf4j;
import net.findmybook.googlebooks.exception.GoogleBooksTransportException;
import net.findmybook.googlebooks.util.ExternalApiLogger;
import net.findmybook.googlebooks.util.LoggingUtils;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Objects;

/**
 * {@link VolumeTransport} backed by Spring's reactive {@link WebClient}.
 *
 * <p>Uses {@code exchangeToMono} rather than {@code retrieve()} so non-2xx responses come back
 * as data for the resolver instead of {@code WebClientResponseException}s. Connection,
 * timeout and premature-close failures are mapped to {@link GoogleBooksTransportException}.
 * No retries: one subscription, one request.</p>
 *
 * @author William Callahan
 */
@Slf4j
public class WebClientVolumeTransport implements VolumeTransport {

    private static final byte[] EMPTY_BODY = new byte[0];

    private final WebClient webClient;

    public WebClientVolumeTransport(WebClient webClient) {
        this.webClient = Objects.requireNonNull(webClient, "webClient");
    }

    @Override
    public Mono<TransportResponse> get(String url) {
        String safeUrl = ExternalApiLogger.redact(url);
        return Mono.defer(() -> webClient.get()
                        // URL is already encoded; URI keeps WebClient from encoding it twice
                        .uri(URI.create(url))
                        .accept(MediaType.APPLICATION_JSON)
                        .exchangeToMono(response -> response.bodyToMono(byte[].class)
                                .defaultIfEmpty(EMPTY_BODY)
                                .map(body -> new TransportResponse(response.statusCode().value(), body))))
                .doOnSubscribe(s -> log.debug("Fetching from Google Books: {}", safeUrl))
                .onErrorMap(e -> !(e instanceof GoogleBooksTransportException), e -> {
                    LoggingUtils.warn(log, e, "Google Books exchange failed for {}", safeUrl);
                    return new GoogleBooksTransportException(safeUrl, e);
                });
    }
}
