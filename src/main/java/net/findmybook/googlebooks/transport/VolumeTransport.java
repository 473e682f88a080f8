package net.findmybook.googlebooks.transport;

import reactor.core.publisher.Mono;

/**
 * Performs a single HTTP GET against Google Books.
 *
 * <p>Implementations must emit a {@link TransportResponse} for every HTTP status, including
 * 4xx and 5xx, and signal an error only when the exchange itself fails. They must not retry.</p>
 */
public interface VolumeTransport {

    /**
     * @param url fully built request URL
     * @return cold publisher of the response; errors with
     *         {@link net.findmybook.googlebooks.exception.GoogleBooksTransportException}
     */
    Mono<TransportResponse> get(String url);
}
