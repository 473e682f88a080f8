package net.findmybook.googlebooks.client;

import net.findmybook.googlebooks.exception.GoogleBooksErrorKind;
import net.findmybook.googlebooks.exception.GoogleBooksTransportException;
import net.findmybook.googlebooks.exception.InvalidVolumeQueryException;
import net.findmybook.googlebooks.exception.UrlConstructionException;
import net.findmybook.googlebooks.model.Volume;
import net.findmybook.googlebooks.model.VolumeResponse;
import net.findmybook.googlebooks.query.VolumeQuery;
import net.findmybook.googlebooks.resolve.RemoteApiErrorDetails;
import net.findmybook.googlebooks.resolve.ResolvedResult;
import net.findmybook.googlebooks.resolve.ResponseResolver;
import net.findmybook.googlebooks.transport.TransportResponse;
import net.findmybook.googlebooks.transport.VolumeTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import tools.jackson.databind.json.JsonMapper;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GoogleBooksClientTest {

    private static final String SEARCH_BODY = """
        {"kind":"books#volumes","totalItems":1,
         "items":[{"id":"zyTCAlFPjgYC","etag":"f0zKg75Mx/I","volumeInfo":{"title":"The Google Story"}}]}
        """;

    @Mock
    private VolumeTransport transport;

    private ResponseResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ResponseResolver(JsonMapper.builder().build());
    }

    @Test
    void searchBuildsUrlWithKeyAndResolvesSuccess() {
        String expectedUrl = "https://www.googleapis.com/books/v1/volumes?q=isbn%3A9782348054693&maxResults=5&key=abc";
        when(transport.get(expectedUrl)).thenReturn(Mono.just(response(200, SEARCH_BODY)));
        GoogleBooksClient client = new GoogleBooksClient(transport, resolver, null, " abc ");

        StepVerifier.create(client.search(VolumeQuery.isbn("9782348054693").withMaxResults(5)))
            .assertNext(result -> {
                VolumeResponse response = result.orElseThrow();
                assertThat(response.totalItems()).isEqualTo(1);
                assertThat(response.itemsOrEmpty()).extracting(Volume::id).containsExactly("zyTCAlFPjgYC");
            })
            .verifyComplete();

        verify(transport, times(1)).get(expectedUrl);
    }

    @Test
    void searchWithoutKeyUsesConfiguredBaseUrl() {
        String expectedUrl = "http://localhost:9999/books/v1/volumes?q=intitle%3ADune";
        when(transport.get(expectedUrl)).thenReturn(Mono.just(response(200, SEARCH_BODY)));
        GoogleBooksClient client = new GoogleBooksClient(transport, resolver, "http://localhost:9999/", "");

        assertThat(client.isApiKeyAvailable()).isFalse();
        StepVerifier.create(client.search(VolumeQuery.title("Dune")))
            .assertNext(result -> assertThat(result.isSuccess()).isTrue())
            .verifyComplete();
    }

    @Test
    void rateLimitResponseIsClassified() {
        when(transport.get(anyString()))
            .thenReturn(Mono.just(response(429, "{\"error\":{\"code\":429,\"message\":\"Quota exceeded\"}}")));
        GoogleBooksClient client = new GoogleBooksClient(transport, resolver);

        StepVerifier.create(client.search(VolumeQuery.of("dune")))
            .assertNext(result -> assertThat(result)
                .isEqualTo(new ResolvedResult.Failure<VolumeResponse>(
                    GoogleBooksErrorKind.RATE_LIMIT_EXCEEDED,
                    "Quota exceeded",
                    new RemoteApiErrorDetails(429, "Quota exceeded", null, null, 429))))
            .verifyComplete();
    }

    @Test
    void fetchByIdResolvesSingleVolume() {
        String expectedUrl = "https://www.googleapis.com/books/v1/volumes/zyTCAlFPjgYC";
        when(transport.get(expectedUrl)).thenReturn(Mono.just(response(200,
            "{\"id\":\"zyTCAlFPjgYC\",\"etag\":\"e\",\"volumeInfo\":{\"title\":\"The Google Story\"}}")));
        GoogleBooksClient client = new GoogleBooksClient(transport, resolver);

        StepVerifier.create(client.fetchById("zyTCAlFPjgYC"))
            .assertNext(result -> assertThat(result.orElseThrow().volumeInfo().title()).isEqualTo("The Google Story"))
            .verifyComplete();
    }

    @Test
    void fetchByIdNotFoundIsRemoteApiError() {
        when(transport.get(anyString()))
            .thenReturn(Mono.just(response(404, "{\"error\":{\"code\":404,\"message\":\"Not Found\"}}")));
        GoogleBooksClient client = new GoogleBooksClient(transport, resolver);

        StepVerifier.create(client.fetchById("missing"))
            .assertNext(result -> {
                assertThat(result).isInstanceOf(ResolvedResult.Failure.class);
                ResolvedResult.Failure<Volume> failure = (ResolvedResult.Failure<Volume>) result;
                assertThat(failure.kind()).isEqualTo(GoogleBooksErrorKind.REMOTE_API_ERROR);
                assertThat(failure.details().reason()).isNull();
            })
            .verifyComplete();
    }

    @Test
    void transportFailureIsSurfacedNotRetried() {
        when(transport.get(anyString())).thenReturn(Mono.error(
            new GoogleBooksTransportException("https://www.googleapis.com/books/v1/volumes?q=dune", new SocketTimeoutException("timeout"))));
        GoogleBooksClient client = new GoogleBooksClient(transport, resolver);

        StepVerifier.create(client.search(VolumeQuery.of("dune")))
            .expectError(GoogleBooksTransportException.class)
            .verify();

        verify(transport, times(1)).get(anyString());
    }

    @Test
    void invalidInputFailsBeforeAnyRequest() {
        GoogleBooksClient client = new GoogleBooksClient(transport, resolver);

        StepVerifier.create(client.search(null))
            .expectError(InvalidVolumeQueryException.class)
            .verify();
        StepVerifier.create(client.fetchById(" "))
            .expectError(InvalidVolumeQueryException.class)
            .verify();

        verify(transport, never()).get(anyString());
    }

    @Test
    void badBaseUrlSurfacesAsUrlConstructionError() {
        GoogleBooksClient client = new GoogleBooksClient(transport, resolver, "not a url", null);

        StepVerifier.create(client.search(VolumeQuery.of("dune")))
            .expectError(UrlConstructionException.class)
            .verify();

        verify(transport, never()).get(anyString());
    }

    @Test
    void nothingIsSentUntilSubscription() {
        GoogleBooksClient client = new GoogleBooksClient(transport, resolver);

        client.search(VolumeQuery.of("dune"));
        client.fetchById("zyTCAlFPjgYC");

        verify(transport, never()).get(anyString());
    }

    private static TransportResponse response(int status, String body) {
        return new TransportResponse(status, body.getBytes(StandardCharsets.UTF_8));
    }
}
