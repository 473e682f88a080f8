package net.findmybook.googlebooks.resolve;

import lombok.extern.slf4j.Slf4j;
import net.findmybook.googlebooks.exception.GoogleBooksErrorKind;
import net.findmybook.googlebooks.model.GoogleApiError;
import net.findmybook.googlebooks.model.GoogleApiErrorDetail;
import net.findmybook.googlebooks.model.Volume;
import net.findmybook.googlebooks.model.VolumeResponse;
import net.findmybook.googlebooks.util.LoggingUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Turns a completed HTTP exchange into a {@link ResolvedResult}.
 *
 * <p>The status line alone picks the body schema: 2xx bodies are decoded as the success
 * payload, every other status as the Google error envelope. An envelope code of 429 maps to
 * {@link GoogleBooksErrorKind#RATE_LIMIT_EXCEEDED}; any other envelope to
 * {@link GoogleBooksErrorKind#REMOTE_API_ERROR}. Bodies that do not fit their schema map to
 * {@link GoogleBooksErrorKind#DESERIALIZATION_ERROR}.</p>
 *
 * <p>Stateless apart from the thread-safe {@link ObjectMapper}; safe to share.</p>
 *
 * @author William Callahan
 */
@Slf4j
public class ResponseResolver {

    static final int RATE_LIMIT_CODE = 429;

    private final ObjectMapper objectMapper;

    public ResponseResolver(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Resolves a search response.
     */
    public ResolvedResult<VolumeResponse> resolveSearch(int statusCode, byte[] body) {
        return resolve(statusCode, body, VolumeResponse.class);
    }

    /**
     * Resolves a single-volume response.
     */
    public ResolvedResult<Volume> resolveVolume(int statusCode, byte[] body) {
        return resolve(statusCode, body, Volume.class);
    }

    /**
     * Resolves any response whose success body decodes to {@code payloadType}.
     *
     * @param statusCode HTTP status code
     * @param body raw response body, null treated as empty
     * @param payloadType success payload schema
     * @return success, or a classified failure; never throws for a bad body
     */
    public <T> ResolvedResult<T> resolve(int statusCode, byte[] body, Class<T> payloadType) {
        Objects.requireNonNull(payloadType, "payloadType");
        byte[] bytes = body == null ? new byte[0] : body;

        if (isSuccessStatus(statusCode)) {
            return decodeSuccess(statusCode, bytes, payloadType);
        }

        GoogleApiError envelope;
        try {
            envelope = decode(bytes, GoogleApiError.class);
        } catch (JacksonException | IllegalArgumentException e) {
            LoggingUtils.warn(log, e, "Undecodable error envelope for HTTP status {}", statusCode);
            return ResolvedResult.failure(GoogleBooksErrorKind.DESERIALIZATION_ERROR,
                    "HTTP " + statusCode + " with undecodable error body: " + diagnostic(e));
        }

        GoogleApiErrorDetail error = envelope.error();
        RemoteApiErrorDetails details = new RemoteApiErrorDetails(
                error.code(), error.message(), error.firstReason(), error.status(), statusCode);
        if (error.code() == RATE_LIMIT_CODE) {
            log.warn("Google Books rate limit reported (HTTP {}): {}", statusCode, error.message());
            return ResolvedResult.failure(GoogleBooksErrorKind.RATE_LIMIT_EXCEEDED, details);
        }
        log.debug("Google Books error envelope: code={}, reason={}, message={}",
                error.code(), details.reason(), error.message());
        return ResolvedResult.failure(GoogleBooksErrorKind.REMOTE_API_ERROR, details);
    }

    private <T> ResolvedResult<T> decodeSuccess(int statusCode, byte[] bytes, Class<T> payloadType) {
        try {
            return ResolvedResult.success(decode(bytes, payloadType));
        } catch (JacksonException | IllegalArgumentException e) {
            LoggingUtils.warn(log, e, "Undecodable {} body for HTTP status {}", payloadType.getSimpleName(), statusCode);
            return ResolvedResult.failure(GoogleBooksErrorKind.DESERIALIZATION_ERROR, diagnostic(e));
        }
    }

    private <T> T decode(byte[] bytes, Class<T> type) {
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Empty response body");
        }
        T value = objectMapper.readValue(bytes, type);
        if (value == null) {
            throw new IllegalArgumentException("Response body decoded to null " + type.getSimpleName());
        }
        return value;
    }

    static boolean isSuccessStatus(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private static String diagnostic(Exception e) {
        if (e instanceof JacksonException jacksonException && jacksonException.getOriginalMessage() != null) {
            return jacksonException.getOriginalMessage();
        }
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
