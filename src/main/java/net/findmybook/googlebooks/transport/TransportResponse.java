package net.findmybook.googlebooks.transport;

import java.util.Arrays;

/**
 * Status code and raw body of a completed HTTP exchange.
 * The body is copied on the way in and out so instances stay immutable.
 */
public record TransportResponse(int statusCode, byte[] body) {

    public TransportResponse {
        body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public int bodySize() {
        return body.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TransportResponse that)) {
            return false;
        }
        return statusCode == that.statusCode && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(statusCode) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "TransportResponse[statusCode=" + statusCode + ", bodySize=" + body.length + "]";
    }
}
