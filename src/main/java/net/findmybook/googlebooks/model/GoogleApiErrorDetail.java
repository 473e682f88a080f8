package net.findmybook.googlebooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Body of the error envelope.
 *
 * @param code HTTP-style code reported by the service (0-65535)
 * @param message human-readable description
 * @param status canonical status name such as {@code RESOURCE_EXHAUSTED}
 * @param errors per-cause details, first entry carries the most specific reason
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleApiErrorDetail(
        @JsonProperty(value = "code", required = true) int code,
        @JsonProperty(value = "message", required = true) String message,
        @JsonProperty("status") @Nullable String status,
        @JsonProperty("errors") @Nullable List<GoogleApiErrorItem> errors) {

    public GoogleApiErrorDetail {
        if (code < 0 || code > 0xFFFF) {
            throw new IllegalArgumentException("Error code out of range: " + code);
        }
    }

    /** Reason of the first error item, or null when the envelope lists none. */
    @Nullable
    public String firstReason() {
        if (errors == null || errors.isEmpty()) {
            return null;
        }
        return errors.get(0).reason();
    }
}
