package net.findmybook.googlebooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;

import java.util.List;

/**
 * Success envelope of {@code GET /books/v1/volumes}.
 *
 * @param kind resource kind, {@code books#volumes}
 * @param totalItems total matches reported by the service (not the size of {@code items})
 * @param items current page, absent when nothing matched
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VolumeResponse(
        @JsonProperty(value = "kind", required = true) String kind,
        @JsonProperty(value = "totalItems", required = true) int totalItems,
        @JsonProperty("items") @Nullable List<Volume> items) {

    /** Returns the items, or an empty list when the service omitted them. */
    public List<Volume> itemsOrEmpty() {
        return items == null ? List.of() : items;
    }
}
