package net.findmybook.googlebooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;

/**
 * A single catalog entry as returned by Google Books.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Volume(
        @JsonProperty(value = "id", required = true) String id,
        @JsonProperty(value = "etag", required = true) String etag,
        @JsonProperty("kind") @Nullable String kind,
        @JsonProperty("selfLink") @Nullable String selfLink,
        @JsonProperty(value = "volumeInfo", required = true) VolumeInfo volumeInfo) {
}
