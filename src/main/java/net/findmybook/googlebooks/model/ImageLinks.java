package net.findmybook.googlebooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;

/** Cover image links. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImageLinks(
        @JsonProperty("smallThumbnail") @Nullable String smallThumbnail,
        @JsonProperty("thumbnail") @Nullable String thumbnail) {
}
