package net.findmybook.googlebooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Standard identifier of a volume (ISBN_10, ISBN_13, ISSN, OTHER).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndustryIdentifier(
        @JsonProperty(value = "identifier", required = true) String identifier,
        @JsonProperty(value = "type", required = true) String type) {
}
