package net.findmybook.googlebooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleApiErrorItem(
        @JsonProperty(value = "message", required = true) String message,
        @JsonProperty(value = "domain", required = true) String domain,
        @JsonProperty(value = "reason", required = true) String reason) {
}
