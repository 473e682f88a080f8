package net.findmybook.googlebooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error envelope Google APIs return for non-success responses:
 * {@code {"error": {"code": 404, "message": "...", "status": "...", "errors": [...]}}}.
 *
 * @author William Callahan
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleApiError(@JsonProperty(value = "error", required = true) GoogleApiErrorDetail error) {

    public GoogleApiError {
        if (error == null) {
            throw new IllegalArgumentException("Error envelope has a null 'error' member");
        }
    }
}
