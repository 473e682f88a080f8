package net.findmybook.googlebooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Descriptive metadata of a volume.
 *
 * <p>{@code printType} is the only field with a substituted default: a missing value
 * decodes to the empty string. Everything else stays null when absent.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VolumeInfo(
        @JsonProperty(value = "title", required = true) String title,
        @JsonProperty("subtitle") @Nullable String subtitle,
        @JsonProperty("authors") @Nullable List<String> authors,
        @JsonProperty("publisher") @Nullable String publisher,
        @JsonProperty("publishedDate") @Nullable String publishedDate,
        @JsonProperty("description") @Nullable String description,
        @JsonProperty("industryIdentifiers") @Nullable List<IndustryIdentifier> industryIdentifiers,
        @JsonProperty("pageCount") @Nullable Integer pageCount,
        @JsonProperty("printType") String printType,
        @JsonProperty("categories") @Nullable List<String> categories,
        @JsonProperty("imageLinks") @Nullable ImageLinks imageLinks) {

    static final String DEFAULT_PRINT_TYPE = "";

    public VolumeInfo {
        if (printType == null) {
            printType = DEFAULT_PRINT_TYPE;
        }
    }

    /**
     * Finds the identifier of the given type, e.g. {@code ISBN_13}.
     */
    public Optional<String> identifier(String type) {
        if (industryIdentifiers == null || type == null) {
            return Optional.empty();
        }
        return industryIdentifiers.stream()
                .filter(id -> type.equalsIgnoreCase(id.type()))
                .map(IndustryIdentifier::identifier)
                .findFirst();
    }
}
