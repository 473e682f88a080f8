/**
 * Immutable search criteria for the Google Books volumes endpoint.
 * Builds the {@code q} term from field predicates and carries the optional paging,
 * language, projection and print-type options.
 *
 * <p>Every {@code and*} and {@code with*} call returns a new instance, so two chains
 * started from the same query never see each other's changes:</p>
 *
 * <pre>{@code
 * VolumeQuery query = VolumeQuery.author("Victor Hugo")
 *     .withLanguageRestrict("fr")
 *     .withPrintType(PrintType.BOOKS)
 *     .withMaxResults(20);
 * }</pre>
 *
 * @author William Callahan
 */
package net.findmybook.googlebooks.query;

import jakarta.annotation.Nullable;
import net.findmybook.googlebooks.exception.InvalidVolumeQueryException;

public record VolumeQuery(String term,
                          @Nullable Integer maxResults,
                          @Nullable Integer startIndex,
                          @Nullable String languageRestrict,
                          @Nullable Projection projection,
                          @Nullable PrintType printType) {

    public VolumeQuery {
        if (term == null || term.isEmpty()) {
            throw new InvalidVolumeQueryException("Search term must not be empty");
        }
    }

    /**
     * Starts a query from a raw search string, e.g. {@code "the housemaid"} or a
     * pre-built {@code "intitle:dune inauthor:herbert"}.
     *
     * @param seed search text, must not be null or empty
     * @return a query with no options set
     */
    public static VolumeQuery of(String seed) {
        return new VolumeQuery(seed, null, null, null, null, null);
    }

    /**
     * Starts a query scoped to a single field.
     */
    public static VolumeQuery of(VolumeQueryField field, String value) {
        return of(field.predicate(requireValue(field, value)));
    }

    public static VolumeQuery isbn(String isbn) {
        return of(VolumeQueryField.ISBN, isbn);
    }

    public static VolumeQuery title(String title) {
        return of(VolumeQueryField.TITLE, title);
    }

    public static VolumeQuery author(String author) {
        return of(VolumeQueryField.AUTHOR, author);
    }

    public static VolumeQuery publisher(String publisher) {
        return of(VolumeQueryField.PUBLISHER, publisher);
    }

    public static VolumeQuery subject(String subject) {
        return of(VolumeQueryField.SUBJECT, subject);
    }

    public static VolumeQuery lccn(String lccn) {
        return of(VolumeQueryField.LCCN, lccn);
    }

    public static VolumeQuery oclc(String oclc) {
        return of(VolumeQueryField.OCLC, oclc);
    }

    /**
     * Appends {@code " <prefix>:<value>"} to the term. Predicates keep call order.
     */
    public VolumeQuery and(VolumeQueryField field, String value) {
        String appended = term + " " + field.predicate(requireValue(field, value));
        return new VolumeQuery(appended, maxResults, startIndex, languageRestrict, projection, printType);
    }

    public VolumeQuery andIsbn(String isbn) {
        return and(VolumeQueryField.ISBN, isbn);
    }

    public VolumeQuery andTitle(String title) {
        return and(VolumeQueryField.TITLE, title);
    }

    public VolumeQuery andAuthor(String author) {
        return and(VolumeQueryField.AUTHOR, author);
    }

    public VolumeQuery andPublisher(String publisher) {
        return and(VolumeQueryField.PUBLISHER, publisher);
    }

    public VolumeQuery andSubject(String subject) {
        return and(VolumeQueryField.SUBJECT, subject);
    }

    public VolumeQuery andLccn(String lccn) {
        return and(VolumeQueryField.LCCN, lccn);
    }

    public VolumeQuery andOclc(String oclc) {
        return and(VolumeQueryField.OCLC, oclc);
    }

    // Option values are passed through unvalidated; the service decides what a negative page size means.

    public VolumeQuery withMaxResults(int max) {
        return new VolumeQuery(term, max, startIndex, languageRestrict, projection, printType);
    }

    public VolumeQuery withStartIndex(int index) {
        return new VolumeQuery(term, maxResults, index, languageRestrict, projection, printType);
    }

    public VolumeQuery withLanguageRestrict(String languageCode) {
        return new VolumeQuery(term, maxResults, startIndex, languageCode, projection, printType);
    }

    public VolumeQuery withProjection(Projection newProjection) {
        return new VolumeQuery(term, maxResults, startIndex, languageRestrict, newProjection, printType);
    }

    public VolumeQuery withPrintType(PrintType newPrintType) {
        return new VolumeQuery(term, maxResults, startIndex, languageRestrict, projection, newPrintType);
    }

    /**
     * Builds the search URL without an API key.
     *
     * @param baseUrl service root, e.g. {@code https://www.googleapis.com}
     */
    public String buildUrl(String baseUrl) {
        return VolumeUrlBuilder.buildSearchUrl(this, baseUrl, null);
    }

    public String buildUrl(String baseUrl, @Nullable String apiKey) {
        return VolumeUrlBuilder.buildSearchUrl(this, baseUrl, apiKey);
    }

    private static String requireValue(VolumeQueryField field, String value) {
        if (value == null) {
            throw new InvalidVolumeQueryException("Value for '" + field.prefix() + "' must not be null");
        }
        return value;
    }
}
