package net.findmybook.googlebooks.query;

import net.findmybook.googlebooks.exception.InvalidVolumeQueryException;
import net.findmybook.googlebooks.exception.UrlConstructionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URI;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VolumeUrlBuilderTest {

    private static final String BASE = "https://www.googleapis.com";

    @Test
    @DisplayName("isbn search with maxResults encodes the colon and keeps q first")
    void isbnSearchWithMaxResults() {
        String url = VolumeQuery.isbn("9782348054693").withMaxResults(5).buildUrl(BASE);

        assertThat(url).isEqualTo("https://www.googleapis.com/books/v1/volumes?q=isbn%3A9782348054693&maxResults=5");
    }

    @Test
    void minimalQueryHasOnlyQ() {
        String url = VolumeQuery.of("the housemaid").buildUrl(BASE);

        assertThat(url).isEqualTo("https://www.googleapis.com/books/v1/volumes?q=the%20housemaid");
        assertThat(URI.create(url).getQuery()).isEqualTo("q=the housemaid");
    }

    @Test
    @DisplayName("parameters follow the fixed order regardless of setter order")
    void parametersFollowFixedOrder() {
        VolumeQuery query = VolumeQuery.author("Victor Hugo")
            .withPrintType(PrintType.BOOKS)
            .withProjection(Projection.LITE)
            .withLanguageRestrict("fr")
            .withStartIndex(40)
            .withMaxResults(20);

        String url = VolumeUrlBuilder.buildSearchUrl(query, BASE, "secret-key");

        assertThat(parameterNames(url))
            .containsExactly("q", "maxResults", "startIndex", "langRestrict", "projection", "printType", "key");
        assertThat(url).contains("q=inauthor%3AVictor%20Hugo")
            .contains("maxResults=20")
            .contains("startIndex=40")
            .contains("langRestrict=fr")
            .contains("projection=lite")
            .contains("printType=books")
            .endsWith("key=secret-key");
    }

    @Test
    void printTypeUsesItsOwnParameterName() {
        String url = VolumeQuery.of("news").withPrintType(PrintType.MAGAZINES).buildUrl(BASE);

        assertThat(parameterNames(url)).containsExactly("q", "printType");
        assertThat(url).doesNotContain("projection");
    }

    @Test
    void negativeOptionsPassThrough() {
        String url = VolumeQuery.of("dune").withMaxResults(-1).buildUrl(BASE);

        assertThat(url).endsWith("maxResults=-1");
    }

    @Test
    void blankApiKeyIsOmitted() {
        assertThat(VolumeQuery.of("dune").buildUrl(BASE, "  ")).doesNotContain("key=");
        assertThat(VolumeQuery.of("dune").buildUrl(BASE, null)).doesNotContain("key=");
    }

    @Test
    void reservedCharactersInTermAreEncoded() {
        String url = VolumeQuery.title("Gastronomie & anarchisme").andAuthor("a+b=c").buildUrl(BASE);

        assertThat(url).contains("q=intitle%3AGastronomie%20%26%20anarchisme%20inauthor%3Aa%2Bb%3Dc");
        assertThat(parameterNames(url)).containsExactly("q");
    }

    @Test
    void buildUrlIsIdempotent() {
        VolumeQuery query = VolumeQuery.subject("Anarchism").withMaxResults(10).withProjection(Projection.FULL);

        assertThat(query.buildUrl(BASE, "k")).isEqualTo(query.buildUrl(BASE, "k"));
    }

    @Test
    void trailingSlashOnBaseIsTolerated() {
        assertThat(VolumeQuery.of("dune").buildUrl("http://localhost:8089/"))
            .isEqualTo("http://localhost:8089/books/v1/volumes?q=dune");
    }

    @Test
    void basePathIsPreserved() {
        assertThat(VolumeQuery.of("dune").buildUrl("http://proxy.internal/google"))
            .isEqualTo("http://proxy.internal/google/books/v1/volumes?q=dune");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "not a url", "www.googleapis.com", "https://www.googleapis.com?x=1"})
    void invalidBaseUrlFails(String base) {
        assertThatThrownBy(() -> VolumeQuery.of("dune").buildUrl(base))
            .isInstanceOf(UrlConstructionException.class);
    }

    @Test
    void volumeUrlEncodesIdAsPathSegment() {
        assertThat(VolumeUrlBuilder.buildVolumeUrl("zyTCAlFPjgYC", BASE, null))
            .isEqualTo("https://www.googleapis.com/books/v1/volumes/zyTCAlFPjgYC");
        assertThat(VolumeUrlBuilder.buildVolumeUrl("a/b c", BASE, "k"))
            .isEqualTo("https://www.googleapis.com/books/v1/volumes/a%2Fb%20c?key=k");
    }

    @Test
    void volumeUrlRejectsBlankId() {
        assertThatThrownBy(() -> VolumeUrlBuilder.buildVolumeUrl(" ", BASE, null))
            .isInstanceOf(InvalidVolumeQueryException.class);
    }

    private static List<String> parameterNames(String url) {
        String rawQuery = URI.create(url).getRawQuery();
        return Arrays.stream(rawQuery.split("&"))
            .map(pair -> pair.substring(0, pair.indexOf('=')))
            .toList();
    }
}
