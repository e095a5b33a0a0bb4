package net.linkcoverage.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlUtilsTest {

    @Test
    void should_LowercaseHostAndDropDefaultPortAndTrailingSlash_When_Normalizing() {
        assertThat(UrlUtils.normalize("HTTPS://Example.com:443/Blog/")).isEqualTo("https://example.com/Blog");
        assertThat(UrlUtils.normalize("http://example.com:80/")).isEqualTo("http://example.com");
        assertThat(UrlUtils.normalize("http://example.com:8080/a")).isEqualTo("http://example.com:8080/a");
    }

    @Test
    void should_DropFragmentAndKeepQuery_When_Normalizing() {
        assertThat(UrlUtils.normalize("https://example.com/page/?id=7#section"))
            .isEqualTo("https://example.com/page?id=7");
    }

    @Test
    void should_AssumeHttp_When_SchemeMissing() {
        assertThat(UrlUtils.normalize("example.com/")).isEqualTo("http://example.com");
    }

    @Test
    void should_ReturnNull_When_UrlIsNotHttp() {
        assertThat(UrlUtils.normalize("ftp://example.com")).isNull();
        assertThat(UrlUtils.normalize("   ")).isNull();
        assertThat(UrlUtils.normalize(null)).isNull();
        assertThat(UrlUtils.isHttpUrl("ftp://files.example.com/report.csv")).isFalse();
    }

    @Test
    void should_StripWww_When_ExtractingDomain() {
        assertThat(UrlUtils.extractDomain("https://WWW.Example.com/path")).isEqualTo("example.com");
        assertThat(UrlUtils.normalizeDomain("Example.com")).isEqualTo("example.com");
    }

    @Test
    void should_MatchSubdomainsButNotLookalikes_When_ComparingHostToDomain() {
        assertThat(UrlUtils.hostMatchesDomain("news.spam.com", "spam.com")).isTrue();
        assertThat(UrlUtils.hostMatchesDomain("spam.com", "spam.com")).isTrue();
        assertThat(UrlUtils.hostMatchesDomain("notspam.com", "spam.com")).isFalse();
        assertThat(UrlUtils.hostMatchesDomain(null, "spam.com")).isFalse();
    }

    @Test
    void should_TreatTrailingSlashAndWwwAsSameResource_When_ComparingUrls() {
        assertThat(UrlUtils.sameResource("https://www.example.com/page/", "http://example.com/page")).isTrue();
        assertThat(UrlUtils.sameResource("https://example.com/page", "https://example.com/other")).isFalse();
        assertThat(UrlUtils.pathOf("https://example.com/")).isEmpty();
    }
}
