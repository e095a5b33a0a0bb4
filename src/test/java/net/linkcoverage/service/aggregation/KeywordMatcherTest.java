package net.linkcoverage.service.aggregation;

import java.util.List;
import net.linkcoverage.service.aggregation.KeywordMatcher.KeywordMatch;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordMatcherTest {

    @Test
    void should_MatchCaseInsensitiveWholeWords_When_KeywordAppears() {
        KeywordMatch match = KeywordMatcher.of(List.of("Acme")).match("ACME launches new line (acme) today");

        assertThat(match.matched()).isTrue();
        assertThat(match.matchedKeywords()).containsExactly("acme");
        assertThat(match.occurrences()).isEqualTo(2);
    }

    @Test
    void should_NotMatch_When_KeywordIsPartOfLongerWord() {
        KeywordMatch match = KeywordMatcher.of(List.of("acme")).match("Visit acmeville and acme2000");

        assertThat(match.matched()).isFalse();
        assertThat(match).isSameAs(KeywordMatch.NONE);
    }

    @Test
    void should_MatchPhraseAcrossWhitespace_When_KeywordHasSeveralWords() {
        KeywordMatch match = KeywordMatcher.of(List.of("rocket skates")).match("New Rocket\n  Skates reviewed");

        assertThat(match.matchedKeywords()).containsExactly("rocket skates");
    }

    @Test
    void should_IgnoreBlankAndDuplicateKeywords_When_Building() {
        KeywordMatcher matcher = KeywordMatcher.of(List.of(" ", "Acme", "acme "));

        assertThat(matcher.isEmpty()).isFalse();
        assertThat(matcher.match("acme").matchedKeywords()).containsExactly("acme");
        assertThat(KeywordMatcher.of(null).isEmpty()).isTrue();
    }

    @Test
    void should_ReturnNone_When_TextIsBlank() {
        assertThat(KeywordMatcher.of(List.of("acme")).match("  ")).isEqualTo(KeywordMatch.NONE);
        assertThat(KeywordMatcher.of(List.of("acme")).match(null)).isEqualTo(KeywordMatch.NONE);
    }
}
