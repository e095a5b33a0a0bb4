package net.linkcoverage.service.content;

import java.util.List;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.model.MonitoringStatus;
import net.linkcoverage.service.content.PageContentAnalyzer.CampaignMention;
import net.linkcoverage.service.content.PageContentAnalyzer.KeywordPlacement;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PageContentAnalyzerTest {

    private final PageContentAnalyzer analyzer = new PageContentAnalyzer();

    @Test
    void should_ExtractStructureAndDropBoilerplate_When_Parsing() {
        PageContent page = analyzer.parse(ContentVerificationServiceTest.COVERAGE_PAGE, "https://news.site/coverage");

        assertThat(page.title()).isEqualTo("Acme Rocket Skates review");
        assertThat(page.metaDescription()).isEqualTo("Hands-on with the new acme skates");
        assertThat(page.headings()).containsExactly("Acme rocket skates tested");
        assertThat(page.outboundLinkCount()).isEqualTo(4);
        assertThat(page.bodyText()).doesNotContain("var tracking").doesNotContain("Home");
    }

    @Test
    void should_RecordWhereKeywordAppears_When_AnalyzingKeywords() {
        PageContent page = analyzer.parse(ContentVerificationServiceTest.COVERAGE_PAGE, "https://news.site/coverage");

        List<KeywordPlacement> placements = analyzer.analyzeKeywords(page, List.of("acme", "jetpack", " "));

        assertThat(placements).hasSize(2);
        KeywordPlacement acme = placements.get(0);
        assertThat(acme.inTitle()).isTrue();
        assertThat(acme.inHeadings()).isTrue();
        assertThat(acme.inMeta()).isTrue();
        assertEquals(1.0, acme.score(), 0.0001);
        assertEquals(0.0, placements.get(1).score(), 0.0001);
    }

    @Test
    void should_CountCampaignIdentityMentions_When_Present() {
        PageContent page = analyzer.parse(ContentVerificationServiceTest.COVERAGE_PAGE, "https://news.site/coverage");
        Campaign campaign = new Campaign("c-1", "alice@example.com", "Acme", "Rocket Skates", "acme.io", null,
            null, MonitoringStatus.ACTIVE, List.of(), List.of(), List.of());

        List<CampaignMention> mentions = analyzer.findMentions(page, campaign);

        assertThat(mentions).extracting(CampaignMention::type)
            .containsExactly("campaign_name", "client_name", "client_domain");
    }

    @Test
    void should_ScoreOnlyQuality_When_NoKeywordsOrMentions() {
        PageContent page = analyzer.parse(ContentVerificationServiceTest.UNRELATED_PAGE, "https://news.site/weather");

        double score = analyzer.score(List.of(), List.of(), page);

        assertEquals(0.06, score, 0.0001);
    }
}
