package net.linkcoverage.service.content;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.service.aggregation.KeywordMatcher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Parses fetched HTML and scores how strongly a page covers a campaign.
 *
 * <p>The content score is 0..1: keyword placement weighs 0.4, campaign mentions 0.3 and page
 * quality 0.3.</p>
 */
final class PageContentAnalyzer {

    private static final double KEYWORD_WEIGHT = 0.4;
    private static final double MENTION_WEIGHT = 0.3;
    private static final double QUALITY_WEIGHT = 0.3;

    PageContent parse(String html, String baseUrl) {
        Document document = Jsoup.parse(html, baseUrl);
        String title = document.title().trim();
        Element meta = document.selectFirst("meta[name=description]");
        String metaDescription = meta == null ? "" : meta.attr("content").trim();

        List<String> headings = new ArrayList<>();
        for (Element heading : document.select("h1, h2, h3, h4, h5, h6")) {
            String text = heading.text().trim();
            if (!text.isEmpty()) {
                headings.add(text);
            }
        }

        int linkCount = 0;
        for (Element anchor : document.select("a[href]")) {
            if (!anchor.text().isBlank() && !anchor.absUrl("href").isEmpty()) {
                linkCount++;
            }
        }

        document.select("script, style, nav, footer, header").remove();
        Element main = document.selectFirst("main");
        if (main == null) {
            main = document.selectFirst("article");
        }
        if (main == null) {
            main = document.body();
        }
        String bodyText = main == null ? document.text().trim() : main.text().trim();
        int wordCount = bodyText.isEmpty() ? 0 : bodyText.split("\\s+").length;
        return new PageContent(title, metaDescription, headings, bodyText, linkCount, wordCount);
    }

    List<KeywordPlacement> analyzeKeywords(PageContent page, List<String> keywords) {
        List<KeywordPlacement> placements = new ArrayList<>();
        if (keywords == null) {
            return placements;
        }
        String allText = String.join(" ", page.title(), page.metaDescription(), page.bodyText(),
            String.join(" ", page.headings()));
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            KeywordMatcher matcher = KeywordMatcher.of(List.of(keyword));
            boolean inHeadings = page.headings().stream().anyMatch(heading -> matcher.match(heading).matched());
            placements.add(new KeywordPlacement(
                keyword.trim(),
                matcher.match(allText).occurrences(),
                matcher.match(page.title()).matched(),
                inHeadings,
                matcher.match(page.metaDescription()).matched()
            ));
        }
        return placements;
    }

    List<CampaignMention> findMentions(PageContent page, Campaign campaign) {
        String text = (page.title() + " " + page.bodyText()).toLowerCase(Locale.ROOT);
        List<CampaignMention> mentions = new ArrayList<>();
        addMention(mentions, "campaign_name", campaign.campaignName(), text);
        addMention(mentions, "client_name", campaign.clientName(), text);
        addMention(mentions, "client_domain", campaign.clientDomain(), text);
        return mentions;
    }

    double score(List<KeywordPlacement> placements, List<CampaignMention> mentions, PageContent page) {
        double score = 0.0;
        if (!placements.isEmpty()) {
            double keywordScore = 0.0;
            for (KeywordPlacement placement : placements) {
                keywordScore += placement.score();
            }
            score += keywordScore / placements.size() * KEYWORD_WEIGHT;
        }
        if (!mentions.isEmpty()) {
            score += Math.min(1.0, mentions.size() * 0.5) * MENTION_WEIGHT;
        }

        double quality = 0.0;
        if (page.wordCount() > 500) {
            quality += 0.3;
        } else if (page.wordCount() > 100) {
            quality += 0.1;
        }
        if (!page.title().isEmpty()) {
            quality += 0.2;
        }
        if (!page.metaDescription().isEmpty()) {
            quality += 0.1;
        }
        if (!page.headings().isEmpty()) {
            quality += 0.2;
        }
        if (page.outboundLinkCount() > 3) {
            quality += 0.2;
        }
        score += Math.min(1.0, quality) * QUALITY_WEIGHT;
        return Math.min(1.0, Math.round(score * 1000.0) / 1000.0);
    }

    private static void addMention(List<CampaignMention> mentions, String type, String value, String lowerText) {
        if (value == null || value.isBlank()) {
            return;
        }
        String needle = value.trim().toLowerCase(Locale.ROOT);
        int count = 0;
        int from = lowerText.indexOf(needle);
        while (from >= 0) {
            count++;
            from = lowerText.indexOf(needle, from + needle.length());
        }
        if (count > 0) {
            mentions.add(new CampaignMention(type, value.trim(), count));
        }
    }

    record KeywordPlacement(String keyword, int matches, boolean inTitle, boolean inHeadings, boolean inMeta) {

        double score() {
            double value = 0.0;
            if (matches > 0) {
                value += 0.3;
            }
            if (inTitle) {
                value += 0.3;
            }
            if (inHeadings) {
                value += 0.2;
            }
            if (inMeta) {
                value += 0.2;
            }
            return Math.min(1.0, value);
        }
    }

    record CampaignMention(String type, String text, int matches) {
    }
}
