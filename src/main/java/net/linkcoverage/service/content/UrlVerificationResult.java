package net.linkcoverage.service.content;

import jakarta.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of verifying one candidate coverage URL.
 *
 * @param status one of {@code verified}, {@code not_verified}, {@code fetch_failed}, {@code error}
 * @param contentScore 0..1 relevance score, 0 when the page could not be analyzed
 */
public record UrlVerificationResult(
    String url,
    String status,
    double contentScore,
    @Nullable String pageTitle,
    int wordCount,
    List<Map<String, Object>> keywordMatches,
    List<Map<String, Object>> campaignMentions,
    @Nullable String error
) {

    public static final String VERIFIED = "verified";
    public static final String NOT_VERIFIED = "not_verified";
    public static final String FETCH_FAILED = "fetch_failed";
    public static final String ERROR = "error";

    public UrlVerificationResult {
        keywordMatches = keywordMatches == null ? List.of() : List.copyOf(keywordMatches);
        campaignMentions = campaignMentions == null ? List.of() : List.copyOf(campaignMentions);
    }

    static UrlVerificationResult fetchFailed(String url, String reason) {
        return new UrlVerificationResult(url, FETCH_FAILED, 0.0, null, 0, List.of(), List.of(), reason);
    }

    static UrlVerificationResult error(String url, String reason) {
        return new UrlVerificationResult(url, ERROR, 0.0, null, 0, List.of(), List.of(), reason);
    }

    public boolean verified() {
        return VERIFIED.equals(status);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("url", url);
        map.put("verification_status", status);
        map.put("coverage_verified", verified());
        map.put("content_score", contentScore);
        map.put("page_title", pageTitle == null ? "" : pageTitle);
        map.put("word_count", wordCount);
        map.put("keyword_matches", keywordMatches);
        map.put("campaign_mentions", campaignMentions);
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }
}
