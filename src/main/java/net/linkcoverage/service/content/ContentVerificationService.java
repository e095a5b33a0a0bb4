package net.linkcoverage.service.content;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.service.content.PageContentAnalyzer.CampaignMention;
import net.linkcoverage.service.content.PageContentAnalyzer.KeywordPlacement;
import net.linkcoverage.support.task.CancellationToken;
import net.linkcoverage.util.LoggingUtils;
import net.linkcoverage.util.UrlUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Verifies candidate coverage pages by fetching and reading them.
 *
 * <p>Each URL is fetched once, parsed with jsoup and scored against the campaign's verification
 * keywords and identity (campaign name, client name, client domain). Fetches run with bounded
 * concurrency and the cancellation token is checked before every fetch starts.</p>
 */
@Slf4j
@Service
public class ContentVerificationService {

    private static final Duration FETCH_TIMEOUT = Duration.ofSeconds(20);

    private final WebClient webClient;
    private final PageContentAnalyzer analyzer = new PageContentAnalyzer();
    private final int maxUrls;
    private final int maxConcurrency;
    private final double verifiedThreshold;

    public ContentVerificationService(WebClient.Builder webClientBuilder,
                                      @Value("${app.content-verification.max-urls:50}") int maxUrls,
                                      @Value("${app.content-verification.max-concurrency:5}") int maxConcurrency,
                                      @Value("${app.content-verification.verified-threshold:0.6}") double verifiedThreshold) {
        this.webClient = webClientBuilder.build();
        this.maxUrls = Math.max(1, maxUrls);
        this.maxConcurrency = Math.max(1, maxConcurrency);
        this.verifiedThreshold = verifiedThreshold;
    }

    /**
     * Verifies up to {@code max-urls} distinct URLs, preserving input order in the result.
     *
     * @return task result payload with {@code urls_checked}, {@code verified_count} and {@code results}
     */
    public Map<String, Object> verifyCoverage(Campaign campaign, List<String> urls, CancellationToken token) {
        List<String> targets = new ArrayList<>(new LinkedHashSet<>(urls));
        if (targets.size() > maxUrls) {
            log.info("Content verification for campaign {} truncated from {} to {} URLs",
                campaign.id(), targets.size(), maxUrls);
            targets = targets.subList(0, maxUrls);
        }

        List<UrlVerificationResult> results = Flux.fromIterable(targets)
            .flatMapSequential(url -> Mono.defer(() -> {
                token.checkpoint();
                return verifyUrl(campaign, url);
            }), maxConcurrency)
            .collectList()
            .block();

        List<Map<String, Object>> resultMaps = new ArrayList<>();
        long verified = 0;
        for (UrlVerificationResult result : results == null ? List.<UrlVerificationResult>of() : results) {
            resultMaps.add(result.toMap());
            if (result.verified()) {
                verified++;
            }
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("urls_checked", resultMaps.size());
        payload.put("verified_count", verified);
        payload.put("results", resultMaps);
        return payload;
    }

    Mono<UrlVerificationResult> verifyUrl(Campaign campaign, String url) {
        if (!UrlUtils.isHttpUrl(url)) {
            return Mono.just(UrlVerificationResult.error(url, "Not an http(s) URL"));
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return Mono.just(UrlVerificationResult.error(url, "Malformed URL"));
        }
        return webClient.get()
            .uri(uri)
            .accept(MediaType.TEXT_HTML, MediaType.ALL)
            .exchangeToMono(response -> readPage(url, response))
            .timeout(FETCH_TIMEOUT)
            .map(fetched -> fetched.html() == null
                ? UrlVerificationResult.fetchFailed(url, fetched.failure())
                : analyze(campaign, url, fetched.html()))
            .onErrorResume(ex -> {
                log.warn("Fetching {} failed: {}", url, LoggingUtils.summarize(ex));
                return Mono.just(UrlVerificationResult.fetchFailed(url, LoggingUtils.summarize(ex)));
            });
    }

    private Mono<FetchedPage> readPage(String url, ClientResponse response) {
        if (response.statusCode().value() != HttpStatus.OK.value()) {
            log.warn("HTTP {} for {}", response.statusCode().value(), url);
            return response.releaseBody().thenReturn(FetchedPage.failed("HTTP " + response.statusCode().value()));
        }
        MediaType contentType = response.headers().contentType().orElse(null);
        if (contentType == null || !MediaType.TEXT_HTML.isCompatibleWith(contentType)) {
            log.warn("Non-HTML content for {}: {}", url, contentType);
            return response.releaseBody().thenReturn(FetchedPage.failed("Non-HTML content: " + contentType));
        }
        return response.bodyToMono(String.class)
            .map(FetchedPage::ok)
            .defaultIfEmpty(FetchedPage.ok(""));
    }

    private UrlVerificationResult analyze(Campaign campaign, String url, String html) {
        try {
            PageContent page = analyzer.parse(html, url);
            List<KeywordPlacement> placements = analyzer.analyzeKeywords(page, campaign.verificationKeywords());
            List<CampaignMention> mentions = analyzer.findMentions(page, campaign);
            double score = analyzer.score(placements, mentions, page);
            String status = score >= verifiedThreshold ? UrlVerificationResult.VERIFIED : UrlVerificationResult.NOT_VERIFIED;
            log.debug("Analyzed {}: score={}, status={}", url, score, status);
            return new UrlVerificationResult(url, status, score, page.title(), page.wordCount(),
                placements.stream().map(ContentVerificationService::placementMap).toList(),
                mentions.stream().map(ContentVerificationService::mentionMap).toList(),
                null);
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Analyzing {} failed", url);
            return UrlVerificationResult.error(url, LoggingUtils.summarize(e));
        }
    }

    private static Map<String, Object> placementMap(KeywordPlacement placement) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("keyword", placement.keyword());
        map.put("matches", placement.matches());
        map.put("found_in_title", placement.inTitle());
        map.put("found_in_headings", placement.inHeadings());
        map.put("found_in_meta", placement.inMeta());
        return map;
    }

    private static Map<String, Object> mentionMap(CampaignMention mention) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", mention.type());
        map.put("text", mention.text());
        map.put("matches", mention.matches());
        return map;
    }

    private record FetchedPage(String html, String failure) {

        static FetchedPage ok(String html) {
            return new FetchedPage(html, null);
        }

        static FetchedPage failed(String failure) {
            return new FetchedPage(null, failure);
        }
    }
}
