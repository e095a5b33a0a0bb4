package net.linkcoverage.service.aggregation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.model.BacklinkRecord;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.model.CoverageStatus;
import net.linkcoverage.model.LinkDestination;
import net.linkcoverage.model.ProviderQueryResult;
import net.linkcoverage.service.aggregation.BacklinkDeduplicator.DedupeResult;
import net.linkcoverage.service.aggregation.BacklinkDeduplicator.MergedBacklink;
import net.linkcoverage.service.aggregation.KeywordMatcher.KeywordMatch;
import net.linkcoverage.service.aggregation.ProviderPayloadReader.ParsedPayload;
import net.linkcoverage.util.UrlUtils;
import org.springframework.stereotype.Service;

/**
 * Turns raw provider payloads into the canonical backlink set for a campaign.
 *
 * <p>Pipeline: read and normalize every row, merge rows sharing a (source, destination) pair,
 * drop blacklisted sources, classify coverage and destination, score. The engine is a pure
 * function of its inputs: identical inputs always yield an identical, identically ordered
 * output.</p>
 */
@Slf4j
@Service
public class AggregationEngine {

    private static final Comparator<BacklinkRecord> OUTPUT_ORDER = Comparator
        .comparing((BacklinkRecord record) -> record.coverageStatus() == CoverageStatus.VERIFIED ? 0 : 1)
        .thenComparing(BacklinkRecord::confidenceScore, Comparator.reverseOrder())
        .thenComparing(BacklinkRecord::pairKey);

    private final ProviderPayloadReader payloadReader = new ProviderPayloadReader();
    private final BacklinkDeduplicator deduplicator = new BacklinkDeduplicator();
    private final ConfidenceScorer scorer;

    public AggregationEngine(ScoringWeights scoringWeights) {
        this.scorer = new ConfidenceScorer(scoringWeights);
    }

    public AggregationResult aggregate(Campaign campaign, List<ProviderQueryResult> providerResults) {
        List<RawBacklinkEntry> entries = new ArrayList<>();
        int skipped = 0;
        for (ProviderQueryResult result : providerResults == null ? List.<ProviderQueryResult>of() : providerResults) {
            ParsedPayload parsed = payloadReader.read(result);
            entries.addAll(parsed.entries());
            skipped += parsed.skipped();
        }

        DedupeResult deduped = deduplicator.deduplicate(entries);
        Set<String> campaignDomains = campaignDomains(campaign);
        List<String> blacklist = normalizedBlacklist(campaign.blacklistDomains());
        KeywordMatcher keywordMatcher = KeywordMatcher.of(campaign.verificationKeywords());

        List<BacklinkRecord> records = new ArrayList<>();
        int blacklisted = 0;
        int unrelated = 0;
        for (MergedBacklink backlink : deduped.backlinks()) {
            String sourceDomain = UrlUtils.extractDomain(backlink.sourceUrl());
            if (isBlacklisted(sourceDomain, blacklist)) {
                blacklisted++;
                continue;
            }
            boolean directLink = isDirectLink(backlink.destinationUrl(), campaign.campaignUrl(), campaignDomains);
            KeywordMatch keywordMatch = keywordMatcher.match(backlink.searchableText());
            if (!directLink && !keywordMatch.matched()) {
                unrelated++;
                continue;
            }
            records.add(toRecord(backlink, directLink, keywordMatch));
        }
        records.sort(OUTPUT_ORDER);

        AggregationResult.Diagnostics diagnostics = new AggregationResult.Diagnostics(
            entries.size() + skipped, skipped, deduped.duplicatesMerged(), blacklisted, unrelated);
        log.debug("Aggregated campaign {}: {} record(s), diagnostics {}", campaign.id(), records.size(), diagnostics);
        return new AggregationResult(records, diagnostics);
    }

    private BacklinkRecord toRecord(MergedBacklink backlink, boolean directLink, KeywordMatch keywordMatch) {
        CoverageStatus status = directLink ? CoverageStatus.VERIFIED : CoverageStatus.POTENTIAL;
        LinkDestination destination = LinkDestinationClassifier.classify(backlink.destinationUrl());
        double confidence = scorer.score(directLink, keywordMatch.occurrences(), backlink.domainRating());
        String linkType = Boolean.FALSE.equals(backlink.dofollow())
            ? BacklinkRecord.LINK_TYPE_NOFOLLOW
            : BacklinkRecord.LINK_TYPE_DOFOLLOW;
        return new BacklinkRecord(
            backlink.sourceUrl(),
            backlink.destinationUrl(),
            backlink.anchorText(),
            backlink.firstSeen(),
            backlink.domainRating(),
            backlink.urlRating(),
            linkType,
            backlink.content(),
            backlink.redirect(),
            backlink.canonical(),
            status,
            destination,
            confidence,
            backlink.sourceApi()
        );
    }

    private static boolean isDirectLink(String destinationUrl, String campaignUrl, Set<String> campaignDomains) {
        if (campaignUrl != null && UrlUtils.sameResource(destinationUrl, campaignUrl)) {
            return true;
        }
        String destinationDomain = UrlUtils.extractDomain(destinationUrl);
        for (String domain : campaignDomains) {
            if (UrlUtils.hostMatchesDomain(destinationDomain, domain)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlacklisted(String sourceDomain, List<String> blacklist) {
        for (String blocked : blacklist) {
            if (UrlUtils.hostMatchesDomain(sourceDomain, blocked)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> campaignDomains(Campaign campaign) {
        Set<String> domains = new LinkedHashSet<>();
        String clientDomain = UrlUtils.normalizeDomain(campaign.clientDomain());
        if (clientDomain != null) {
            domains.add(clientDomain);
        }
        String urlDomain = UrlUtils.extractDomain(campaign.campaignUrl());
        if (urlDomain != null) {
            domains.add(urlDomain);
        }
        return domains;
    }

    private static List<String> normalizedBlacklist(List<String> blacklistDomains) {
        List<String> normalized = new ArrayList<>();
        for (String domain : blacklistDomains) {
            String value = UrlUtils.normalizeDomain(domain);
            if (value != null) {
                normalized.add(value);
            }
        }
        return normalized;
    }
}
