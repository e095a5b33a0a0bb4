package net.linkcoverage.model;

import jakarta.annotation.Nullable;
import java.util.Map;

/**
 * Read-side rollup of persisted backlink records for one campaign. Recomputed on every read.
 *
 * @param verificationRate verified / total as a percentage (0..100), 0 when there are no records
 * @param averageDomainRating mean over records that carry a rating, null when none do
 * @param destinationBreakdown record counts keyed by link destination wire value
 */
public record CampaignCoverageSummary(
    String campaignId,
    long totalBacklinks,
    long verifiedCoverage,
    long potentialCoverage,
    double verificationRate,
    @Nullable Double averageDomainRating,
    Map<String, Long> destinationBreakdown
) {

    public CampaignCoverageSummary {
        destinationBreakdown = destinationBreakdown == null ? Map.of() : Map.copyOf(destinationBreakdown);
    }
}
