package net.linkcoverage.model;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Rollup across every campaign visible to the caller.
 */
public record AggregateCoverageSummary(
    long totalCampaigns,
    long totalBacklinks,
    long verifiedCoverage,
    long potentialCoverage,
    double overallVerificationRate,
    @Nullable Double averageDomainRating,
    List<CampaignCoverageSummary> campaigns
) {

    public AggregateCoverageSummary {
        campaigns = campaigns == null ? List.of() : List.copyOf(campaigns);
    }
}
