package net.linkcoverage.service.summary;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.model.AggregateCoverageSummary;
import net.linkcoverage.model.BacklinkRecord;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.model.CampaignCoverageSummary;
import net.linkcoverage.model.CoverageStatus;
import net.linkcoverage.model.LinkDestination;
import net.linkcoverage.repository.BacklinkRecordFilter;
import net.linkcoverage.repository.BacklinkRecordRepository;
import net.linkcoverage.repository.CampaignStore;
import org.springframework.stereotype.Service;

/**
 * Read-side rollups over persisted backlink records. Nothing is cached; every call recomputes
 * from the repository. Campaigns without records yield zero-value summaries.
 */
@Slf4j
@Service
public class CoverageSummaryService {

    private final CampaignStore campaignStore;
    private final BacklinkRecordRepository backlinkRecordRepository;

    public CoverageSummaryService(CampaignStore campaignStore, BacklinkRecordRepository backlinkRecordRepository) {
        this.campaignStore = campaignStore;
        this.backlinkRecordRepository = backlinkRecordRepository;
    }

    public CampaignCoverageSummary summarize(String campaignId) {
        List<BacklinkRecord> records = backlinkRecordRepository.queryBacklinkRecords(campaignId, BacklinkRecordFilter.all());
        return summarizeRecords(campaignId, records);
    }

    /** Rollup across every campaign in the store. */
    public AggregateCoverageSummary summarizeAll() {
        return rollup(campaignStore.listAllCampaigns());
    }

    /** Rollup across the campaigns owned by one user. */
    public AggregateCoverageSummary summarizeAll(String ownerId) {
        return rollup(campaignStore.listCampaigns(ownerId));
    }

    static CampaignCoverageSummary summarizeRecords(String campaignId, List<BacklinkRecord> records) {
        long verified = 0;
        long potential = 0;
        double ratingSum = 0;
        long rated = 0;
        Map<String, Long> destinations = emptyDestinationBreakdown();
        for (BacklinkRecord record : records) {
            if (record.coverageStatus() == CoverageStatus.VERIFIED) {
                verified++;
            } else {
                potential++;
            }
            if (record.domainRating() != null) {
                ratingSum += record.domainRating();
                rated++;
            }
            destinations.merge(record.linkDestination().wireValue(), 1L, Long::sum);
        }
        long total = records.size();
        return new CampaignCoverageSummary(
            campaignId,
            total,
            verified,
            potential,
            percentage(verified, total),
            rated == 0 ? null : round(ratingSum / rated),
            destinations
        );
    }

    private AggregateCoverageSummary rollup(List<Campaign> campaigns) {
        List<CampaignCoverageSummary> summaries = new ArrayList<>(campaigns.size());
        long totalBacklinks = 0;
        long verified = 0;
        long potential = 0;
        double ratingSum = 0;
        long rated = 0;
        for (Campaign campaign : campaigns) {
            List<BacklinkRecord> records = backlinkRecordRepository.queryBacklinkRecords(campaign.id(), BacklinkRecordFilter.all());
            CampaignCoverageSummary summary = summarizeRecords(campaign.id(), records);
            summaries.add(summary);
            totalBacklinks += summary.totalBacklinks();
            verified += summary.verifiedCoverage();
            potential += summary.potentialCoverage();
            for (BacklinkRecord record : records) {
                if (record.domainRating() != null) {
                    ratingSum += record.domainRating();
                    rated++;
                }
            }
        }
        log.debug("Summarized {} campaigns with {} backlinks", campaigns.size(), totalBacklinks);
        return new AggregateCoverageSummary(
            campaigns.size(),
            totalBacklinks,
            verified,
            potential,
            percentage(verified, totalBacklinks),
            rated == 0 ? null : round(ratingSum / rated),
            summaries
        );
    }

    private static Map<String, Long> emptyDestinationBreakdown() {
        Map<String, Long> breakdown = new LinkedHashMap<>();
        for (LinkDestination destination : LinkDestination.values()) {
            breakdown.put(destination.wireValue(), 0L);
        }
        return breakdown;
    }

    private static double percentage(long part, long total) {
        if (total == 0) {
            return 0.0;
        }
        return round(part * 100.0 / total);
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
