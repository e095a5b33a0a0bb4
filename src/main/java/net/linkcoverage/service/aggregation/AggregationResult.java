package net.linkcoverage.service.aggregation;

import java.util.List;
import net.linkcoverage.model.BacklinkRecord;
import net.linkcoverage.model.CoverageStatus;

/**
 * Canonical records plus the counters explaining what was dropped on the way.
 */
public record AggregationResult(List<BacklinkRecord> records, Diagnostics diagnostics) {

    public AggregationResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public long count(CoverageStatus status) {
        return records.stream().filter(record -> record.coverageStatus() == status).count();
    }

    /**
     * @param rawEntries rows read from all payloads, malformed ones included
     * @param skippedEntries malformed rows that were ignored
     * @param duplicatesMerged rows folded into an existing pair
     * @param blacklisted pairs dropped because the source domain is blacklisted
     * @param unrelated pairs with neither a direct link nor keyword evidence
     */
    public record Diagnostics(int rawEntries,
                              int skippedEntries,
                              int duplicatesMerged,
                              int blacklisted,
                              int unrelated) {

        public int excludedCount() {
            return blacklisted + unrelated;
        }
    }
}
