package net.linkcoverage.repository;

import java.util.List;
import net.linkcoverage.model.BacklinkRecord;

/**
 * Persistence for canonical backlink records. Writes are idempotent upserts keyed by
 * (campaign, source URL, destination URL) so concurrent analyses of one campaign converge.
 */
public interface BacklinkRecordRepository {

    /**
     * @return number of records written
     */
    int upsertBacklinkRecords(String campaignId, List<BacklinkRecord> records);

    List<BacklinkRecord> queryBacklinkRecords(String campaignId, BacklinkRecordFilter filter);
}
