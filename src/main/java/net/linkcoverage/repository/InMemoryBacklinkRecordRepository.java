package net.linkcoverage.repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import net.linkcoverage.model.BacklinkRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Repository;

/**
 * Backlink record store used when no database is configured. Records are kept per campaign in
 * insertion order; re-upserting a pair replaces the stored record in place.
 */
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
public class InMemoryBacklinkRecordRepository implements BacklinkRecordRepository {

    private final Map<String, Map<String, BacklinkRecord>> recordsByCampaign = new ConcurrentHashMap<>();

    @Override
    public int upsertBacklinkRecords(String campaignId, List<BacklinkRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        Map<String, BacklinkRecord> stored = recordsByCampaign.computeIfAbsent(campaignId, key -> new LinkedHashMap<>());
        synchronized (stored) {
            for (BacklinkRecord record : records) {
                stored.put(record.pairKey(), record);
            }
        }
        return records.size();
    }

    @Override
    public List<BacklinkRecord> queryBacklinkRecords(String campaignId, BacklinkRecordFilter filter) {
        Map<String, BacklinkRecord> stored = recordsByCampaign.get(campaignId);
        if (stored == null) {
            return List.of();
        }
        BacklinkRecordFilter effective = filter == null ? BacklinkRecordFilter.all() : filter;
        List<BacklinkRecord> matches = new ArrayList<>();
        synchronized (stored) {
            for (BacklinkRecord record : stored.values()) {
                if (effective.matches(record)) {
                    matches.add(record);
                }
            }
        }
        return matches;
    }
}
