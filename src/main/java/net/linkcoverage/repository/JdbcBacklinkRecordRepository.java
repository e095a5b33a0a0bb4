package net.linkcoverage.repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.model.BacklinkRecord;
import net.linkcoverage.model.CoverageStatus;
import net.linkcoverage.model.LinkDestination;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Postgres backed backlink record store.
 *
 * <p>Upserts run as update-then-insert per record. A concurrent insert of the same pair surfaces
 * as {@link DuplicateKeyException} and is resolved by re-running the update, so two analyses of
 * one campaign converge on the last writer's values.</p>
 */
@Slf4j
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcBacklinkRecordRepository implements BacklinkRecordRepository {

    private static final String UPDATE_SQL = """
            UPDATE backlink_records
            SET anchor_text = ?, first_seen = ?, domain_rating = ?, url_rating = ?, link_type = ?,
                is_content = ?, is_redirect = ?, is_canonical = ?, coverage_status = ?, link_destination = ?,
                confidence_score = ?, source_api = ?, updated_at = ?
            WHERE campaign_id = ? AND source_url = ? AND destination_url = ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO backlink_records (anchor_text, first_seen, domain_rating, url_rating, link_type,
                                          is_content, is_redirect, is_canonical, coverage_status, link_destination,
                                          confidence_score, source_api, updated_at,
                                          campaign_id, source_url, destination_url)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final RowMapper<BacklinkRecord> RECORD_ROW_MAPPER = JdbcBacklinkRecordRepository::mapRecord;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Autowired
    public JdbcBacklinkRecordRepository(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, Clock.systemUTC());
    }

    JdbcBacklinkRecordRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public int upsertBacklinkRecords(String campaignId, List<BacklinkRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        Timestamp updatedAt = Timestamp.from(Instant.now(clock));
        int written = 0;
        for (BacklinkRecord record : records) {
            Object[] values = values(campaignId, record, updatedAt);
            if (jdbcTemplate.update(UPDATE_SQL, values) > 0) {
                written++;
                continue;
            }
            try {
                jdbcTemplate.update(INSERT_SQL, values);
            } catch (DuplicateKeyException e) {
                log.debug("Concurrent insert for {} in campaign {}; applying as update", record.pairKey(), campaignId);
                jdbcTemplate.update(UPDATE_SQL, values);
            }
            written++;
        }
        return written;
    }

    @Override
    public List<BacklinkRecord> queryBacklinkRecords(String campaignId, BacklinkRecordFilter filter) {
        BacklinkRecordFilter effective = filter == null ? BacklinkRecordFilter.all() : filter;
        StringBuilder sql = new StringBuilder("""
                SELECT source_url, destination_url, anchor_text, first_seen, domain_rating, url_rating, link_type,
                       is_content, is_redirect, is_canonical, coverage_status, link_destination,
                       confidence_score, source_api
                FROM backlink_records
                WHERE campaign_id = ?
                """);
        List<Object> args = new ArrayList<>();
        args.add(campaignId);
        if (effective.coverageStatus() != null) {
            sql.append(" AND coverage_status = ?");
            args.add(effective.coverageStatus().wireValue());
        }
        if (effective.minDomainRating() != null) {
            sql.append(" AND domain_rating >= ?");
            args.add(effective.minDomainRating());
        }
        sql.append(" ORDER BY confidence_score DESC, source_url, destination_url");
        return jdbcTemplate.query(sql.toString(), RECORD_ROW_MAPPER, args.toArray());
    }

    private static Object[] values(String campaignId, BacklinkRecord record, Timestamp updatedAt) {
        return new Object[] {
            record.anchorText(),
            record.firstSeen() == null ? null : Date.valueOf(record.firstSeen()),
            record.domainRating(),
            record.urlRating(),
            record.linkType(),
            record.content(),
            record.redirect(),
            record.canonical(),
            record.coverageStatus().wireValue(),
            record.linkDestination().wireValue(),
            record.confidenceScore(),
            record.sourceApi(),
            updatedAt,
            campaignId,
            record.sourceUrl(),
            record.destinationUrl()
        };
    }

    private static BacklinkRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        Date firstSeen = rs.getDate("first_seen");
        return new BacklinkRecord(
            rs.getString("source_url"),
            rs.getString("destination_url"),
            rs.getString("anchor_text"),
            firstSeen == null ? null : firstSeen.toLocalDate(),
            nullableDouble(rs, "domain_rating"),
            nullableDouble(rs, "url_rating"),
            rs.getString("link_type"),
            rs.getBoolean("is_content"),
            rs.getBoolean("is_redirect"),
            rs.getBoolean("is_canonical"),
            CoverageStatus.fromWireValue(rs.getString("coverage_status")),
            LinkDestination.fromWireValue(rs.getString("link_destination")),
            rs.getDouble("confidence_score"),
            rs.getString("source_api")
        );
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
