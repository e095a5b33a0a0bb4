package net.linkcoverage.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.model.MonitoringStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Postgres backed campaign store. Keyword and blacklist lists are stored as JSON text columns.
 */
@Slf4j
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcCampaignStore implements CampaignStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };

    private static final String SELECT_COLUMNS = """
            SELECT id, user_email, client_name, campaign_name, client_domain, campaign_url, launch_date,
                   monitoring_status, serp_keywords, verification_keywords, blacklist_domains
            FROM campaigns
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Campaign> campaignRowMapper = this::mapCampaign;

    public JdbcCampaignStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Campaign> getCampaign(String campaignId) {
        if (campaignId == null) {
            return Optional.empty();
        }
        List<Campaign> rows = jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", campaignRowMapper, campaignId);
        return rows.stream().findFirst();
    }

    @Override
    public List<Campaign> listCampaigns(String ownerId) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE user_email = ? ORDER BY id", campaignRowMapper, ownerId);
    }

    @Override
    public List<Campaign> listAllCampaigns() {
        return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY id", campaignRowMapper);
    }

    @Override
    public List<Campaign> listMonitoredCampaigns() {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE monitoring_status = ? ORDER BY id",
            campaignRowMapper, "active");
    }

    @Override
    public Campaign saveCampaign(Campaign campaign) {
        Object[] values = {
            campaign.ownerId(),
            campaign.clientName(),
            campaign.campaignName(),
            campaign.clientDomain(),
            campaign.campaignUrl(),
            campaign.launchDate() == null ? null : Date.valueOf(campaign.launchDate()),
            campaign.monitoringStatus().name().toLowerCase(Locale.ROOT),
            writeList(campaign.serpKeywords()),
            writeList(campaign.verificationKeywords()),
            writeList(campaign.blacklistDomains()),
            campaign.id()
        };
        int updated = jdbcTemplate.update("""
                UPDATE campaigns
                SET user_email = ?, client_name = ?, campaign_name = ?, client_domain = ?, campaign_url = ?,
                    launch_date = ?, monitoring_status = ?, serp_keywords = ?, verification_keywords = ?,
                    blacklist_domains = ?
                WHERE id = ?
                """, values);
        if (updated == 0) {
            jdbcTemplate.update("""
                    INSERT INTO campaigns (user_email, client_name, campaign_name, client_domain, campaign_url,
                                           launch_date, monitoring_status, serp_keywords, verification_keywords,
                                           blacklist_domains, id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """, values);
        }
        return campaign;
    }

    private Campaign mapCampaign(ResultSet rs, int rowNum) throws SQLException {
        Date launchDate = rs.getDate("launch_date");
        return new Campaign(
            rs.getString("id"),
            rs.getString("user_email"),
            rs.getString("client_name"),
            rs.getString("campaign_name"),
            rs.getString("client_domain"),
            rs.getString("campaign_url"),
            launchDate == null ? null : launchDate.toLocalDate(),
            MonitoringStatus.fromValue(rs.getString("monitoring_status")),
            readList(rs.getString("serp_keywords")),
            readList(rs.getString("verification_keywords")),
            readList(rs.getString("blacklist_domains"))
        );
    }

    private List<String> readList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable campaign list column: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private String writeList(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize campaign list column", e);
        }
    }
}
