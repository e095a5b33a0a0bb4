package net.linkcoverage.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDate;
import java.util.List;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.model.MonitoringStatus;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcCampaignStoreTest {

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private JdbcCampaignStore store;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
            .generateUniqueName(true)
            .setType(EmbeddedDatabaseType.H2)
            .addScript("classpath:db/schema.sql")
            .build();
        jdbcTemplate = new JdbcTemplate(database);
        store = new JdbcCampaignStore(jdbcTemplate, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void should_RoundTripListsAndDates_When_CampaignSaved() {
        Campaign campaign = new Campaign("c-1", "alice@example.com", "Acme", "Spring launch", "acme.io",
            "https://acme.io/launch", LocalDate.of(2025, 3, 1), MonitoringStatus.ACTIVE,
            List.of("rocket skates"), List.of("acme", "rocket skates"), List.of("spam.com"));

        store.saveCampaign(campaign);

        assertThat(store.getCampaign("c-1")).contains(campaign);
        assertThat(jdbcTemplate.queryForObject("SELECT monitoring_status FROM campaigns WHERE id = 'c-1'", String.class))
            .isEqualTo("active");
    }

    @Test
    void should_UpdateExistingRow_When_SavedAgain() {
        store.saveCampaign(campaign("c-1", "alice@example.com", MonitoringStatus.ACTIVE));
        store.saveCampaign(campaign("c-1", "alice@example.com", MonitoringStatus.PAUSED));

        assertThat(store.listAllCampaigns()).hasSize(1);
        assertThat(store.getCampaign("c-1")).get()
            .extracting(Campaign::monitoringStatus).isEqualTo(MonitoringStatus.PAUSED);
    }

    @Test
    void should_FilterByOwnerAndMonitoringStatus_When_Listing() {
        store.saveCampaign(campaign("c-2", "alice@example.com", MonitoringStatus.PAUSED));
        store.saveCampaign(campaign("c-1", "alice@example.com", MonitoringStatus.ACTIVE));
        store.saveCampaign(campaign("c-3", "bob@example.com", MonitoringStatus.ACTIVE));

        assertThat(store.listCampaigns("alice@example.com")).extracting(Campaign::id).containsExactly("c-1", "c-2");
        assertThat(store.listMonitoredCampaigns()).extracting(Campaign::id).containsExactly("c-1", "c-3");
        assertThat(store.getCampaign("missing")).isEmpty();
        assertThat(store.getCampaign(null)).isEmpty();
    }

    @Test
    void should_TreatUnreadableListColumnAsEmpty_When_Loading() {
        store.saveCampaign(campaign("c-1", "alice@example.com", MonitoringStatus.ACTIVE));
        jdbcTemplate.update("UPDATE campaigns SET verification_keywords = 'not json' WHERE id = 'c-1'");

        assertThat(store.getCampaign("c-1")).get()
            .extracting(Campaign::verificationKeywords, InstanceOfAssertFactories.LIST).isEmpty();
    }

    private static Campaign campaign(String id, String owner, MonitoringStatus status) {
        return new Campaign(id, owner, null, "Campaign " + id, "example.com", null, null, status,
            List.of(), List.of("acme"), List.of());
    }
}
