package net.linkcoverage.model;

import jakarta.annotation.Nullable;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-only view of a campaign as supplied by the campaign store.
 *
 * @param ownerId identity of the user who owns the campaign
 * @param clientDomain bare domain of the client, e.g. {@code example.com}
 * @param campaignUrl target URL whose coverage is being tracked
 */
public record Campaign(
    String id,
    String ownerId,
    @Nullable String clientName,
    String campaignName,
    @Nullable String clientDomain,
    @Nullable String campaignUrl,
    @Nullable LocalDate launchDate,
    MonitoringStatus monitoringStatus,
    List<String> serpKeywords,
    List<String> verificationKeywords,
    List<String> blacklistDomains
) {

    public Campaign {
        serpKeywords = serpKeywords == null ? List.of() : List.copyOf(serpKeywords);
        verificationKeywords = verificationKeywords == null ? List.of() : List.copyOf(verificationKeywords);
        blacklistDomains = blacklistDomains == null ? List.of() : List.copyOf(blacklistDomains);
        monitoringStatus = monitoringStatus == null ? MonitoringStatus.ACTIVE : monitoringStatus;
    }

    /** Whether the campaign has enough targeting data to run an analysis. */
    public boolean hasTarget() {
        return (campaignUrl != null && !campaignUrl.isBlank())
            || (clientDomain != null && !clientDomain.isBlank());
    }
}
