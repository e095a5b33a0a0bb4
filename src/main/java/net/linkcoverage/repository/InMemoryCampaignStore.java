package net.linkcoverage.repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.model.MonitoringStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Repository;

/**
 * Campaign store used when no database is configured.
 */
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
public class InMemoryCampaignStore implements CampaignStore {

    private final Map<String, Campaign> campaigns = new ConcurrentHashMap<>();

    @Override
    public Optional<Campaign> getCampaign(String campaignId) {
        if (campaignId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(campaigns.get(campaignId));
    }

    @Override
    public List<Campaign> listCampaigns(String ownerId) {
        return campaigns.values().stream()
            .filter(campaign -> campaign.ownerId().equals(ownerId))
            .sorted(Comparator.comparing(Campaign::id))
            .toList();
    }

    @Override
    public List<Campaign> listAllCampaigns() {
        return campaigns.values().stream()
            .sorted(Comparator.comparing(Campaign::id))
            .toList();
    }

    @Override
    public List<Campaign> listMonitoredCampaigns() {
        return campaigns.values().stream()
            .filter(campaign -> campaign.monitoringStatus() == MonitoringStatus.ACTIVE)
            .sorted(Comparator.comparing(Campaign::id))
            .toList();
    }

    @Override
    public Campaign saveCampaign(Campaign campaign) {
        campaigns.put(campaign.id(), campaign);
        return campaign;
    }
}
