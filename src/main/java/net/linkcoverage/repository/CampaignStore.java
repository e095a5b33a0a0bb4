package net.linkcoverage.repository;

import java.util.List;
import java.util.Optional;
import net.linkcoverage.model.Campaign;

/**
 * Source of campaign targeting data (domain, URL, keyword sets, blacklist).
 */
public interface CampaignStore {

    Optional<Campaign> getCampaign(String campaignId);

    /** Campaigns owned by the given user, ordered by id. */
    List<Campaign> listCampaigns(String ownerId);

    List<Campaign> listAllCampaigns();

    /** Campaigns whose monitoring status is active. */
    List<Campaign> listMonitoredCampaigns();

    Campaign saveCampaign(Campaign campaign);
}
