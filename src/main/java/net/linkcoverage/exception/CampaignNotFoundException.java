package net.linkcoverage.exception;

/**
 * Campaign referenced by a running task vanished from the campaign store.
 */
public class CampaignNotFoundException extends RuntimeException {
    private final String campaignId;

    public CampaignNotFoundException(String campaignId) {
        super("Campaign not found: " + campaignId);
        this.campaignId = campaignId;
    }

    public String getCampaignId() {
        return campaignId;
    }
}
