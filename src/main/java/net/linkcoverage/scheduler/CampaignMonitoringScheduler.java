package net.linkcoverage.scheduler;

import java.util.ArrayList;
import java.util.List;
import net.linkcoverage.application.task.TaskOrchestrator;
import net.linkcoverage.domain.task.TaskType;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.repository.CampaignStore;
import net.linkcoverage.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically enqueues one {@code scheduled_monitoring} task per actively monitored campaign,
 * owned by the campaign's owner.
 *
 * <p>A campaign that cannot be enqueued is logged and skipped; the cycle itself never throws.</p>
 */
@Component
public class CampaignMonitoringScheduler {

    private static final Logger log = LoggerFactory.getLogger(CampaignMonitoringScheduler.class);

    private final CampaignStore campaignStore;
    private final TaskOrchestrator taskOrchestrator;
    private final boolean schedulerEnabled;

    public CampaignMonitoringScheduler(CampaignStore campaignStore,
                                       TaskOrchestrator taskOrchestrator,
                                       @Value("${app.monitoring.enabled:true}") boolean schedulerEnabled) {
        this.campaignStore = campaignStore;
        this.taskOrchestrator = taskOrchestrator;
        this.schedulerEnabled = schedulerEnabled;
    }

    @Scheduled(cron = "${app.monitoring.cron:0 0 */6 * * *}")
    public void runMonitoringCycle() {
        runMonitoringCycle(false);
    }

    /**
     * Runs a monitoring cycle now, regardless of the enabled flag.
     */
    public MonitoringCycleSummary forceRunMonitoringCycle() {
        return runMonitoringCycle(true);
    }

    private MonitoringCycleSummary runMonitoringCycle(boolean forceExecution) {
        if (!forceExecution && !schedulerEnabled) {
            log.debug("Campaign monitoring scheduler is disabled via configuration.");
            return new MonitoringCycleSummary(0, List.of(), List.of());
        }

        List<Campaign> campaigns;
        try {
            campaigns = campaignStore.listMonitoredCampaigns();
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Campaign monitoring cycle could not list monitored campaigns");
            return new MonitoringCycleSummary(0, List.of(), List.of("campaign store unavailable"));
        }

        List<String> taskIds = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (Campaign campaign : campaigns) {
            try {
                taskIds.add(taskOrchestrator.createTask(campaign.ownerId(), TaskType.SCHEDULED_MONITORING,
                    campaign.id(), null));
            } catch (RuntimeException e) {
                LoggingUtils.warn(log, e, "Failed to enqueue monitoring for campaign {}", campaign.id());
                failures.add(campaign.id() + ": " + LoggingUtils.summarize(e));
            }
        }
        log.info("Campaign monitoring cycle enqueued {} task(s) for {} campaign(s); {} failure(s).",
            taskIds.size(), campaigns.size(), failures.size());
        return new MonitoringCycleSummary(campaigns.size(), List.copyOf(taskIds), List.copyOf(failures));
    }

    /**
     * @param campaignsConsidered monitored campaigns found in the store
     * @param enqueuedTaskIds ids of monitoring tasks created this cycle
     * @param failures one entry per campaign that could not be enqueued
     */
    public record MonitoringCycleSummary(int campaignsConsidered, List<String> enqueuedTaskIds, List<String> failures) {
    }
}
