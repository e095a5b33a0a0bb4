package net.linkcoverage.application.task;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntConsumer;
import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.application.analysis.CampaignAnalysisUseCase;
import net.linkcoverage.application.analysis.CampaignAnalysisUseCase.AnalysisOutcome;
import net.linkcoverage.domain.task.Task;
import net.linkcoverage.exception.CampaignNotFoundException;
import net.linkcoverage.exception.TaskCancelledException;
import net.linkcoverage.exception.TaskTimeoutException;
import net.linkcoverage.model.AnalysisDepth;
import net.linkcoverage.model.BacklinkRecord;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.model.CoverageStatus;
import net.linkcoverage.repository.BacklinkRecordFilter;
import net.linkcoverage.repository.BacklinkRecordRepository;
import net.linkcoverage.repository.CampaignStore;
import net.linkcoverage.service.content.ContentVerificationService;
import net.linkcoverage.support.task.CancellationToken;
import net.linkcoverage.util.LoggingUtils;
import org.springframework.stereotype.Component;

/**
 * One handler per {@link net.linkcoverage.domain.task.TaskType}. Each handler returns the result
 * payload stored on the completed task and reports progress milestones through the callback.
 */
@Slf4j
@Component
public class CoverageTaskHandlers {

    static final String PARAM_ANALYSIS_DEPTH = "analysis_depth";
    static final String PARAM_URLS = "urls";
    static final String PARAM_CAMPAIGN_IDS = "campaign_ids";

    private static final int PROGRESS_BATCH_START = 10;
    private static final int PROGRESS_BATCH_SPAN = 80;

    private final CampaignStore campaignStore;
    private final BacklinkRecordRepository backlinkRecordRepository;
    private final CampaignAnalysisUseCase analysisUseCase;
    private final ContentVerificationService contentVerificationService;

    public CoverageTaskHandlers(CampaignStore campaignStore,
                                BacklinkRecordRepository backlinkRecordRepository,
                                CampaignAnalysisUseCase analysisUseCase,
                                ContentVerificationService contentVerificationService) {
        this.campaignStore = campaignStore;
        this.backlinkRecordRepository = backlinkRecordRepository;
        this.analysisUseCase = analysisUseCase;
        this.contentVerificationService = contentVerificationService;
    }

    public Map<String, Object> execute(Task task, CancellationToken token, IntConsumer progress) {
        return switch (task.type()) {
            case CAMPAIGN_ANALYSIS -> runAnalysis(task, token, progress);
            case CONTENT_VERIFICATION -> runContentVerification(task, token, progress);
            case SCHEDULED_MONITORING -> runMonitoring(task, token, progress);
            case BATCH_UPDATE -> runBatchUpdate(task, token, progress);
        };
    }

    private Map<String, Object> runAnalysis(Task task, CancellationToken token, IntConsumer progress) {
        Campaign campaign = loadCampaign(task.campaignId());
        AnalysisDepth depth = AnalysisDepth.fromParameter(task.parameters().get(PARAM_ANALYSIS_DEPTH));
        return analysisUseCase.analyze(campaign, depth, token, progress).toResultMap();
    }

    private Map<String, Object> runContentVerification(Task task, CancellationToken token, IntConsumer progress) {
        Campaign campaign = loadCampaign(task.campaignId());
        List<String> urls = stringList(task.parameters().get(PARAM_URLS));
        Map<String, Object> result = contentVerificationService.verifyCoverage(campaign, urls, token);
        progress.accept(90);
        return result;
    }

    private Map<String, Object> runMonitoring(Task task, CancellationToken token, IntConsumer progress) {
        Campaign campaign = loadCampaign(task.campaignId());
        List<BacklinkRecord> before = backlinkRecordRepository.queryBacklinkRecords(campaign.id(), BacklinkRecordFilter.all());
        Set<String> verifiedBefore = pairKeys(before, CoverageStatus.VERIFIED);
        Set<String> potentialBefore = pairKeys(before, CoverageStatus.POTENTIAL);

        AnalysisOutcome outcome = analysisUseCase.analyze(campaign, AnalysisDepth.QUICK, token, progress);
        Set<String> verifiedNow = pairKeys(outcome.records(), CoverageStatus.VERIFIED);
        Set<String> potentialNow = pairKeys(outcome.records(), CoverageStatus.POTENTIAL);

        long newVerified = verifiedNow.stream().filter(key -> !verifiedBefore.contains(key)).count();
        long newPotential = potentialNow.stream()
            .filter(key -> !potentialBefore.contains(key) && !verifiedBefore.contains(key))
            .count();
        long lost = verifiedBefore.stream().filter(key -> !verifiedNow.contains(key)).count();
        boolean alert = newVerified > 0 || newPotential > 0 || lost > 0;

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("new_verified_coverage", newVerified);
        changes.put("new_potential_coverage", newPotential);
        changes.put("lost_coverage", lost);
        changes.put("alert_triggered", alert);

        Map<String, Object> result = outcome.toResultMap();
        result.put("previous_verified_coverage", verifiedBefore.size());
        result.put("previous_potential_coverage", potentialBefore.size());
        result.put("significant_changes", changes);
        if (alert) {
            log.info("Monitoring campaign {}: +{} verified, +{} potential, -{} verified",
                campaign.id(), newVerified, newPotential, lost);
        }
        return result;
    }

    private Map<String, Object> runBatchUpdate(Task task, CancellationToken token, IntConsumer progress) {
        List<String> campaignIds = List.copyOf(new LinkedHashSet<>(stringList(task.parameters().get(PARAM_CAMPAIGN_IDS))));
        Map<String, Object> results = new LinkedHashMap<>();
        int successful = 0;
        for (int i = 0; i < campaignIds.size(); i++) {
            token.checkpoint();
            String campaignId = campaignIds.get(i);
            Map<String, Object> entry = updateCampaign(task.ownerId(), campaignId, token);
            results.put(campaignId, entry);
            if ("completed".equals(entry.get("status"))) {
                successful++;
            }
            progress.accept(PROGRESS_BATCH_START + PROGRESS_BATCH_SPAN * (i + 1) / campaignIds.size());
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("campaigns_processed", campaignIds.size());
        result.put("successful_updates", successful);
        result.put("results", results);
        return result;
    }

    private Map<String, Object> updateCampaign(String ownerId, String campaignId, CancellationToken token) {
        Map<String, Object> entry = new LinkedHashMap<>();
        Campaign campaign = campaignStore.getCampaign(campaignId)
            .filter(found -> found.ownerId().equals(ownerId))
            .orElse(null);
        if (campaign == null) {
            entry.put("status", "not_found");
            return entry;
        }
        try {
            AnalysisOutcome outcome = analysisUseCase.analyze(campaign, AnalysisDepth.QUICK, token, ignored -> { });
            entry.put("status", "completed");
            entry.put("total_results", outcome.records().size());
            entry.put("verified_coverage", outcome.verifiedCoverage());
            entry.put("potential_coverage", outcome.potentialCoverage());
        } catch (TaskCancelledException | TaskTimeoutException e) {
            throw e;
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Batch update failed for campaign {}", campaignId);
            entry.put("status", "failed");
            entry.put("error", LoggingUtils.summarize(e));
        }
        return entry;
    }

    private Campaign loadCampaign(String campaignId) {
        return campaignStore.getCampaign(campaignId)
            .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }

    private static Set<String> pairKeys(List<BacklinkRecord> records, CoverageStatus status) {
        Set<String> keys = new HashSet<>();
        for (BacklinkRecord record : records) {
            if (record.coverageStatus() == status) {
                keys.add(record.pairKey());
            }
        }
        return keys;
    }

    /** Reads a list parameter, keeping non-blank string values in order. */
    static List<String> stringList(Object value) {
        List<String> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element != null && !element.toString().isBlank()) {
                    values.add(element.toString().trim());
                }
            }
        } else if (value instanceof String text && !text.isBlank()) {
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    values.add(part.trim());
                }
            }
        }
        return values;
    }
}
