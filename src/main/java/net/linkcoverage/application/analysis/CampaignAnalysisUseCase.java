package net.linkcoverage.application.analysis;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.TimeoutException;
import java.util.function.IntConsumer;
import net.linkcoverage.exception.AllProvidersFailedException;
import net.linkcoverage.exception.TaskCancelledException;
import net.linkcoverage.exception.TaskValidationException;
import net.linkcoverage.model.AnalysisDepth;
import net.linkcoverage.model.BacklinkRecord;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.model.CoverageStatus;
import net.linkcoverage.model.ProviderName;
import net.linkcoverage.model.ProviderQuery;
import net.linkcoverage.model.ProviderQueryResult;
import net.linkcoverage.model.ProviderStatus;
import net.linkcoverage.model.RiskAlert;
import net.linkcoverage.model.RiskAssessment;
import net.linkcoverage.repository.BacklinkRecordRepository;
import net.linkcoverage.service.aggregation.AggregationEngine;
import net.linkcoverage.service.aggregation.AggregationResult;
import net.linkcoverage.service.provider.ProviderGateway;
import net.linkcoverage.service.risk.RiskAssessmentService;
import net.linkcoverage.support.task.CancellationToken;
import net.linkcoverage.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Application use case that runs one campaign analysis end to end.
 *
 * <p>Phases: fetch every configured provider in parallel, aggregate, persist, assess risk. The
 * cancellation token is checked before provider calls and before persistence, so a cancelled
 * analysis never writes records. Providers answering {@code rate_limited} are retried by the
 * caller with a short backoff while the task deadline allows; a provider that fails in any other
 * way has already been resolved with mock data by the gateway.</p>
 */
@Service
public class CampaignAnalysisUseCase {

    private static final Logger log = LoggerFactory.getLogger(CampaignAnalysisUseCase.class);

    static final int PROGRESS_FETCHED = 40;
    static final int PROGRESS_AGGREGATED = 70;
    static final int PROGRESS_PERSISTED = 90;

    private static final int DEFAULT_RATE_LIMIT_RETRIES = 2;
    private static final Duration DEFAULT_RATE_LIMIT_BACKOFF = Duration.ofSeconds(2);

    private final ProviderGateway providerGateway;
    private final AggregationEngine aggregationEngine;
    private final BacklinkRecordRepository backlinkRecordRepository;
    private final RiskAssessmentService riskAssessmentService;
    private final int rateLimitRetries;
    private final Duration rateLimitBackoff;

    @Autowired
    public CampaignAnalysisUseCase(ProviderGateway providerGateway,
                                   AggregationEngine aggregationEngine,
                                   BacklinkRecordRepository backlinkRecordRepository,
                                   RiskAssessmentService riskAssessmentService) {
        this(providerGateway, aggregationEngine, backlinkRecordRepository, riskAssessmentService,
            DEFAULT_RATE_LIMIT_RETRIES, DEFAULT_RATE_LIMIT_BACKOFF);
    }

    CampaignAnalysisUseCase(ProviderGateway providerGateway,
                            AggregationEngine aggregationEngine,
                            BacklinkRecordRepository backlinkRecordRepository,
                            RiskAssessmentService riskAssessmentService,
                            int rateLimitRetries,
                            Duration rateLimitBackoff) {
        this.providerGateway = providerGateway;
        this.aggregationEngine = aggregationEngine;
        this.backlinkRecordRepository = backlinkRecordRepository;
        this.riskAssessmentService = riskAssessmentService;
        this.rateLimitRetries = Math.max(0, rateLimitRetries);
        this.rateLimitBackoff = rateLimitBackoff;
    }

    /**
     * Runs the analysis for one campaign.
     *
     * @param progress receives the milestone reached after each phase
     * @throws AllProvidersFailedException when no provider produced data
     * @throws TaskCancelledException when cancellation was observed at a checkpoint
     * @throws net.linkcoverage.exception.TaskTimeoutException when the deadline elapsed
     */
    public AnalysisOutcome analyze(Campaign campaign, AnalysisDepth depth, CancellationToken token, IntConsumer progress) {
        ProviderQuery query = buildQuery(campaign, depth);

        List<ProviderQueryResult> results = fetchWithBackoff(query, token);
        if (results.stream().noneMatch(ProviderQueryResult::hasPayload)) {
            throw new AllProvidersFailedException("No provider returned data: " + describe(results));
        }
        progress.accept(PROGRESS_FETCHED);

        AggregationResult aggregation = aggregationEngine.aggregate(campaign, results);
        progress.accept(PROGRESS_AGGREGATED);

        token.checkpoint();
        int written = backlinkRecordRepository.upsertBacklinkRecords(campaign.id(), aggregation.records());
        progress.accept(PROGRESS_PERSISTED);

        RiskAssessment risk = riskAssessmentService.assessRisk(aggregation.records());
        Map<ProviderName, ProviderStatus> statuses = new EnumMap<>(ProviderName.class);
        for (ProviderQueryResult result : results) {
            statuses.put(result.provider(), result.status());
        }
        log.info("Campaign {} analysis ({}): {} records persisted, {} verified, {} potential, {} excluded, providers={}",
            campaign.id(), depth.wireValue(), written,
            aggregation.count(CoverageStatus.VERIFIED), aggregation.count(CoverageStatus.POTENTIAL),
            aggregation.diagnostics().excludedCount(), describe(results));
        return new AnalysisOutcome(campaign.id(), depth, aggregation, statuses, risk);
    }

    static ProviderQuery buildQuery(Campaign campaign, AnalysisDepth depth) {
        String domain = UrlUtils.normalizeDomain(campaign.clientDomain());
        if (domain == null) {
            domain = UrlUtils.extractDomain(campaign.campaignUrl());
        }
        if (domain == null) {
            throw new TaskValidationException("Campaign " + campaign.id() + " has neither a client domain nor a campaign URL");
        }
        String target = UrlUtils.normalize(campaign.campaignUrl());
        return new ProviderQuery(domain, target == null ? "https://" + domain : target, depth.providerLimit());
    }

    private List<ProviderQueryResult> fetchWithBackoff(ProviderQuery query, CancellationToken token) {
        List<ProviderName> providers = providerGateway.configuredProviders();
        Map<ProviderName, ProviderQueryResult> latest = new LinkedHashMap<>();
        for (ProviderQueryResult result : fetchAll(providers, query, token)) {
            latest.put(result.provider(), result);
        }

        for (int attempt = 1; attempt <= rateLimitRetries; attempt++) {
            List<ProviderName> limited = new ArrayList<>();
            latest.forEach((provider, result) -> {
                if (result.status() == ProviderStatus.RATE_LIMITED) {
                    limited.add(provider);
                }
            });
            if (limited.isEmpty()) {
                break;
            }
            Duration backoff = rateLimitBackoff.multipliedBy(1L << (attempt - 1));
            if (backoff.compareTo(token.remaining()) >= 0) {
                log.info("Skipping rate-limit retry for {}: backoff {} exceeds remaining task time", limited, backoff);
                break;
            }
            log.info("Providers {} rate limited; retry {}/{} in {} ms", limited, attempt, rateLimitRetries, backoff.toMillis());
            sleep(backoff, token);
            for (ProviderQueryResult result : fetchAll(limited, query, token)) {
                latest.put(result.provider(), result);
            }
        }
        return List.copyOf(latest.values());
    }

    private List<ProviderQueryResult> fetchAll(List<ProviderName> providers, ProviderQuery query, CancellationToken token) {
        token.checkpoint();
        List<ProviderQueryResult> results = Flux.fromIterable(providers)
            .flatMapSequential(provider -> providerGateway.fetchAsync(provider, query))
            .collectList()
            .timeout(token.remaining())
            .onErrorMap(TimeoutException.class, ex -> token.timeoutError())
            .block();
        return results == null ? List.of() : results;
    }

    private static void sleep(Duration backoff, CancellationToken token) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException(token.taskId());
        }
        token.checkpoint();
    }

    private static String describe(List<ProviderQueryResult> results) {
        StringJoiner joiner = new StringJoiner(", ");
        for (ProviderQueryResult result : results) {
            joiner.add(result.provider().key() + "=" + result.status().wireValue() + (result.mockData() ? " (mock)" : ""));
        }
        return joiner.toString();
    }

    /**
     * Everything one analysis produced.
     *
     * @param providerStatuses final status per provider after any rate-limit retries
     */
    public record AnalysisOutcome(String campaignId,
                                  AnalysisDepth depth,
                                  AggregationResult aggregation,
                                  Map<ProviderName, ProviderStatus> providerStatuses,
                                  RiskAssessment risk) {

        public List<BacklinkRecord> records() {
            return aggregation.records();
        }

        public long verifiedCoverage() {
            return aggregation.count(CoverageStatus.VERIFIED);
        }

        public long potentialCoverage() {
            return aggregation.count(CoverageStatus.POTENTIAL);
        }

        /** Task result payload for a campaign analysis. */
        public Map<String, Object> toResultMap() {
            AggregationResult.Diagnostics diagnostics = aggregation.diagnostics();
            Map<String, Object> providerStatus = new LinkedHashMap<>();
            providerStatuses.forEach((provider, status) -> providerStatus.put(provider.key(), status.wireValue()));

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("campaign_id", campaignId);
            result.put("total_results", aggregation.records().size());
            result.put("verified_coverage", verifiedCoverage());
            result.put("potential_coverage", potentialCoverage());
            result.put("excluded_count", diagnostics.excludedCount());
            result.put("skipped_entries", diagnostics.skippedEntries());
            result.put("duplicates_merged", diagnostics.duplicatesMerged());
            result.put("provider_status", providerStatus);
            result.put("risk_summary", new LinkedHashMap<>(risk.severityCounts()));
            result.put("risk_alerts", risk.alerts().stream().map(AnalysisOutcome::alertMap).toList());
            result.put("analysis_depth", depth.wireValue());
            return result;
        }

        private static Map<String, Object> alertMap(RiskAlert alert) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("risk_type", alert.riskType());
            map.put("severity", alert.severity().wireValue());
            map.put("description", alert.description());
            map.put("affected_urls", alert.affectedUrls());
            map.put("recommendation", alert.recommendation());
            Instant detectedAt = alert.detectedAt();
            map.put("detected_at", detectedAt.toString());
            return map;
        }
    }
}
