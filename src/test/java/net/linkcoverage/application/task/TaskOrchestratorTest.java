package net.linkcoverage.application.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import net.linkcoverage.application.analysis.CampaignAnalysisUseCase;
import net.linkcoverage.config.AppRateLimiterConfig;
import net.linkcoverage.domain.task.Task;
import net.linkcoverage.domain.task.TaskStatus;
import net.linkcoverage.domain.task.TaskTransition;
import net.linkcoverage.domain.task.TaskType;
import net.linkcoverage.exception.InvalidTaskStateException;
import net.linkcoverage.exception.TaskNotFoundException;
import net.linkcoverage.exception.TaskNotReadyException;
import net.linkcoverage.exception.TaskValidationException;
import net.linkcoverage.model.BacklinkRecord;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.model.MonitoringStatus;
import net.linkcoverage.model.ProviderName;
import net.linkcoverage.model.ProviderQuery;
import net.linkcoverage.model.ProviderQueryResult;
import net.linkcoverage.model.ProviderStatus;
import net.linkcoverage.repository.BacklinkRecordFilter;
import net.linkcoverage.repository.InMemoryBacklinkRecordRepository;
import net.linkcoverage.repository.InMemoryCampaignStore;
import net.linkcoverage.service.aggregation.AggregationEngine;
import net.linkcoverage.service.aggregation.ScoringWeights;
import net.linkcoverage.service.content.ContentVerificationService;
import net.linkcoverage.service.provider.AhrefsClient;
import net.linkcoverage.service.provider.DataForSeoClient;
import net.linkcoverage.service.provider.MockBacklinkDataService;
import net.linkcoverage.service.provider.ProviderCallMonitor;
import net.linkcoverage.service.provider.ProviderGateway;
import net.linkcoverage.service.risk.RiskAssessmentService;
import net.linkcoverage.support.retry.ProviderRetrySupport.RetrySettings;
import net.linkcoverage.support.runtime.RuntimeConfig;
import net.linkcoverage.support.task.InMemoryTaskTransitionLog;
import net.linkcoverage.support.task.TaskWorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskOrchestratorTest {

    private static final String ALICE = "alice@example.com";
    private static final String BOB = "bob@example.com";
    private static final long TASK_TIMEOUT_MILLIS = 5_000;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InMemoryCampaignStore campaignStore;
    private InMemoryBacklinkRecordRepository recordRepository;
    private InMemoryTaskTransitionLog transitionLog;
    private SimpleMeterRegistry meterRegistry;
    private ProviderGateway providerGateway;
    private TaskWorkerPool realPool;

    @BeforeEach
    void setUp() {
        campaignStore = new InMemoryCampaignStore();
        recordRepository = new InMemoryBacklinkRecordRepository();
        transitionLog = new InMemoryTaskTransitionLog();
        meterRegistry = new SimpleMeterRegistry();
        providerGateway = mock(ProviderGateway.class);
        when(providerGateway.configuredProviders()).thenReturn(List.of(ProviderName.AHREFS));
        campaignStore.saveCampaign(campaign("c-1", ALICE));
        campaignStore.saveCampaign(campaign("c-2", ALICE));
        campaignStore.saveCampaign(campaign("c-bob", BOB));
    }

    @AfterEach
    void tearDown() {
        if (realPool != null) {
            realPool.shutdown();
        }
    }

    @Test
    void should_CompleteAnalysisWithCoverageCounts_When_ProviderReturnsRows() throws Exception {
        stubAhrefs(ahrefsPayload(
            row("https://other.com/a", "https://example.com/page", null),
            row("https://other.com/b", "https://elsewhere.net/", "Why acme matters")));
        TaskOrchestrator orchestrator = orchestratorWithRealPool(Duration.ofMinutes(30));

        String taskId = orchestrator.createTask(ALICE, "campaign_analysis", "c-1", Map.of("analysis_depth", "quick"));
        Task done = awaitTerminal(orchestrator, taskId);

        assertThat(done.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(done.progress()).isEqualTo(100);
        assertThat(done.completedAt()).isNotNull();
        Map<String, Object> result = orchestrator.getTaskResult(taskId, ALICE);
        assertThat(result)
            .containsEntry("total_results", 2)
            .containsEntry("verified_coverage", 1L)
            .containsEntry("potential_coverage", 1L);
        assertThat(recordRepository.queryBacklinkRecords("c-1", BacklinkRecordFilter.all())).hasSize(2);
        assertEquals(1.0, meterRegistry.counter("coverage.tasks.completed").count());
    }

    @Test
    void should_KeepStoredResultIntact_When_CallerTriesToModifyIt() {
        stubAhrefs(ahrefsPayload(
            row("https://other.com/a", "https://example.com/page", null),
            row("https://other.com/b", "https://elsewhere.net/", "Why acme matters")));
        TaskOrchestrator orchestrator = orchestratorWithMockPool(Clock.systemUTC());
        String taskId = orchestrator.createTask(ALICE, "campaign_analysis", "c-1", null);
        orchestrator.execute(taskId);

        Map<String, Object> result = orchestrator.getTaskResult(taskId, ALICE);
        assertThatThrownBy(() -> result.put("total_results", 999))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.remove("verified_coverage"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> orchestrator.getTaskStatus(taskId, ALICE).result().clear())
            .isInstanceOf(UnsupportedOperationException.class);

        assertThat(orchestrator.getTaskResult(taskId, ALICE))
            .containsEntry("total_results", 2)
            .containsEntry("verified_coverage", 1L);
    }

    @Test
    void should_CompleteWithMockFallback_When_LiveModeHasNoCredentials() throws Exception {
        RuntimeConfig runtimeConfig = new RuntimeConfig(false);
        ProviderGateway liveGateway = new ProviderGateway(
            runtimeConfig,
            List.of(
                new AhrefsClient(WebClient.builder(), RetrySettings.defaults(), "https://api.ahrefs.com/v3", ""),
                new DataForSeoClient(WebClient.builder(), RetrySettings.defaults(), "https://api.dataforseo.com/v3", "", "")),
            AppRateLimiterConfig.perMinute("ahrefsTest", 60),
            AppRateLimiterConfig.perMinute("dataForSeoTest", 60),
            new MockBacklinkDataService(objectMapper),
            new ProviderCallMonitor());
        realPool = new TaskWorkerPool(2);
        TaskOrchestrator orchestrator = orchestrator(liveGateway, realPool, Duration.ofMinutes(30), Clock.systemUTC());

        String taskId = orchestrator.createTask(ALICE, TaskType.CAMPAIGN_ANALYSIS, "c-1", null);
        Task done = awaitTerminal(orchestrator, taskId);

        assertThat(done.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(done.result()).containsEntry("provider_status",
            Map.of("ahrefs", "auth_error", "dataforseo", "auth_error"));
        assertThat((Integer) done.result().get("total_results")).isPositive();
        assertThat(runtimeConfig.snapshot().providerErrors()).containsKeys("ahrefs", "dataforseo");
    }

    @Test
    void should_RejectInvalidRequests_When_Creating() {
        TaskOrchestrator orchestrator = orchestratorWithMockPool(Clock.systemUTC());

        assertThatThrownBy(() -> orchestrator.createTask(ALICE, "keyword_research", "c-1", null))
            .isInstanceOf(TaskValidationException.class);
        assertThatThrownBy(() -> orchestrator.createTask(" ", "campaign_analysis", "c-1", null))
            .isInstanceOf(TaskValidationException.class);
        assertThatThrownBy(() -> orchestrator.createTask(ALICE, "campaign_analysis", null, null))
            .isInstanceOf(TaskValidationException.class);
        assertThatThrownBy(() -> orchestrator.createTask(ALICE, "campaign_analysis", "missing", null))
            .isInstanceOf(TaskValidationException.class)
            .hasMessage("Campaign not found: missing");
        assertThatThrownBy(() -> orchestrator.createTask(ALICE, "campaign_analysis", "c-bob", null))
            .isInstanceOf(TaskValidationException.class)
            .hasMessage("Campaign not found: c-bob");
        assertThatThrownBy(() -> orchestrator.createTask(ALICE, "campaign_analysis", "c-1", Map.of("analysis_depth", "extreme")))
            .isInstanceOf(TaskValidationException.class);
        assertThatThrownBy(() -> orchestrator.createTask(ALICE, "content_verification", "c-1", Map.of()))
            .isInstanceOf(TaskValidationException.class);
        assertThatThrownBy(() -> orchestrator.createTask(ALICE, "batch_update", null, Map.of("campaign_ids", List.of())))
            .isInstanceOf(TaskValidationException.class);
        assertThat(orchestrator.listTasks(ALICE, null)).isEmpty();
    }

    @Test
    void should_RejectCampaignWithoutTarget_When_CreatingAnalysis() {
        campaignStore.saveCampaign(new Campaign("c-empty", ALICE, null, "Untargeted", null, null, null,
            MonitoringStatus.ACTIVE, List.of(), List.of(), List.of()));
        TaskOrchestrator orchestrator = orchestratorWithMockPool(Clock.systemUTC());

        assertThatThrownBy(() -> orchestrator.createTask(ALICE, "campaign_analysis", "c-empty", null))
            .isInstanceOf(TaskValidationException.class);
    }

    @Test
    void should_CreatePendingTaskWithEstimate_When_RequestValid() {
        TaskWorkerPool pool = mock(TaskWorkerPool.class);
        TaskOrchestrator orchestrator = orchestrator(providerGateway, pool, Duration.ofMinutes(30), Clock.systemUTC());
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("analysis_depth", "deep");
        parameters.put("ignored", null);

        String taskId = orchestrator.createTask(ALICE, "campaign_analysis", "c-1", parameters);

        Task task = orchestrator.getTaskStatus(taskId, ALICE);
        assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.progress()).isZero();
        assertThat(task.estimatedDurationMinutes()).isEqualTo(10);
        assertThat(task.parameters()).containsOnlyKeys("analysis_depth");
        assertThat(transitionLog.readAll()).extracting(TaskTransition::toStatus).containsExactly(TaskStatus.PENDING);
        verify(pool).submit(eq(taskId), any(Runnable.class));
    }

    @Test
    void should_HideTaskFromOtherUsers_When_Queried() {
        TaskOrchestrator orchestrator = orchestratorWithMockPool(Clock.systemUTC());
        String taskId = orchestrator.createTask(ALICE, "campaign_analysis", "c-1", null);

        assertThatThrownBy(() -> orchestrator.getTaskStatus(taskId, BOB)).isInstanceOf(TaskNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.getTaskResult(taskId, BOB)).isInstanceOf(TaskNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.cancelTask(taskId, BOB)).isInstanceOf(TaskNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.getTaskStatus("no-such-task", ALICE)).isInstanceOf(TaskNotFoundException.class);
        assertThat(orchestrator.listTasks(BOB, null)).isEmpty();
    }

    @Test
    void should_RefuseResult_When_TaskNotCompleted() {
        TaskOrchestrator orchestrator = orchestratorWithMockPool(Clock.systemUTC());
        String taskId = orchestrator.createTask(ALICE, "campaign_analysis", "c-1", null);

        assertThatThrownBy(() -> orchestrator.getTaskResult(taskId, ALICE))
            .isInstanceOf(TaskNotReadyException.class)
            .satisfies(error -> assertThat(((TaskNotReadyException) error).getStatus()).isEqualTo(TaskStatus.PENDING));
    }

    @Test
    void should_CancelPendingTaskAndRejectSecondCancel_When_Requested() {
        TaskWorkerPool pool = mock(TaskWorkerPool.class);
        TaskOrchestrator orchestrator = orchestrator(providerGateway, pool, Duration.ofMinutes(30), Clock.systemUTC());
        String taskId = orchestrator.createTask(ALICE, "campaign_analysis", "c-1", null);

        Task cancelled = orchestrator.cancelTask(taskId, ALICE);
        orchestrator.execute(taskId);

        assertThat(cancelled.status()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(orchestrator.getTaskStatus(taskId, ALICE).status()).isEqualTo(TaskStatus.CANCELLED);
        assertThatThrownBy(() -> orchestrator.cancelTask(taskId, ALICE))
            .isInstanceOf(InvalidTaskStateException.class);
        verify(pool).cancelPending(taskId);
    }

    @Test
    void should_DiscardLateResult_When_RunningTaskCancelled() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch releaseFetch = new CountDownLatch(1);
        ProviderQueryResult payload = ahrefsResult(ahrefsPayload(row("https://other.com/a", "https://example.com/", null)));
        when(providerGateway.fetchAsync(eq(ProviderName.AHREFS), any(ProviderQuery.class)))
            .thenReturn(Mono.fromCallable(() -> {
                fetchStarted.countDown();
                releaseFetch.await(TASK_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
                return payload;
            }));
        TaskOrchestrator orchestrator = orchestratorWithRealPool(Duration.ofMinutes(30));
        String taskId = orchestrator.createTask(ALICE, "campaign_analysis", "c-1", null);
        assertTrue(fetchStarted.await(TASK_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS));

        orchestrator.cancelTask(taskId, ALICE);
        releaseFetch.countDown();
        awaitIdle();

        assertThat(orchestrator.getTaskStatus(taskId, ALICE).status()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(recordRepository.queryBacklinkRecords("c-1", BacklinkRecordFilter.all())).isEmpty();
        assertThat(transitionLog.readAll()).extracting(TaskTransition::toStatus)
            .containsExactly(TaskStatus.PENDING, TaskStatus.RUNNING, TaskStatus.CANCELLED);
    }

    @Test
    void should_FailTask_When_DeadlineElapses() {
        when(providerGateway.fetchAsync(eq(ProviderName.AHREFS), any(ProviderQuery.class))).thenReturn(Mono.never());
        TaskOrchestrator orchestrator = orchestrator(providerGateway, mock(TaskWorkerPool.class),
            Duration.ofMillis(200), Clock.systemUTC());
        String taskId = orchestrator.createTask(ALICE, "campaign_analysis", "c-1", null);

        orchestrator.execute(taskId);

        Task task = orchestrator.getTaskStatus(taskId, ALICE);
        assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.errorMessage()).contains("deadline");
        assertThat(task.result()).isNull();
        assertEquals(1.0, meterRegistry.counter("coverage.tasks.failed").count());
    }

    @Test
    void should_FailWithSanitizedMessage_When_HandlerThrows() {
        when(providerGateway.fetchAsync(eq(ProviderName.AHREFS), any(ProviderQuery.class)))
            .thenReturn(Mono.error(new IllegalStateException("provider\n  exploded")));
        TaskOrchestrator orchestrator = orchestratorWithMockPool(Clock.systemUTC());
        String taskId = orchestrator.createTask(ALICE, "campaign_analysis", "c-1", null);

        orchestrator.execute(taskId);

        Task task = orchestrator.getTaskStatus(taskId, ALICE);
        assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.errorMessage()).isEqualTo("provider exploded");
        assertThat(task.progress()).isEqualTo(TaskOrchestrator.PROGRESS_STARTED);
    }

    @Test
    void should_ListNewestFirstWithLimitAndFilter_When_Listing() {
        Clock fixed = Clock.fixed(Instant.parse("2025-10-01T10:00:00Z"), ZoneOffset.UTC);
        TaskOrchestrator orchestrator = orchestratorWithMockPool(fixed);
        String first = orchestrator.createTask(ALICE, "campaign_analysis", "c-1", null);
        String second = orchestrator.createTask(ALICE, "scheduled_monitoring", "c-1", null);
        String third = orchestrator.createTask(ALICE, "campaign_analysis", "c-2", null);
        orchestrator.createTask(BOB, "campaign_analysis", "c-bob", null);
        orchestrator.cancelTask(second, ALICE);

        assertThat(orchestrator.listTasks(ALICE, null)).extracting(Task::id).containsExactly(third, second, first);
        assertThat(orchestrator.listTasks(ALICE, null, 2)).extracting(Task::id).containsExactly(third, second);
        assertThat(orchestrator.listTasks(ALICE, null, 0)).hasSize(1);
        assertThat(orchestrator.listTasks(ALICE, TaskStatus.PENDING)).extracting(Task::id).containsExactly(third, first);
        assertThat(orchestrator.listTasks(ALICE, TaskStatus.CANCELLED)).extracting(Task::id).containsExactly(second);
    }

    @Test
    void should_FailInterruptedTasksAndDropExpired_When_RecoveringFromLog() {
        Instant now = Instant.parse("2025-10-10T00:00:00Z");
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        Task interrupted = loggedTask("t-running", TaskStatus.RUNNING, now.minusSeconds(60), null, null);
        Task recent = loggedTask("t-recent", TaskStatus.COMPLETED, now.minusSeconds(3600), now.minusSeconds(3000),
            Map.of("total_results", 3));
        Task stale = loggedTask("t-stale", TaskStatus.COMPLETED, now.minus(Duration.ofDays(5)),
            now.minus(Duration.ofDays(5)), Map.of("total_results", 1));
        transitionLog.append(new TaskTransition(1, "t-running", TaskStatus.PENDING, TaskStatus.RUNNING, now, interrupted));
        transitionLog.append(new TaskTransition(2, "t-recent", TaskStatus.RUNNING, TaskStatus.COMPLETED, now, recent));
        transitionLog.append(new TaskTransition(3, "t-stale", TaskStatus.RUNNING, TaskStatus.COMPLETED, now, stale));

        TaskOrchestrator orchestrator = orchestratorWithMockPool(clock);
        orchestrator.recoverFromLog();

        Task failed = orchestrator.getTaskStatus("t-running", ALICE);
        assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(failed.errorMessage()).isEqualTo(TaskOrchestrator.RESTART_INTERRUPTED_MESSAGE);
        assertThat(orchestrator.getTaskResult("t-recent", ALICE)).containsEntry("total_results", 3);
        assertThatThrownBy(() -> orchestrator.getTaskStatus("t-stale", ALICE)).isInstanceOf(TaskNotFoundException.class);
        assertThat(transitionLog.readAll()).last().extracting(TaskTransition::sequence).isEqualTo(4L);
    }

    @Test
    void should_PurgeTerminalTasksPastRetention_When_Swept() {
        MutableClock clock = new MutableClock(Instant.parse("2025-10-01T00:00:00Z"));
        TaskOrchestrator orchestrator = orchestrator(providerGateway, mock(TaskWorkerPool.class),
            Duration.ofMinutes(30), clock);
        String cancelled = orchestrator.createTask(ALICE, "campaign_analysis", "c-1", null);
        String pending = orchestrator.createTask(ALICE, "campaign_analysis", "c-2", null);
        orchestrator.cancelTask(cancelled, ALICE);

        clock.advance(Duration.ofHours(73));
        int removed = orchestrator.purgeExpiredTasks();

        assertThat(removed).isEqualTo(1);
        assertThatThrownBy(() -> orchestrator.getTaskStatus(cancelled, ALICE)).isInstanceOf(TaskNotFoundException.class);
        assertThat(orchestrator.getTaskStatus(pending, ALICE).status()).isEqualTo(TaskStatus.PENDING);
    }

    @Test
    void should_ReportCoverageChanges_When_MonitoringRunsAfterAnalysis() {
        when(providerGateway.fetchAsync(eq(ProviderName.AHREFS), any(ProviderQuery.class)))
            .thenReturn(Mono.just(ahrefsResult(ahrefsPayload(
                row("https://other.com/a", "https://example.com/page", null),
                row("https://other.com/b", "https://elsewhere.net/", "acme notes")))))
            .thenReturn(Mono.just(ahrefsResult(ahrefsPayload(
                row("https://other.com/a", "https://example.com/page", null),
                row("https://other.com/b", "https://elsewhere.net/", "acme notes"),
                row("https://fresh.site/c", "https://example.com/", null)))));
        TaskOrchestrator orchestrator = orchestratorWithMockPool(Clock.systemUTC());

        String analysis = orchestrator.createTask(ALICE, "campaign_analysis", "c-1", null);
        orchestrator.execute(analysis);
        String monitoring = orchestrator.createTask(ALICE, "scheduled_monitoring", "c-1", null);
        orchestrator.execute(monitoring);

        Map<String, Object> result = orchestrator.getTaskResult(monitoring, ALICE);
        assertThat(result)
            .containsEntry("previous_verified_coverage", 1)
            .containsEntry("previous_potential_coverage", 1)
            .containsEntry("analysis_depth", "quick");
        assertThat(result.get("significant_changes")).isEqualTo(Map.of(
            "new_verified_coverage", 1L,
            "new_potential_coverage", 0L,
            "lost_coverage", 0L,
            "alert_triggered", true));
    }

    @Test
    void should_ReportPerCampaignOutcome_When_BatchUpdating() {
        when(providerGateway.fetchAsync(eq(ProviderName.AHREFS), any(ProviderQuery.class)))
            .thenReturn(Mono.just(ahrefsResult(ahrefsPayload(row("https://other.com/a", "https://example.com/", null)))));
        TaskOrchestrator orchestrator = orchestratorWithMockPool(Clock.systemUTC());

        String taskId = orchestrator.createTask(ALICE, "batch_update", null,
            Map.of("campaign_ids", List.of("c-1", "c-1", "c-bob", "c-2")));
        orchestrator.execute(taskId);

        Map<String, Object> result = orchestrator.getTaskResult(taskId, ALICE);
        assertThat(result)
            .containsEntry("campaigns_processed", 3)
            .containsEntry("successful_updates", 2);
        @SuppressWarnings("unchecked")
        Map<String, Map<String, Object>> perCampaign = (Map<String, Map<String, Object>>) result.get("results");
        assertThat(perCampaign).containsOnlyKeys("c-1", "c-bob", "c-2");
        assertThat(perCampaign.get("c-bob")).containsEntry("status", "not_found");
        assertThat(perCampaign.get("c-1")).containsEntry("status", "completed").containsEntry("verified_coverage", 1L);
    }

    @Test
    void should_VerifyUrls_When_ContentVerificationRuns() {
        TaskOrchestrator orchestrator = orchestratorWithMockPool(Clock.systemUTC());

        String taskId = orchestrator.createTask(ALICE, "content_verification", "c-1",
            Map.of("urls", "https://news.site/a, https://news.site/b"));
        orchestrator.execute(taskId);

        Map<String, Object> result = orchestrator.getTaskResult(taskId, ALICE);
        assertThat(result).containsEntry("urls_checked", 2).containsEntry("verified_count", 0L);
    }

    @Test
    void should_FlattenAndTruncate_When_SanitizingErrors() {
        assertThat(TaskOrchestrator.sanitizeError(new IllegalStateException())).isEqualTo("IllegalStateException");
        assertThat(TaskOrchestrator.sanitizeError(new RuntimeException("x".repeat(300)))).hasSize(200);
    }

    private TaskOrchestrator orchestratorWithRealPool(Duration deadline) {
        realPool = new TaskWorkerPool(2);
        return orchestrator(providerGateway, realPool, deadline, Clock.systemUTC());
    }

    private TaskOrchestrator orchestratorWithMockPool(Clock clock) {
        return orchestrator(providerGateway, mock(TaskWorkerPool.class), Duration.ofMinutes(30), clock);
    }

    private TaskOrchestrator orchestrator(ProviderGateway gateway, TaskWorkerPool pool, Duration deadline, Clock clock) {
        CampaignAnalysisUseCase useCase = new CampaignAnalysisUseCase(gateway,
            new AggregationEngine(ScoringWeights.defaults()), recordRepository, new RiskAssessmentService());
        CoverageTaskHandlers handlers = new CoverageTaskHandlers(campaignStore, recordRepository, useCase,
            contentVerificationService());
        return new TaskOrchestrator(campaignStore, pool, transitionLog, handlers, meterRegistry,
            deadline, Duration.ofHours(72), clock);
    }

    private static ContentVerificationService contentVerificationService() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> Mono.just(
            ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, "text/html")
                .body("<html><head><title>Weather</title></head><body><p>Sunny.</p></body></html>")
                .build()));
        return new ContentVerificationService(builder, 50, 2, 0.6);
    }

    private void stubAhrefs(ObjectNode payload) {
        when(providerGateway.fetchAsync(eq(ProviderName.AHREFS), any(ProviderQuery.class)))
            .thenReturn(Mono.just(ahrefsResult(payload)));
    }

    private Task awaitTerminal(TaskOrchestrator orchestrator, String taskId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TASK_TIMEOUT_MILLIS;
        Task task = orchestrator.getTaskStatus(taskId, ALICE);
        while (!task.status().isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
            task = orchestrator.getTaskStatus(taskId, ALICE);
        }
        assertTrue(task.status().isTerminal(), "Task did not finish in time: " + task.status());
        return task;
    }

    private void awaitIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + TASK_TIMEOUT_MILLIS;
        while (realPool.snapshot().running() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(realPool.snapshot().running()).isZero();
    }

    private ObjectNode ahrefsPayload(ObjectNode... rows) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode backlinks = payload.putArray("backlinks");
        for (ObjectNode row : rows) {
            backlinks.add(row);
        }
        return payload;
    }

    private ObjectNode row(String from, String to, String title) {
        ObjectNode row = objectMapper.createObjectNode().put("url_from", from).put("url_to", to);
        if (title != null) {
            row.put("title", title);
        }
        return row;
    }

    private static ProviderQueryResult ahrefsResult(ObjectNode payload) {
        return ProviderQueryResult.live(ProviderName.AHREFS, ProviderStatus.OK, payload);
    }

    private static Task loggedTask(String id, TaskStatus status, Instant createdAt, Instant completedAt,
                                   Map<String, Object> result) {
        return new Task(id, TaskType.CAMPAIGN_ANALYSIS, status, ALICE, "c-1", Map.of(), status.isTerminal() ? 100 : 40,
            createdAt, createdAt, completedAt, 10, null, result);
    }

    private static Campaign campaign(String id, String owner) {
        return new Campaign(id, owner, "Acme", "Launch " + id, "example.com", "https://example.com/",
            null, MonitoringStatus.ACTIVE, List.of(), List.of("acme"), List.of());
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        private MutableClock(Instant start) {
            this.now = start;
        }

        private void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
