package net.linkcoverage.application.task;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.Nullable;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.domain.task.Task;
import net.linkcoverage.domain.task.TaskStatus;
import net.linkcoverage.domain.task.TaskTransition;
import net.linkcoverage.domain.task.TaskType;
import net.linkcoverage.exception.InvalidTaskStateException;
import net.linkcoverage.exception.TaskCancelledException;
import net.linkcoverage.exception.TaskNotFoundException;
import net.linkcoverage.exception.TaskNotReadyException;
import net.linkcoverage.exception.TaskTimeoutException;
import net.linkcoverage.exception.TaskValidationException;
import net.linkcoverage.model.AnalysisDepth;
import net.linkcoverage.model.Campaign;
import net.linkcoverage.repository.CampaignStore;
import net.linkcoverage.support.task.CancellationToken;
import net.linkcoverage.support.task.TaskTransitionLog;
import net.linkcoverage.support.task.TaskWorkerPool;
import net.linkcoverage.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Owns the lifecycle of background coverage tasks.
 *
 * <p>Tasks live in an in-memory table of immutable {@link Task} snapshots keyed by id. Every
 * status change goes through {@link #commit}, which validates the transition, swaps the snapshot
 * and appends it to the transition log while holding the orchestrator lock, so readers always
 * see the latest committed state of a task and never a half-applied one.</p>
 *
 * <p>Work is queued on the {@link TaskWorkerPool}; {@link #createTask} never blocks on provider
 * I/O. Cancellation is cooperative: a running worker stops at its next checkpoint and any result
 * it produces afterwards is discarded.</p>
 */
@Slf4j
@Service
public class TaskOrchestrator {

    static final int DEFAULT_LIST_LIMIT = 50;
    static final int MAX_LIST_LIMIT = 100;
    static final int PROGRESS_STARTED = 10;
    static final int PROGRESS_DONE = 100;
    static final String RESTART_INTERRUPTED_MESSAGE = "Interrupted by service restart";
    private static final int MAX_ERROR_MESSAGE_LENGTH = 200;

    private final CampaignStore campaignStore;
    private final TaskWorkerPool workerPool;
    private final TaskTransitionLog transitionLog;
    private final CoverageTaskHandlers handlers;
    private final Duration taskDeadline;
    private final Duration retention;
    private final Clock clock;

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Map<String, Long> creationOrder = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong creationCounter = new AtomicLong();

    private final Counter tasksCreated;
    private final Counter tasksCompleted;
    private final Counter tasksFailed;
    private final Counter tasksCancelled;
    private final Timer taskDuration;

    @Autowired
    public TaskOrchestrator(CampaignStore campaignStore,
                            TaskWorkerPool workerPool,
                            TaskTransitionLog transitionLog,
                            CoverageTaskHandlers handlers,
                            MeterRegistry meterRegistry,
                            @Value("${app.tasks.deadline-minutes:30}") long deadlineMinutes,
                            @Value("${app.tasks.retention-hours:72}") long retentionHours) {
        this(campaignStore, workerPool, transitionLog, handlers, meterRegistry,
            Duration.ofMinutes(deadlineMinutes), Duration.ofHours(retentionHours), Clock.systemUTC());
    }

    TaskOrchestrator(CampaignStore campaignStore,
                     TaskWorkerPool workerPool,
                     TaskTransitionLog transitionLog,
                     CoverageTaskHandlers handlers,
                     MeterRegistry meterRegistry,
                     Duration taskDeadline,
                     Duration retention,
                     Clock clock) {
        if (taskDeadline.isZero() || taskDeadline.isNegative()) {
            throw new IllegalArgumentException("app.tasks.deadline-minutes must be > 0");
        }
        this.campaignStore = campaignStore;
        this.workerPool = workerPool;
        this.transitionLog = transitionLog;
        this.handlers = handlers;
        this.taskDeadline = taskDeadline;
        this.retention = retention;
        this.clock = clock;
        this.tasksCreated = meterRegistry.counter("coverage.tasks.created");
        this.tasksCompleted = meterRegistry.counter("coverage.tasks.completed");
        this.tasksFailed = meterRegistry.counter("coverage.tasks.failed");
        this.tasksCancelled = meterRegistry.counter("coverage.tasks.cancelled");
        this.taskDuration = meterRegistry.timer("coverage.tasks.duration");
    }

    /**
     * Validates and queues a task.
     *
     * @param type task type wire value, e.g. {@code campaign_analysis}
     * @return id of the new pending task
     * @throws TaskValidationException for unknown types, unknown campaigns or missing parameters
     */
    public String createTask(String ownerId, String type, @Nullable String campaignId, @Nullable Map<String, Object> parameters) {
        return createTask(ownerId, TaskType.fromWireValue(type), campaignId, parameters);
    }

    public String createTask(String ownerId, TaskType type, @Nullable String campaignId, @Nullable Map<String, Object> parameters) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new TaskValidationException("Requesting user is required");
        }
        Map<String, Object> cleanParameters = cleanParameters(parameters);
        String resolvedCampaignId = validate(ownerId, type, campaignId, cleanParameters);

        String taskId = UUID.randomUUID().toString();
        Task task = new Task(taskId, type, TaskStatus.PENDING, ownerId, resolvedCampaignId, cleanParameters, 0,
            clock.instant(), null, null, type.estimatedDurationMinutes(), null, null);
        synchronized (this) {
            creationOrder.put(taskId, creationCounter.incrementAndGet());
            commit(null, task);
        }
        tasksCreated.increment();
        workerPool.submit(taskId, () -> execute(taskId));
        log.info("Created {} task {} for user {} (campaign {})", type.wireValue(), taskId, ownerId, resolvedCampaignId);
        return taskId;
    }

    /**
     * @throws TaskNotFoundException when the task is unknown or owned by someone else
     */
    public Task getTaskStatus(String taskId, String requestingUser) {
        return visibleTask(taskId, requestingUser);
    }

    /**
     * @throws TaskNotReadyException when the task has not completed
     */
    public Map<String, Object> getTaskResult(String taskId, String requestingUser) {
        Task task = visibleTask(taskId, requestingUser);
        if (task.status() != TaskStatus.COMPLETED || task.result() == null) {
            throw new TaskNotReadyException(taskId, task.status());
        }
        return task.result();
    }

    public List<Task> listTasks(String requestingUser, @Nullable TaskStatus statusFilter) {
        return listTasks(requestingUser, statusFilter, null);
    }

    /**
     * Tasks owned by the user, most recently created first.
     *
     * @param limit defaults to 50, clamped to 1..100
     */
    public List<Task> listTasks(String requestingUser, @Nullable TaskStatus statusFilter, @Nullable Integer limit) {
        int effectiveLimit = limit == null ? DEFAULT_LIST_LIMIT : Math.max(1, Math.min(MAX_LIST_LIMIT, limit));
        return tasks.values().stream()
            .filter(task -> task.ownerId().equals(requestingUser))
            .filter(task -> statusFilter == null || task.status() == statusFilter)
            .sorted(Comparator.comparing(Task::createdAt)
                .thenComparing(task -> creationOrder.getOrDefault(task.id(), 0L))
                .reversed())
            .limit(effectiveLimit)
            .toList();
    }

    /**
     * Cancels a pending or running task. A running worker is signalled and stops at its next
     * checkpoint.
     *
     * @throws InvalidTaskStateException when the task is already terminal
     */
    public Task cancelTask(String taskId, String requestingUser) {
        Task cancelled;
        synchronized (this) {
            Task current = visibleTask(taskId, requestingUser);
            if (current.status().isTerminal()) {
                throw new InvalidTaskStateException(taskId, current.status());
            }
            cancelled = commit(current, withStatus(current, TaskStatus.CANCELLED, current.progress(), null, null));
            CancellationToken token = tokens.get(taskId);
            if (token != null) {
                token.cancel();
            }
        }
        workerPool.cancelPending(taskId);
        tasksCancelled.increment();
        log.info("Cancelled task {} for user {}", taskId, requestingUser);
        return cancelled;
    }

    /**
     * Drops terminal tasks that finished before the retention window.
     *
     * @return number of tasks removed
     */
    public synchronized int purgeExpiredTasks() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        for (Task task : List.copyOf(tasks.values())) {
            if (isExpired(task, cutoff)) {
                tasks.remove(task.id());
                creationOrder.remove(task.id());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Purged {} terminal task(s) completed before {}", removed, cutoff);
        }
        return removed;
    }

    /**
     * Rebuilds the task table from the transition log. Tasks that were pending or running when
     * the previous process stopped are failed, not re-executed.
     */
    @PostConstruct
    public synchronized void recoverFromLog() {
        List<TaskTransition> transitions;
        try {
            transitions = transitionLog.readAll();
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Task transition log could not be read; starting with an empty task table");
            return;
        }
        Map<String, Task> lastKnown = new LinkedHashMap<>();
        long maxSequence = 0;
        for (TaskTransition transition : transitions) {
            lastKnown.put(transition.taskId(), transition.snapshot());
            maxSequence = Math.max(maxSequence, transition.sequence());
        }
        sequence.set(Math.max(sequence.get(), maxSequence));

        Instant cutoff = clock.instant().minus(retention);
        int restored = 0;
        int interrupted = 0;
        for (Task task : lastKnown.values()) {
            if (isExpired(task, cutoff)) {
                continue;
            }
            tasks.put(task.id(), task);
            creationOrder.put(task.id(), creationCounter.incrementAndGet());
            restored++;
            if (!task.status().isTerminal()) {
                commit(task, withStatus(task, TaskStatus.FAILED, task.progress(), RESTART_INTERRUPTED_MESSAGE, null));
                interrupted++;
            }
        }
        if (restored > 0) {
            log.info("Recovered {} task(s) from transition log; {} marked failed after restart", restored, interrupted);
        }
    }

    void execute(String taskId) {
        Task running;
        CancellationToken token;
        synchronized (this) {
            Task current = tasks.get(taskId);
            if (current == null || current.status() != TaskStatus.PENDING) {
                log.debug("Skipping task {}: no longer pending", taskId);
                return;
            }
            token = new CancellationToken(taskId, taskDeadline, clock);
            tokens.put(taskId, token);
            running = commit(current, new Task(current.id(), current.type(), TaskStatus.RUNNING, current.ownerId(),
                current.campaignId(), current.parameters(), PROGRESS_STARTED, current.createdAt(), clock.instant(),
                null, current.estimatedDurationMinutes(), null, null));
        }

        Timer.Sample sample = Timer.start();
        try {
            Map<String, Object> result = handlers.execute(running, token, progress -> updateProgress(taskId, progress));
            if (token.isExpired()) {
                throw token.timeoutError();
            }
            finish(taskId, TaskStatus.COMPLETED, null, result);
        } catch (TaskCancelledException e) {
            log.info("Task {} stopped at a cancellation checkpoint", taskId);
        } catch (TaskTimeoutException e) {
            log.warn("Task {} timed out: {}", taskId, e.getMessage());
            finish(taskId, TaskStatus.FAILED, e.getMessage(), null);
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Task {} ({}) failed", taskId, running.type().wireValue());
            finish(taskId, TaskStatus.FAILED, sanitizeError(e), null);
        } finally {
            tokens.remove(taskId);
            sample.stop(taskDuration);
        }
    }

    private synchronized void updateProgress(String taskId, int progress) {
        Task current = tasks.get(taskId);
        if (current == null || current.status() != TaskStatus.RUNNING || progress <= current.progress()) {
            return;
        }
        tasks.put(taskId, new Task(current.id(), current.type(), current.status(), current.ownerId(),
            current.campaignId(), current.parameters(), Math.min(progress, PROGRESS_DONE), current.createdAt(),
            current.startedAt(), null, current.estimatedDurationMinutes(), null, null));
    }

    private void finish(String taskId, TaskStatus status, @Nullable String errorMessage, @Nullable Map<String, Object> result) {
        synchronized (this) {
            Task current = tasks.get(taskId);
            if (current == null || current.status() != TaskStatus.RUNNING) {
                log.info("Discarding {} outcome for task {}: status is already {}", status.wireValue(), taskId,
                    current == null ? "evicted" : current.status().wireValue());
                return;
            }
            int progress = status == TaskStatus.COMPLETED ? PROGRESS_DONE : current.progress();
            commit(current, withStatus(current, status, progress, errorMessage, result));
        }
        if (status == TaskStatus.COMPLETED) {
            tasksCompleted.increment();
            log.info("Task {} completed", taskId);
        } else {
            tasksFailed.increment();
        }
    }

    /**
     * Validates the transition, stores the new snapshot and appends it to the log. Callers hold
     * the orchestrator lock.
     */
    private Task commit(@Nullable Task previous, Task next) {
        TaskStatus fromStatus = previous == null ? null : previous.status();
        if (fromStatus != null && !fromStatus.canTransitionTo(next.status())) {
            throw new InvalidTaskStateException(next.id(), fromStatus);
        }
        tasks.put(next.id(), next);
        try {
            transitionLog.append(new TaskTransition(sequence.incrementAndGet(), next.id(), fromStatus, next.status(),
                clock.instant(), next));
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Failed to append transition {} -> {} for task {}",
                fromStatus, next.status(), next.id());
        }
        return next;
    }

    private Task withStatus(Task current, TaskStatus status, int progress,
                            @Nullable String errorMessage, @Nullable Map<String, Object> result) {
        Instant completedAt = status.isTerminal() ? clock.instant() : null;
        return new Task(current.id(), current.type(), status, current.ownerId(), current.campaignId(),
            current.parameters(), progress, current.createdAt(), current.startedAt(), completedAt,
            current.estimatedDurationMinutes(), errorMessage, result);
    }

    private Task visibleTask(String taskId, String requestingUser) {
        Task task = taskId == null ? null : tasks.get(taskId);
        if (task == null || !task.ownerId().equals(requestingUser)) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    private String validate(String ownerId, TaskType type, @Nullable String campaignId, Map<String, Object> parameters) {
        String resolvedCampaignId = campaignId == null || campaignId.isBlank() ? null : campaignId.trim();
        if (type.requiresCampaign()) {
            if (resolvedCampaignId == null) {
                throw new TaskValidationException(type.wireValue() + " requires a campaign_id");
            }
            Campaign campaign = campaignStore.getCampaign(resolvedCampaignId)
                .filter(found -> found.ownerId().equals(ownerId))
                .orElseThrow(() -> new TaskValidationException("Campaign not found: " + resolvedCampaignId));
            if (!campaign.hasTarget()) {
                throw new TaskValidationException("Campaign " + resolvedCampaignId + " has neither a client domain nor a campaign URL");
            }
        }
        switch (type) {
            case CAMPAIGN_ANALYSIS -> {
                try {
                    AnalysisDepth.fromParameter(parameters.get(CoverageTaskHandlers.PARAM_ANALYSIS_DEPTH));
                } catch (IllegalArgumentException e) {
                    throw new TaskValidationException("Unknown analysis_depth: " + parameters.get(CoverageTaskHandlers.PARAM_ANALYSIS_DEPTH));
                }
            }
            case CONTENT_VERIFICATION -> {
                if (CoverageTaskHandlers.stringList(parameters.get(CoverageTaskHandlers.PARAM_URLS)).isEmpty()) {
                    throw new TaskValidationException("content_verification requires a non-empty urls parameter");
                }
            }
            case BATCH_UPDATE -> {
                if (CoverageTaskHandlers.stringList(parameters.get(CoverageTaskHandlers.PARAM_CAMPAIGN_IDS)).isEmpty()) {
                    throw new TaskValidationException("batch_update requires a non-empty campaign_ids parameter");
                }
            }
            case SCHEDULED_MONITORING -> {
                // campaign check above is all monitoring needs
            }
        }
        return resolvedCampaignId;
    }

    private boolean isExpired(Task task, Instant cutoff) {
        return task.status().isTerminal() && task.completedAt() != null && task.completedAt().isBefore(cutoff);
    }

    private static Map<String, Object> cleanParameters(@Nullable Map<String, Object> parameters) {
        Map<String, Object> clean = new HashMap<>();
        if (parameters != null) {
            parameters.forEach((key, value) -> {
                if (key != null && value != null) {
                    clean.put(key, value);
                }
            });
        }
        return clean;
    }

    static String sanitizeError(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            message = throwable.getClass().getSimpleName();
        }
        String flattened = message.replaceAll("\\s+", " ").trim();
        return flattened.length() > MAX_ERROR_MESSAGE_LENGTH
            ? flattened.substring(0, MAX_ERROR_MESSAGE_LENGTH)
            : flattened;
    }
}
