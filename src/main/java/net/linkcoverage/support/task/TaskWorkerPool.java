package net.linkcoverage.support.task;

import jakarta.annotation.PreDestroy;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Bounded in-memory pool that runs background tasks in FIFO order.
 *
 * <p>At most {@code maxParallel} tasks run at once and a task id can be queued or running only
 * once, so a single task never has two workers. Submission never blocks the caller.</p>
 */
@Slf4j
@Component
public class TaskWorkerPool {

    private static final int MAX_ALLOWED_PARALLEL = 20;

    private final ExecutorService executorService;
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final Deque<QueuedTask> pending;
    private final Map<String, QueuedTask> pendingById;
    private final Set<String> runningIds;
    private final int maxParallel;

    public TaskWorkerPool(@Value("${app.tasks.max-parallel:3}") int configuredParallelism) {
        this.maxParallel = coerceParallelism(configuredParallelism);
        this.pending = new ArrayDeque<>();
        this.pendingById = new HashMap<>();
        this.runningIds = new HashSet<>();
        this.executorService = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("coverage-task-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Returns queue depth and concurrency metrics.
     */
    public synchronized PoolSnapshot snapshot() {
        return new PoolSnapshot(runningIds.size(), pendingById.size(), maxParallel);
    }

    /**
     * Queues work for the given task id.
     *
     * @return lifecycle futures; {@code started} completes when a worker picks the task up
     * @throws IllegalStateException when the id is already queued or running
     */
    public synchronized SubmittedTask submit(String taskId, Runnable work) {
        if (pendingById.containsKey(taskId) || runningIds.contains(taskId)) {
            throw new IllegalStateException("Task " + taskId + " is already queued or running");
        }
        QueuedTask queuedTask = new QueuedTask(taskId, work, new CompletableFuture<>(), new CompletableFuture<>());
        pending.addLast(queuedTask);
        pendingById.put(taskId, queuedTask);
        drain();
        return new SubmittedTask(taskId, queuedTask.started, queuedTask.completion);
    }

    /**
     * Removes a task that has not started yet.
     *
     * @return true when the task was pending and removed
     */
    public synchronized boolean cancelPending(String taskId) {
        QueuedTask queuedTask = pendingById.remove(taskId);
        if (queuedTask == null) {
            return false;
        }
        pending.removeIf(task -> task.id.equals(taskId));

        CancellationException cancellation = new CancellationException("Task cancelled before start");
        queuedTask.started.completeExceptionally(cancellation);
        queuedTask.completion.completeExceptionally(cancellation);
        return true;
    }

    public synchronized boolean isRunning(String taskId) {
        return runningIds.contains(taskId);
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdownNow();
    }

    private synchronized void drain() {
        while (runningIds.size() < maxParallel) {
            QueuedTask next = pending.pollFirst();
            if (next == null) {
                return;
            }
            pendingById.remove(next.id);
            runningIds.add(next.id);
            next.started.complete(null);
            executorService.submit(() -> executeTask(next));
        }
    }

    private void executeTask(QueuedTask task) {
        try {
            task.work.run();
            task.completion.complete(null);
        } catch (RuntimeException exception) {
            LoggingUtils.error(log, exception, "Worker for task {} terminated with an unhandled error", task.id);
            task.completion.completeExceptionally(exception);
        } finally {
            synchronized (this) {
                runningIds.remove(task.id);
                drain();
            }
        }
    }

    private static int coerceParallelism(int configuredParallelism) {
        if (configuredParallelism <= 0) {
            return 1;
        }
        return Math.min(configuredParallelism, MAX_ALLOWED_PARALLEL);
    }

    private static final class QueuedTask {
        private final String id;
        private final Runnable work;
        private final CompletableFuture<Void> started;
        private final CompletableFuture<Void> completion;

        private QueuedTask(String id, Runnable work, CompletableFuture<Void> started, CompletableFuture<Void> completion) {
            this.id = id;
            this.work = work;
            this.started = started;
            this.completion = completion;
        }
    }

    public record PoolSnapshot(int running, int pending, int maxParallel) {
    }

    public record SubmittedTask(String id,
                                CompletableFuture<Void> started,
                                CompletableFuture<Void> completion) {
    }
}
