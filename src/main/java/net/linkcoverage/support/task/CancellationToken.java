package net.linkcoverage.support.task;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import net.linkcoverage.exception.TaskCancelledException;
import net.linkcoverage.exception.TaskTimeoutException;

/**
 * Cooperative stop signal for one task execution, combining an explicit cancel flag with the
 * task's overall deadline. Workers call {@link #checkpoint()} at phase boundaries.
 */
public final class CancellationToken {

    private final String taskId;
    private final Duration timeout;
    private final Instant deadline;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public CancellationToken(String taskId, Duration timeout, Clock clock) {
        this.taskId = taskId;
        this.timeout = timeout;
        this.clock = clock;
        this.deadline = clock.instant().plus(timeout);
    }

    public String taskId() {
        return taskId;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    /** Time left before the deadline, never negative. */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * @throws TaskCancelledException when cancellation was requested
     * @throws TaskTimeoutException when the deadline has passed
     */
    public void checkpoint() {
        if (cancelled.get()) {
            throw new TaskCancelledException(taskId);
        }
        if (isExpired()) {
            throw timeoutError();
        }
    }

    public TaskTimeoutException timeoutError() {
        return new TaskTimeoutException(taskId, timeout);
    }
}
