package net.linkcoverage.exception;

import java.time.Duration;

/**
 * Raised inside a worker once the overall task deadline has elapsed.
 * RETRYABLE: No (the task is failed)
 */
public class TaskTimeoutException extends RuntimeException {
    public TaskTimeoutException(String taskId, Duration deadline) {
        super("Task " + taskId + " exceeded its deadline of " + describe(deadline));
    }

    private static String describe(Duration deadline) {
        return deadline.toMinutes() > 0 ? deadline.toMinutes() + " minute(s)" : deadline.toMillis() + " ms";
    }
}
