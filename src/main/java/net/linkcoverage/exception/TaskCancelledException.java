package net.linkcoverage.exception;

/**
 * Unwinds a worker that observed a cancellation request at a checkpoint.
 */
public class TaskCancelledException extends RuntimeException {
    public TaskCancelledException(String taskId) {
        super("Task " + taskId + " was cancelled");
    }
}
