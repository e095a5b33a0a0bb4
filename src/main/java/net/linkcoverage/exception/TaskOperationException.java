package net.linkcoverage.exception;

/**
 * Base exception for task queries and commands rejected by the orchestrator.
 * Subclasses map one-to-one to the failures callers must distinguish.
 */
public abstract class TaskOperationException extends RuntimeException {
    private final String taskId;

    protected TaskOperationException(String message, String taskId) {
        super(message);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
