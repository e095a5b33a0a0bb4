package net.linkcoverage.exception;

import net.linkcoverage.domain.task.TaskStatus;

/**
 * Result requested for a task that has not completed.
 */
public class TaskNotReadyException extends TaskOperationException {
    private final TaskStatus status;

    public TaskNotReadyException(String taskId, TaskStatus status) {
        super("Task " + taskId + " has no result while " + status.wireValue(), taskId);
        this.status = status;
    }

    public TaskStatus getStatus() {
        return status;
    }
}
