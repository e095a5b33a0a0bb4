package net.linkcoverage.exception;

import net.linkcoverage.domain.task.TaskStatus;

/**
 * Command rejected because the task already reached a terminal state.
 */
public class InvalidTaskStateException extends TaskOperationException {
    private final TaskStatus status;

    public InvalidTaskStateException(String taskId, TaskStatus status) {
        super("Task " + taskId + " is already " + status.wireValue(), taskId);
        this.status = status;
    }

    public TaskStatus getStatus() {
        return status;
    }
}
