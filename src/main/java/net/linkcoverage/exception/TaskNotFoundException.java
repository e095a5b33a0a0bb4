package net.linkcoverage.exception;

/**
 * Task does not exist or is not visible to the requesting user.
 * Both cases share one exception so task ids are not probeable across users.
 */
public class TaskNotFoundException extends TaskOperationException {
    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId, taskId);
    }
}
