package net.linkcoverage.exception;

/**
 * Task request rejected synchronously at creation; nothing is enqueued.
 */
public class TaskValidationException extends RuntimeException {
    public TaskValidationException(String message) {
        super(message);
    }
}
