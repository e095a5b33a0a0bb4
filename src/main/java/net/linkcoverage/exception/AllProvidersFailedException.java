package net.linkcoverage.exception;

/**
 * No provider produced usable data for an analysis, so the task cannot complete.
 */
public class AllProvidersFailedException extends RuntimeException {
    public AllProvidersFailedException(String message) {
        super(message);
    }
}
