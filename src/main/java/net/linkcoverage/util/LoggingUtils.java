package net.linkcoverage.util;

import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Helpers for logging failures with their cause attached, and for turning a throwable into a
 * short description that is safe to store or show to users.
 */
public final class LoggingUtils {

    private static final int MAX_SUMMARY_LENGTH = 200;

    private LoggingUtils() {
    }

    public static void error(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, Level.ERROR, throwable, message, args);
    }

    public static void warn(Logger logger, Throwable throwable, String message, Object... args) {
        log(logger, Level.WARN, throwable, message, args);
    }

    /**
     * One-line description of the innermost cause, e.g. {@code "ConnectException: Connection refused"}.
     * Never includes stack traces or response bodies.
     */
    public static String summarize(Throwable throwable) {
        if (throwable == null) {
            return "Unknown error";
        }
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        String summary = message == null || message.isBlank()
            ? root.getClass().getSimpleName()
            : root.getClass().getSimpleName() + ": " + message.replaceAll("\\s+", " ").trim();
        return summary.length() > MAX_SUMMARY_LENGTH ? summary.substring(0, MAX_SUMMARY_LENGTH) : summary;
    }

    private static void log(Logger logger, Level level, Throwable throwable, String message, Object... args) {
        if (logger == null || message == null) {
            return;
        }
        var builder = logger.atLevel(level);
        if (throwable != null) {
            builder = builder.setCause(throwable);
        }
        if (args == null || args.length == 0) {
            builder.log(message);
        } else {
            builder.log(message, args);
        }
    }
}
