package net.linkcoverage.domain.task;

import java.util.Locale;

/**
 * Task lifecycle states. Transitions only move forward:
 * {@code PENDING -> RUNNING -> COMPLETED|FAILED|CANCELLED}, and {@code PENDING -> CANCELLED}.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Whether the lifecycle allows moving from this state to {@code target}.
     * A pending task may also fail directly, which covers restart recovery and deadline expiry
     * before a worker picked it up.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED || target == FAILED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskStatus fromWireValue(String value) {
        return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
