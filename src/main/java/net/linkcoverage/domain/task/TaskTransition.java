package net.linkcoverage.domain.task;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * One committed lifecycle transition, appended to the transition log.
 *
 * @param sequence monotonically increasing across the whole log
 * @param fromStatus null for the creation entry
 * @param snapshot task state immediately after the transition
 */
public record TaskTransition(
    long sequence,
    String taskId,
    @Nullable TaskStatus fromStatus,
    TaskStatus toStatus,
    Instant occurredAt,
    Task snapshot
) {
}
