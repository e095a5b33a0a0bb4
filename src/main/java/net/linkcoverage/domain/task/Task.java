package net.linkcoverage.domain.task;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of a task as last committed by the orchestrator.
 *
 * @param ownerId identity of the user who created the task
 * @param progress 0..100, frozen once the task is terminal
 * @param result present only when {@code status == COMPLETED}; read-only, values may be null.
 *               After replay from a JSON-lines transition log, numeric values come back as
 *               their JSON type, so counts stored as {@code long} may read back as {@code Integer}
 */
public record Task(
    String id,
    TaskType type,
    TaskStatus status,
    String ownerId,
    @Nullable String campaignId,
    Map<String, Object> parameters,
    int progress,
    Instant createdAt,
    @Nullable Instant startedAt,
    @Nullable Instant completedAt,
    @Nullable Integer estimatedDurationMinutes,
    @Nullable String errorMessage,
    @Nullable Map<String, Object> result
) {

    public Task {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }
}
