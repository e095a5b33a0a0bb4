package net.linkcoverage.domain.task;

import java.util.Locale;
import net.linkcoverage.exception.TaskValidationException;

/**
 * Closed set of background task kinds. Each value is dispatched to exactly one handler.
 */
public enum TaskType {

    CAMPAIGN_ANALYSIS("campaign_analysis", 10),
    CONTENT_VERIFICATION("content_verification", 15),
    SCHEDULED_MONITORING("scheduled_monitoring", 5),
    BATCH_UPDATE("batch_update", 30);

    private final String wireValue;
    private final int estimatedDurationMinutes;

    TaskType(String wireValue, int estimatedDurationMinutes) {
        this.wireValue = wireValue;
        this.estimatedDurationMinutes = estimatedDurationMinutes;
    }

    public String wireValue() {
        return wireValue;
    }

    public int estimatedDurationMinutes() {
        return estimatedDurationMinutes;
    }

    /** Every type except batch updates operates on a single campaign. */
    public boolean requiresCampaign() {
        return this != BATCH_UPDATE;
    }

    /**
     * Resolves a wire value such as {@code campaign_analysis}.
     *
     * @throws TaskValidationException for unknown or blank values
     */
    public static TaskType fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            throw new TaskValidationException("Task type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TaskType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        throw new TaskValidationException("Unknown task type: " + value);
    }
}
