package net.linkcoverage.model;

public enum MonitoringStatus {
    ACTIVE,
    PAUSED,
    COMPLETED;

    public static MonitoringStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ACTIVE;
        }
        return MonitoringStatus.valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
