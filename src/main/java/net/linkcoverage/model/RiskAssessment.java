package net.linkcoverage.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Severity-ordered alerts for one aggregated record set.
 */
public record RiskAssessment(List<RiskAlert> alerts, int recordsScanned) {

    public RiskAssessment {
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
    }

    public static RiskAssessment empty() {
        return new RiskAssessment(List.of(), 0);
    }

    public long count(RiskSeverity severity) {
        return alerts.stream().filter(alert -> alert.severity() == severity).count();
    }

    /** Alert counts keyed by lowercase severity, in high/medium/low order. */
    public Map<String, Long> severityCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (RiskSeverity severity : RiskSeverity.values()) {
            counts.put(severity.wireValue(), count(severity));
        }
        return counts;
    }
}
