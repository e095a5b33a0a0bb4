package net.linkcoverage.model;

import java.time.Instant;
import java.util.List;

/**
 * Single toxicity finding raised by risk assessment.
 */
public record RiskAlert(
    String riskType,
    RiskSeverity severity,
    String description,
    List<String> affectedUrls,
    String recommendation,
    Instant detectedAt
) {

    public RiskAlert {
        affectedUrls = affectedUrls == null ? List.of() : List.copyOf(affectedUrls);
    }
}
