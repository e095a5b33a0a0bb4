package net.linkcoverage.model;

import java.util.Locale;

public enum RiskSeverity {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int rank;

    RiskSeverity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
