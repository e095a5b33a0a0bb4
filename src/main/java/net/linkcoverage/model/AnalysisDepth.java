package net.linkcoverage.model;

import java.util.Locale;

/**
 * Controls how many rows each provider is asked for during a campaign analysis.
 */
public enum AnalysisDepth {
    QUICK(100),
    STANDARD(500),
    DEEP(1000);

    private final int providerLimit;

    AnalysisDepth(int providerLimit) {
        this.providerLimit = providerLimit;
    }

    public int providerLimit() {
        return providerLimit;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a depth parameter, defaulting to {@link #STANDARD} when absent.
     *
     * @throws IllegalArgumentException for unrecognized values
     */
    public static AnalysisDepth fromParameter(Object value) {
        if (value == null) {
            return STANDARD;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return STANDARD;
        }
        return AnalysisDepth.valueOf(text.toUpperCase(Locale.ROOT));
    }
}
