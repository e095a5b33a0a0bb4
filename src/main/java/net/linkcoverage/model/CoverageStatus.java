package net.linkcoverage.model;

/**
 * Coverage classification of a canonical backlink record.
 */
public enum CoverageStatus {
    /** Direct hyperlink to the campaign URL or domain. */
    VERIFIED("verified"),
    /** Keyword evidence without a direct link. */
    POTENTIAL("potential");

    private final String wireValue;

    CoverageStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static CoverageStatus fromWireValue(String value) {
        for (CoverageStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown coverage status: " + value);
    }
}
