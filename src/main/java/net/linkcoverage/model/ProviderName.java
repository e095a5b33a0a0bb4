package net.linkcoverage.model;

import java.util.Locale;

/**
 * External backlink data sources queried by the provider gateway.
 */
public enum ProviderName {

    AHREFS("ahrefs", "Ahrefs"),
    DATAFORSEO("dataforseo", "DataForSEO");

    private final String key;
    private final String displayName;

    ProviderName(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /** Lowercase identifier used in provenance tags and the provider error map. */
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a provider from its key, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException when the value names no known provider
     */
    public static ProviderName fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Provider key must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ProviderName provider : values()) {
            if (provider.key.equals(normalized)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + value);
    }
}
