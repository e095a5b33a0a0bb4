package net.linkcoverage.model;

/**
 * Provider-agnostic backlink lookup.
 *
 * @param domain normalized target domain, used for the lookup and for mock seeding
 * @param targetUrl campaign URL the mock data should point at, may be null
 * @param limit maximum number of rows requested from the provider
 */
public record ProviderQuery(String domain, String targetUrl, int limit) {

    public ProviderQuery {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("Provider query requires a domain");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("Provider query limit must be positive but was " + limit);
        }
    }
}
