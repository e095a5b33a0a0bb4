package net.linkcoverage.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.Nullable;

/**
 * Raw provider response plus its status tag. Never persisted; consumed by a single aggregation.
 *
 * @param payload provider-native JSON, present for OK and EMPTY results and for any result the
 *                gateway resolved with mock data
 * @param mockData true when the payload was produced by the mock data service
 * @param errorMessage short, credential-free failure description
 */
public record ProviderQueryResult(
    ProviderName provider,
    ProviderStatus status,
    @Nullable JsonNode payload,
    boolean mockData,
    @Nullable String errorMessage
) {

    public static ProviderQueryResult live(ProviderName provider, ProviderStatus status, JsonNode payload) {
        return new ProviderQueryResult(provider, status, payload, false, null);
    }

    public static ProviderQueryResult mock(ProviderName provider, JsonNode payload) {
        return new ProviderQueryResult(provider, ProviderStatus.OK, payload, true, null);
    }

    public static ProviderQueryResult mockFallback(ProviderName provider,
                                                   ProviderStatus status,
                                                   JsonNode payload,
                                                   String errorMessage) {
        return new ProviderQueryResult(provider, status, payload, true, errorMessage);
    }

    public static ProviderQueryResult rateLimited(ProviderName provider) {
        return new ProviderQueryResult(provider, ProviderStatus.RATE_LIMITED, null, false,
            "Rate limit budget exhausted");
    }

    /** Whether this result carries data the aggregation engine can consume. */
    public boolean hasPayload() {
        return payload != null;
    }
}
