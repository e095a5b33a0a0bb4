package net.linkcoverage.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import net.linkcoverage.model.ProviderName;
import net.linkcoverage.model.ProviderQuery;
import reactor.core.publisher.Mono;

/**
 * Live access to one external backlink provider.
 *
 * <p>Implementations signal failures as {@link net.linkcoverage.exception.ProviderCallException}
 * with the matching status; they do not fall back to mock data themselves.</p>
 */
public interface BacklinkProviderClient {

    ProviderName provider();

    /** Whether credentials for live calls are present. */
    boolean isConfigured();

    /**
     * Fetches backlinks for the query domain in the provider's native JSON shape.
     */
    Mono<JsonNode> fetchBacklinks(ProviderQuery query);

    /** Number of backlink rows in a native payload, for logging. */
    int countRows(JsonNode payload);
}
