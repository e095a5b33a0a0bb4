package net.linkcoverage.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.exception.ProviderCallException;
import net.linkcoverage.model.ProviderName;
import net.linkcoverage.model.ProviderQuery;
import net.linkcoverage.model.ProviderQueryResult;
import net.linkcoverage.model.ProviderStatus;
import net.linkcoverage.support.runtime.RuntimeConfig;
import net.linkcoverage.util.ExternalApiLogger;
import net.linkcoverage.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Uniform entry point for backlink providers.
 *
 * <p>Each call reads the mock flag once, at subscription time, and uses that value for the whole
 * call. In live mode the call first takes a token from the provider's budget; an empty budget
 * returns {@code rate_limited} immediately. Live failures are recorded in {@link RuntimeConfig}
 * and, except for rate limiting, resolved with deterministic mock data for that provider only.</p>
 */
@Slf4j
@Service
public class ProviderGateway {

    private final RuntimeConfig runtimeConfig;
    private final Map<ProviderName, BacklinkProviderClient> clients;
    private final Map<ProviderName, RateLimiter> rateLimiters;
    private final MockBacklinkDataService mockDataService;
    private final ProviderCallMonitor callMonitor;

    @Autowired
    public ProviderGateway(RuntimeConfig runtimeConfig,
                           List<BacklinkProviderClient> clients,
                           @Qualifier("ahrefsRateLimiter") RateLimiter ahrefsRateLimiter,
                           @Qualifier("dataForSeoRateLimiter") RateLimiter dataForSeoRateLimiter,
                           MockBacklinkDataService mockDataService,
                           ProviderCallMonitor callMonitor) {
        this(runtimeConfig, clients,
            Map.of(ProviderName.AHREFS, ahrefsRateLimiter, ProviderName.DATAFORSEO, dataForSeoRateLimiter),
            mockDataService, callMonitor);
    }

    ProviderGateway(RuntimeConfig runtimeConfig,
                    List<BacklinkProviderClient> clients,
                    Map<ProviderName, RateLimiter> rateLimiters,
                    MockBacklinkDataService mockDataService,
                    ProviderCallMonitor callMonitor) {
        this.runtimeConfig = runtimeConfig;
        this.clients = new EnumMap<>(ProviderName.class);
        for (BacklinkProviderClient client : clients) {
            this.clients.put(client.provider(), client);
        }
        this.rateLimiters = new EnumMap<>(rateLimiters);
        this.mockDataService = mockDataService;
        this.callMonitor = callMonitor;
    }

    /** Providers queried for every analysis, in a stable order. */
    public List<ProviderName> configuredProviders() {
        return List.of(ProviderName.values());
    }

    /**
     * Blocking variant for worker threads.
     */
    public ProviderQueryResult fetch(ProviderName provider, ProviderQuery query) {
        return fetchAsync(provider, query).block();
    }

    /**
     * Fetches backlinks for one provider. The returned Mono never errors; every outcome is encoded
     * in the result status.
     */
    public Mono<ProviderQueryResult> fetchAsync(ProviderName provider, ProviderQuery query) {
        return Mono.defer(() -> {
            if (runtimeConfig.isMockMode()) {
                return Mono.fromCallable(() -> serveMock(provider, query));
            }

            BacklinkProviderClient client = clients.get(provider);
            if (client == null || !client.isConfigured()) {
                String reason = client == null
                    ? provider.displayName() + " live client not registered"
                    : provider.displayName() + " credentials not configured";
                return Mono.fromCallable(() -> handleFailure(provider, query,
                    ProviderCallException.authError(provider, reason)));
            }

            RateLimiter rateLimiter = rateLimiters.get(provider);
            if (rateLimiter != null && !rateLimiter.acquirePermission()) {
                callMonitor.recordRateLimited(provider);
                ExternalApiLogger.logRateLimited(log, provider.displayName(), query.domain());
                return Mono.just(ProviderQueryResult.rateLimited(provider));
            }

            return client.fetchBacklinks(query)
                .map(payload -> {
                    callMonitor.recordLiveSuccess(provider);
                    ProviderStatus status = client.countRows(payload) == 0 ? ProviderStatus.EMPTY : ProviderStatus.OK;
                    return ProviderQueryResult.live(provider, status, payload);
                })
                .switchIfEmpty(Mono.fromCallable(() -> handleFailure(provider, query,
                    new ProviderCallException(provider, ProviderStatus.ERROR,
                        provider.displayName() + " returned no body", false, null))))
                .onErrorResume(ProviderCallException.class,
                    ex -> Mono.fromCallable(() -> handleFailure(provider, query, ex)))
                .onErrorResume(ex -> !(ex instanceof ProviderCallException),
                    ex -> Mono.fromCallable(() -> handleFailure(provider, query,
                        ProviderCallException.transientFailure(provider, LoggingUtils.summarize(ex), ex))));
        });
    }

    private ProviderQueryResult serveMock(ProviderName provider, ProviderQuery query) {
        JsonNode payload = mockDataService.mockPayload(provider, query);
        callMonitor.recordMockServed(provider);
        ExternalApiLogger.logMockServed(log, provider.displayName(), query.domain(), countRows(provider, payload));
        return ProviderQueryResult.mock(provider, payload);
    }

    private ProviderQueryResult handleFailure(ProviderName provider, ProviderQuery query, ProviderCallException failure) {
        String message = failure.getMessage() == null ? failure.getStatus().wireValue() : failure.getMessage();
        callMonitor.recordLiveFailure(provider, message);
        runtimeConfig.recordProviderError(provider, message);
        ExternalApiLogger.logApiCallFailure(log, provider.displayName(), "FETCH_BACKLINKS", query.domain(), message);

        if (failure.getStatus() == ProviderStatus.RATE_LIMITED) {
            return ProviderQueryResult.rateLimited(provider);
        }

        JsonNode payload = mockDataService.mockPayload(provider, query);
        callMonitor.recordMockFallback(provider);
        ExternalApiLogger.logMockFallback(log, provider.displayName(), query.domain(), failure.getStatus().wireValue());
        return ProviderQueryResult.mockFallback(provider, failure.getStatus(), payload, message);
    }

    private int countRows(ProviderName provider, JsonNode payload) {
        BacklinkProviderClient client = clients.get(provider);
        return client == null ? 0 : client.countRows(payload);
    }
}
