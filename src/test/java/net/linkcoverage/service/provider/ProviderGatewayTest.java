package net.linkcoverage.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import net.linkcoverage.config.AppRateLimiterConfig;
import net.linkcoverage.exception.ProviderCallException;
import net.linkcoverage.model.ProviderName;
import net.linkcoverage.model.ProviderQuery;
import net.linkcoverage.model.ProviderQueryResult;
import net.linkcoverage.model.ProviderStatus;
import net.linkcoverage.support.runtime.RuntimeConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ProviderGatewayTest {

    private static final ProviderQuery QUERY = new ProviderQuery("example.com", "https://example.com/launch", 100);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockBacklinkDataService mockDataService;
    private ProviderCallMonitor callMonitor;

    @BeforeEach
    void setUp() {
        mockDataService = new MockBacklinkDataService(objectMapper);
        callMonitor = new ProviderCallMonitor();
    }

    @Test
    void should_ReturnIdenticalMockPayloads_When_MockModeEnabled() {
        ProviderGateway gateway = gateway(new RuntimeConfig(true), List.of(), Map.of());

        ProviderQueryResult first = gateway.fetch(ProviderName.AHREFS, QUERY);
        ProviderQueryResult second = gateway.fetch(ProviderName.AHREFS, QUERY);

        assertThat(first.status()).isEqualTo(ProviderStatus.OK);
        assertThat(first.mockData()).isTrue();
        assertEquals(first.payload(), second.payload());
        assertThat(callMonitor.getStats(ProviderName.AHREFS).mockServed()).isEqualTo(2);
    }

    @Test
    void should_FallBackToMockAndRecordError_When_CredentialsMissing() {
        RuntimeConfig runtimeConfig = new RuntimeConfig(false);
        StubClient unconfigured = new StubClient(ProviderName.AHREFS, false, Mono.never());
        ProviderGateway gateway = gateway(runtimeConfig, List.of(unconfigured), Map.of());

        ProviderQueryResult result = gateway.fetch(ProviderName.AHREFS, QUERY);

        assertThat(result.status()).isEqualTo(ProviderStatus.AUTH_ERROR);
        assertThat(result.mockData()).isTrue();
        assertThat(result.hasPayload()).isTrue();
        assertThat(unconfigured.calls.get()).isZero();
        assertThat(runtimeConfig.snapshot().providerErrors())
            .containsEntry("ahrefs", "Ahrefs credentials not configured");
    }

    @Test
    void should_FallBackToMock_When_ClientNotRegistered() {
        RuntimeConfig runtimeConfig = new RuntimeConfig(false);
        ProviderGateway gateway = gateway(runtimeConfig, List.of(), Map.of());

        StepVerifier.create(gateway.fetchAsync(ProviderName.DATAFORSEO, QUERY))
            .assertNext(result -> {
                assertThat(result.status()).isEqualTo(ProviderStatus.AUTH_ERROR);
                assertThat(result.mockData()).isTrue();
            })
            .verifyComplete();
        assertThat(runtimeConfig.snapshot().providerErrors()).containsKey("dataforseo");
    }

    @Test
    void should_ReturnLivePayload_When_ClientSucceeds() {
        JsonNode payload = objectMapper.createObjectNode().set("backlinks",
            objectMapper.createArrayNode().add(objectMapper.createObjectNode().put("url_from", "https://a.site")));
        ProviderGateway gateway = gateway(new RuntimeConfig(false),
            List.of(new StubClient(ProviderName.AHREFS, true, Mono.just(payload))), Map.of());

        ProviderQueryResult result = gateway.fetch(ProviderName.AHREFS, QUERY);

        assertThat(result.status()).isEqualTo(ProviderStatus.OK);
        assertThat(result.mockData()).isFalse();
        assertThat(result.payload()).isSameAs(payload);
        assertThat(callMonitor.getStats(ProviderName.AHREFS).liveSuccesses()).isEqualTo(1);
    }

    @Test
    void should_TagEmpty_When_LivePayloadHasNoRows() {
        JsonNode payload = objectMapper.createObjectNode().set("backlinks", objectMapper.createArrayNode());
        ProviderGateway gateway = gateway(new RuntimeConfig(false),
            List.of(new StubClient(ProviderName.AHREFS, true, Mono.just(payload))), Map.of());

        ProviderQueryResult result = gateway.fetch(ProviderName.AHREFS, QUERY);

        assertThat(result.status()).isEqualTo(ProviderStatus.EMPTY);
        assertThat(result.hasPayload()).isTrue();
    }

    @Test
    void should_ReturnRateLimitedWithoutMock_When_ProviderReturns429() {
        RuntimeConfig runtimeConfig = new RuntimeConfig(false);
        StubClient client = new StubClient(ProviderName.AHREFS, true,
            Mono.error(ProviderCallException.rateLimited(ProviderName.AHREFS, "Ahrefs rate limit reached (HTTP 429)")));
        ProviderGateway gateway = gateway(runtimeConfig, List.of(client), Map.of());

        ProviderQueryResult result = gateway.fetch(ProviderName.AHREFS, QUERY);

        assertThat(result.status()).isEqualTo(ProviderStatus.RATE_LIMITED);
        assertThat(result.hasPayload()).isFalse();
        assertThat(runtimeConfig.snapshot().providerErrors()).containsKey("ahrefs");
    }

    @Test
    void should_ReturnRateLimitedWithoutCallingClient_When_BudgetExhausted() {
        StubClient client = new StubClient(ProviderName.DATAFORSEO, true,
            Mono.just(objectMapper.createObjectNode()));
        RateLimiter limiter = AppRateLimiterConfig.perMinute("testDataForSeo", 1);
        ProviderGateway gateway = gateway(new RuntimeConfig(false), List.of(client),
            Map.of(ProviderName.DATAFORSEO, limiter));

        ProviderQueryResult first = gateway.fetch(ProviderName.DATAFORSEO, QUERY);
        ProviderQueryResult second = gateway.fetch(ProviderName.DATAFORSEO, QUERY);

        assertThat(first.status()).isEqualTo(ProviderStatus.EMPTY);
        assertThat(second.status()).isEqualTo(ProviderStatus.RATE_LIMITED);
        assertThat(client.calls.get()).isEqualTo(1);
        assertThat(callMonitor.getStats(ProviderName.DATAFORSEO).rateLimited()).isEqualTo(1);
    }

    @Test
    void should_FallBackWithErrorStatus_When_ClientFailsUnexpectedly() {
        RuntimeConfig runtimeConfig = new RuntimeConfig(false);
        StubClient client = new StubClient(ProviderName.DATAFORSEO, true,
            Mono.error(new IllegalStateException("connection reset")));
        ProviderGateway gateway = gateway(runtimeConfig, List.of(client), Map.of());

        ProviderQueryResult result = gateway.fetch(ProviderName.DATAFORSEO, QUERY);

        assertThat(result.status()).isEqualTo(ProviderStatus.ERROR);
        assertThat(result.mockData()).isTrue();
        assertThat(result.errorMessage()).contains("connection reset");
        assertThat(callMonitor.getStats(ProviderName.DATAFORSEO).mockFallbacks()).isEqualTo(1);
    }

    @Test
    void should_ListBothProviders_When_AskedForConfiguredProviders() {
        ProviderGateway gateway = gateway(new RuntimeConfig(true), List.of(), Map.of());

        assertThat(gateway.configuredProviders()).containsExactly(ProviderName.AHREFS, ProviderName.DATAFORSEO);
    }

    private ProviderGateway gateway(RuntimeConfig runtimeConfig,
                                    List<BacklinkProviderClient> clients,
                                    Map<ProviderName, RateLimiter> rateLimiters) {
        return new ProviderGateway(runtimeConfig, clients, rateLimiters, mockDataService, callMonitor);
    }

    private static final class StubClient implements BacklinkProviderClient {
        private final ProviderName provider;
        private final boolean configured;
        private final Mono<JsonNode> response;
        private final AtomicInteger calls = new AtomicInteger();

        private StubClient(ProviderName provider, boolean configured, Mono<JsonNode> response) {
            this.provider = provider;
            this.configured = configured;
            this.response = response;
        }

        @Override
        public ProviderName provider() {
            return provider;
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public Mono<JsonNode> fetchBacklinks(ProviderQuery query) {
            calls.incrementAndGet();
            return response;
        }

        @Override
        public int countRows(JsonNode payload) {
            return payload.path("backlinks").size();
        }
    }
}
