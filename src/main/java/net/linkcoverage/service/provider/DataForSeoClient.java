/**
 * Live client for the DataForSEO backlinks endpoint.
 * Uses HTTP basic auth; access problems are reported inside a 200 body as task status codes.
 */
package net.linkcoverage.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.exception.ProviderCallException;
import net.linkcoverage.model.ProviderName;
import net.linkcoverage.model.ProviderQuery;
import net.linkcoverage.model.ProviderStatus;
import net.linkcoverage.support.retry.ProviderRetrySupport;
import net.linkcoverage.support.retry.ProviderRetrySupport.RetrySettings;
import net.linkcoverage.util.ExternalApiLogger;
import net.linkcoverage.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

@Service
@Slf4j
public class DataForSeoClient implements BacklinkProviderClient {

    /** Task status codes at or above this value mean the account cannot use the endpoint. */
    static final int ACCESS_ERROR_STATUS_CODE = 40000;

    private final WebClient webClient;
    private final RetrySettings retrySettings;
    private final String baseUrl;
    private final String username;
    private final String password;

    public DataForSeoClient(WebClient.Builder webClientBuilder,
                            RetrySettings retrySettings,
                            @Value("${app.providers.dataforseo.base-url:https://api.dataforseo.com/v3}") String baseUrl,
                            @Value("${app.providers.dataforseo.username:}") String username,
                            @Value("${app.providers.dataforseo.password:}") String password) {
        this.webClient = webClientBuilder.build();
        this.retrySettings = retrySettings;
        this.baseUrl = baseUrl;
        this.username = username;
        this.password = password;
    }

    @Override
    public ProviderName provider() {
        return ProviderName.DATAFORSEO;
    }

    @Override
    public boolean isConfigured() {
        return username != null && !username.isBlank() && password != null && !password.isBlank();
    }

    @Override
    public Mono<JsonNode> fetchBacklinks(ProviderQuery query) {
        if (!isConfigured()) {
            return Mono.error(ProviderCallException.authError(ProviderName.DATAFORSEO,
                "DataForSEO credentials not configured"));
        }
        String url = UriComponentsBuilder.fromUriString(baseUrl)
            .pathSegment("backlinks", "backlinks", "live")
            .build()
            .toUriString();
        List<Map<String, Object>> body = List.of(Map.of(
            "target", query.domain(),
            "mode", "as_is",
            "limit", query.limit()
        ));

        ExternalApiLogger.logApiCallAttempt(log, "DataForSEO", "BACKLINKS_LIVE", query.domain());
        return webClient.post()
            .uri(url)
            .headers(headers -> headers.setBasicAuth(username, password))
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .onStatus(status -> status.value() == 401 || status.value() == 402 || status.value() == 403,
                response -> Mono.just(ProviderCallException.authError(ProviderName.DATAFORSEO,
                    "DataForSEO rejected credentials or subscription (HTTP " + response.statusCode().value() + ")")))
            .onStatus(status -> status.value() == 429,
                response -> Mono.just(ProviderCallException.rateLimited(ProviderName.DATAFORSEO,
                    "DataForSEO rate limit reached (HTTP 429)")))
            .bodyToMono(JsonNode.class)
            .timeout(retrySettings.callTimeout())
            .flatMap(this::rejectAccessErrors)
            .retryWhen(ProviderRetrySupport.transientRetry(retrySettings, ProviderName.DATAFORSEO, log))
            .doOnNext(payload -> ExternalApiLogger.logApiCallSuccess(log, "DataForSEO", "BACKLINKS_LIVE",
                query.domain(), countRows(payload)))
            .onErrorMap(e -> !(e instanceof ProviderCallException), e -> {
                LoggingUtils.warn(log, e, "DataForSEO call failed for domain {}", query.domain());
                String reason = e instanceof WebClientResponseException wcre
                    ? "DataForSEO request failed with HTTP " + wcre.getStatusCode().value()
                    : "DataForSEO request failed: " + LoggingUtils.summarize(e);
                return new ProviderCallException(ProviderName.DATAFORSEO, ProviderStatus.ERROR, reason, false, e);
            });
    }

    @Override
    public int countRows(JsonNode payload) {
        if (payload == null) {
            return 0;
        }
        int rows = 0;
        for (JsonNode task : payload.path("tasks")) {
            for (JsonNode result : task.path("result")) {
                rows += result.path("items").size();
            }
        }
        return rows;
    }

    private Mono<JsonNode> rejectAccessErrors(JsonNode payload) {
        int topLevel = payload.path("status_code").asInt(20000);
        if (topLevel >= ACCESS_ERROR_STATUS_CODE) {
            return Mono.error(ProviderCallException.authError(ProviderName.DATAFORSEO,
                "DataForSEO access error (status " + topLevel + ")"));
        }
        for (JsonNode task : payload.path("tasks")) {
            int taskStatus = task.path("status_code").asInt(20000);
            if (taskStatus >= ACCESS_ERROR_STATUS_CODE) {
                return Mono.error(ProviderCallException.authError(ProviderName.DATAFORSEO,
                    "DataForSEO task access error (status " + taskStatus + ")"));
            }
        }
        return Mono.just(payload);
    }
}
