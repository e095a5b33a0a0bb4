/**
 * Live client for the Ahrefs site explorer backlink endpoint.
 * Authenticates with a bearer key and retries transient failures with exponential backoff.
 */
package net.linkcoverage.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
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
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

@Service
@Slf4j
public class AhrefsClient implements BacklinkProviderClient {

    static final String SELECT_FIELDS =
        "url_from,url_to,anchor,title,first_seen,domain_rating_source,url_rating_source,is_dofollow,is_content,is_redirect,is_canonical";

    private final WebClient webClient;
    private final RetrySettings retrySettings;
    private final String baseUrl;
    private final String apiKey;

    public AhrefsClient(WebClient.Builder webClientBuilder,
                        RetrySettings retrySettings,
                        @Value("${app.providers.ahrefs.base-url:https://api.ahrefs.com/v3}") String baseUrl,
                        @Value("${app.providers.ahrefs.api-key:}") String apiKey) {
        this.webClient = webClientBuilder.build();
        this.retrySettings = retrySettings;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public ProviderName provider() {
        return ProviderName.AHREFS;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<JsonNode> fetchBacklinks(ProviderQuery query) {
        if (!isConfigured()) {
            return Mono.error(ProviderCallException.authError(ProviderName.AHREFS, "Ahrefs API key not configured"));
        }
        String url = UriComponentsBuilder.fromUriString(baseUrl)
            .pathSegment("site-explorer", "all-backlinks")
            .queryParam("target", query.domain())
            .queryParam("mode", "domain")
            .queryParam("limit", query.limit())
            .queryParam("select", SELECT_FIELDS)
            .build()
            .toUriString();

        ExternalApiLogger.logApiCallAttempt(log, "Ahrefs", "ALL_BACKLINKS", query.domain());
        return webClient.get()
            .uri(url)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .onStatus(status -> status.value() == 401 || status.value() == 402 || status.value() == 403,
                response -> Mono.just(ProviderCallException.authError(ProviderName.AHREFS,
                    "Ahrefs rejected credentials or subscription (HTTP " + response.statusCode().value() + ")")))
            .onStatus(status -> status.value() == 429,
                response -> Mono.just(ProviderCallException.rateLimited(ProviderName.AHREFS,
                    "Ahrefs rate limit reached (HTTP 429)")))
            .bodyToMono(JsonNode.class)
            .timeout(retrySettings.callTimeout())
            .flatMap(this::rejectErrorPayload)
            .retryWhen(ProviderRetrySupport.transientRetry(retrySettings, ProviderName.AHREFS, log))
            .doOnNext(body -> ExternalApiLogger.logApiCallSuccess(log, "Ahrefs", "ALL_BACKLINKS",
                query.domain(), countRows(body)))
            .onErrorMap(e -> !(e instanceof ProviderCallException), e -> {
                LoggingUtils.warn(log, e, "Ahrefs call failed for domain {}", query.domain());
                String reason = e instanceof WebClientResponseException wcre
                    ? "Ahrefs request failed with HTTP " + wcre.getStatusCode().value()
                    : "Ahrefs request failed: " + LoggingUtils.summarize(e);
                return new ProviderCallException(ProviderName.AHREFS,
                    ProviderStatus.ERROR, reason, false, e);
            });
    }

    @Override
    public int countRows(JsonNode payload) {
        return payload == null ? 0 : payload.path("backlinks").size();
    }

    /**
     * Ahrefs reports plan and scope problems as an {@code error} field in the body.
     */
    private Mono<JsonNode> rejectErrorPayload(JsonNode body) {
        JsonNode error = body.get("error");
        if (error != null && !error.isNull()) {
            String code = error.isTextual() ? error.asText() : error.path("code").asText("unknown");
            return Mono.error(ProviderCallException.authError(ProviderName.AHREFS,
                "Ahrefs returned an error payload: " + code));
        }
        return Mono.just(body);
    }
}
