package net.linkcoverage.support.retry;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import net.linkcoverage.exception.ProviderCallException;
import net.linkcoverage.model.ProviderName;
import net.linkcoverage.util.LoggingUtils;
import org.slf4j.Logger;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

/**
 * Reactor retry policy shared by live provider clients: exponential backoff on transient
 * failures only, bounded attempts, and a typed exception once retries are exhausted.
 */
public final class ProviderRetrySupport {

    /**
     * Retry parameters that are constant per deployment.
     *
     * @param maxAttempts total attempts including the first call
     */
    public record RetrySettings(int maxAttempts, Duration initialBackoff, Duration callTimeout) {

        public RetrySettings {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
            }
            initialBackoff = initialBackoff == null ? Duration.ofMillis(200) : initialBackoff;
            callTimeout = callTimeout == null ? Duration.ofSeconds(20) : callTimeout;
        }

        public static RetrySettings defaults() {
            return new RetrySettings(3, Duration.ofMillis(200), Duration.ofSeconds(20));
        }
    }

    private ProviderRetrySupport() {
    }

    /**
     * Builds the retry spec for one call site. 4xx responses, including 429, are never retried.
     */
    public static RetryBackoffSpec transientRetry(RetrySettings settings, ProviderName provider, Logger log) {
        return Retry.backoff(settings.maxAttempts() - 1L, settings.initialBackoff())
            .filter(ProviderRetrySupport::isTransient)
            .doBeforeRetry(retrySignal -> LoggingUtils.warn(log, retrySignal.failure(),
                "Retrying {} call after transient failure. Attempt #{}",
                provider.displayName(), retrySignal.totalRetries() + 2))
            .onRetryExhaustedThrow((retryBackoffSpec, retrySignal) -> {
                LoggingUtils.error(log, retrySignal.failure(), "All retries failed for {} call", provider.displayName());
                return ProviderCallException.transientFailure(provider,
                    "Retries exhausted: " + LoggingUtils.summarize(retrySignal.failure()),
                    retrySignal.failure());
            });
    }

    /**
     * 5xx responses, connection/I/O failures and per-call timeouts.
     */
    public static boolean isTransient(Throwable throwable) {
        if (throwable instanceof ProviderCallException providerCallException) {
            return providerCallException.isRetryable();
        }
        if (throwable instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError();
        }
        return throwable instanceof IOException
            || throwable instanceof WebClientRequestException
            || throwable instanceof TimeoutException;
    }
}
