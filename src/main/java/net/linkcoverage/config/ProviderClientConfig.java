package net.linkcoverage.config;

import java.time.Duration;
import net.linkcoverage.support.retry.ProviderRetrySupport.RetrySettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry and timeout settings shared by live provider clients.
 */
@Configuration
public class ProviderClientConfig {

    @Bean
    public RetrySettings providerRetrySettings(
            @Value("${app.providers.retry.max-attempts:3}") int maxAttempts,
            @Value("${app.providers.retry.initial-backoff-ms:200}") long initialBackoffMillis,
            @Value("${app.providers.call-timeout-seconds:20}") long callTimeoutSeconds) {
        return new RetrySettings(
            maxAttempts,
            Duration.ofMillis(initialBackoffMillis),
            Duration.ofSeconds(callTimeoutSeconds)
        );
    }
}
