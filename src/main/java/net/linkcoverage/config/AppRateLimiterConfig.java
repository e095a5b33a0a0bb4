/**
 * Configuration for provider rate limiters
 * - One token budget per external backlink provider
 * - Budgets never queue callers; an exhausted budget is reported as rate_limited
 */
package net.linkcoverage.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AppRateLimiterConfig {
    private static final Logger logger = LoggerFactory.getLogger(AppRateLimiterConfig.class);

    @Value("${app.providers.ahrefs.requests-per-minute:30}")
    private int ahrefsRequestsPerMinute;

    @Value("${app.providers.dataforseo.requests-per-minute:30}")
    private int dataForSeoRequestsPerMinute;

    /**
     * Rate limiter for the Ahrefs API
     *
     * @return limiter refreshed every minute with the configured budget
     */
    @Bean
    public RateLimiter ahrefsRateLimiter() {
        RateLimiter rateLimiter = perMinute("ahrefsProviderRateLimiter", ahrefsRequestsPerMinute);
        logger.info("Ahrefs rate limiter initialized with limit of {} requests/minute", ahrefsRequestsPerMinute);
        return rateLimiter;
    }

    /**
     * Rate limiter for the DataForSEO API
     *
     * @return limiter refreshed every minute with the configured budget
     */
    @Bean
    public RateLimiter dataForSeoRateLimiter() {
        RateLimiter rateLimiter = perMinute("dataForSeoProviderRateLimiter", dataForSeoRequestsPerMinute);
        logger.info("DataForSEO rate limiter initialized with limit of {} requests/minute", dataForSeoRequestsPerMinute);
        return rateLimiter;
    }

    /**
     * Builds a non-blocking limiter: {@code timeoutDuration(ZERO)} makes
     * {@link RateLimiter#acquirePermission()} return false instead of waiting.
     */
    public static RateLimiter perMinute(String name, int requestsPerMinute) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, requestsPerMinute))
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiter.of(name, config);
    }
}
