/**
 * Service for monitoring provider call metrics
 * - Tracks call outcomes per provider since startup
 * - Keeps the last failure description per provider
 * - Feeds the provider health indicator
 */
package net.linkcoverage.service.provider;

import net.linkcoverage.model.ProviderName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class ProviderCallMonitor {
    private static final Logger logger = LoggerFactory.getLogger(ProviderCallMonitor.class);

    private final Map<ProviderName, Counters> counters = new EnumMap<>(ProviderName.class);
    private final Instant startedAt = Instant.now();

    public ProviderCallMonitor() {
        for (ProviderName provider : ProviderName.values()) {
            counters.put(provider, new Counters());
        }
    }

    /**
     * Records a live call that returned a usable payload
     * @param provider provider that was called
     */
    public void recordLiveSuccess(ProviderName provider) {
        Counters c = counters.get(provider);
        c.liveCalls.incrementAndGet();
        c.liveSuccesses.incrementAndGet();
        long total = c.liveCalls.get();
        if (total % 50 == 0) {
            logger.info("{} live call count reached {}", provider.displayName(), total);
        }
    }

    /**
     * Records a live call that failed after retries
     * @param provider provider that was called
     * @param errorMessage sanitized failure description
     */
    public void recordLiveFailure(ProviderName provider, String errorMessage) {
        Counters c = counters.get(provider);
        c.liveCalls.incrementAndGet();
        c.liveFailures.incrementAndGet();
        c.lastFailure.set(errorMessage);
        logger.warn("Failed {} call: {}", provider.displayName(), errorMessage);
    }

    public void recordRateLimited(ProviderName provider) {
        counters.get(provider).rateLimited.incrementAndGet();
    }

    public void recordMockServed(ProviderName provider) {
        counters.get(provider).mockServed.incrementAndGet();
    }

    public void recordMockFallback(ProviderName provider) {
        counters.get(provider).mockFallbacks.incrementAndGet();
    }

    public ProviderCallStats getStats(ProviderName provider) {
        Counters c = counters.get(provider);
        return new ProviderCallStats(
            c.liveCalls.get(),
            c.liveSuccesses.get(),
            c.liveFailures.get(),
            c.rateLimited.get(),
            c.mockServed.get(),
            c.mockFallbacks.get(),
            c.lastFailure.get()
        );
    }

    /**
     * Flattened counters keyed {@code <provider>.<counter>}, suitable for health details.
     */
    public Map<String, Object> getMetricsMap() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("monitoringSince", startedAt.toString());
        for (ProviderName provider : ProviderName.values()) {
            ProviderCallStats stats = getStats(provider);
            String prefix = provider.key() + ".";
            metrics.put(prefix + "liveCalls", stats.liveCalls());
            metrics.put(prefix + "liveSuccesses", stats.liveSuccesses());
            metrics.put(prefix + "liveFailures", stats.liveFailures());
            metrics.put(prefix + "rateLimited", stats.rateLimited());
            metrics.put(prefix + "mockServed", stats.mockServed());
            metrics.put(prefix + "mockFallbacks", stats.mockFallbacks());
        }
        return metrics;
    }

    public void reset() {
        counters.values().forEach(Counters::reset);
        logger.info("Provider call counters reset");
    }

    public record ProviderCallStats(long liveCalls,
                                    long liveSuccesses,
                                    long liveFailures,
                                    long rateLimited,
                                    long mockServed,
                                    long mockFallbacks,
                                    String lastFailure) {
    }

    private static final class Counters {
        private final AtomicLong liveCalls = new AtomicLong();
        private final AtomicLong liveSuccesses = new AtomicLong();
        private final AtomicLong liveFailures = new AtomicLong();
        private final AtomicLong rateLimited = new AtomicLong();
        private final AtomicLong mockServed = new AtomicLong();
        private final AtomicLong mockFallbacks = new AtomicLong();
        private final AtomicReference<String> lastFailure = new AtomicReference<>();

        private void reset() {
            liveCalls.set(0);
            liveSuccesses.set(0);
            liveFailures.set(0);
            rateLimited.set(0);
            mockServed.set(0);
            mockFallbacks.set(0);
            lastFailure.set(null);
        }
    }
}
