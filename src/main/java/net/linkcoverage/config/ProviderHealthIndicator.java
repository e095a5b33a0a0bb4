package net.linkcoverage.config;

import net.linkcoverage.service.provider.ProviderCallMonitor;
import net.linkcoverage.support.runtime.RuntimeConfig;
import net.linkcoverage.support.runtime.RuntimeConfigSnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Reports runtime mode and recorded provider errors. Provider failures never take the service
 * down because the gateway substitutes mock data, so the status stays UP and the errors are
 * surfaced as details.
 */
@Component("providersHealthIndicator")
public class ProviderHealthIndicator implements ReactiveHealthIndicator {

    private final RuntimeConfig runtimeConfig;
    private final ProviderCallMonitor callMonitor;

    public ProviderHealthIndicator(RuntimeConfig runtimeConfig, ProviderCallMonitor callMonitor) {
        this.runtimeConfig = runtimeConfig;
        this.callMonitor = callMonitor;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(() -> {
            RuntimeConfigSnapshot snapshot = runtimeConfig.snapshot();
            Health.Builder builder = Health.up()
                .withDetail("mock_mode", snapshot.mockMode())
                .withDetail("provider_status", snapshot.providerErrors().isEmpty() ? "healthy" : "degraded")
                .withDetail("provider_errors", snapshot.providerErrors())
                .withDetail("calls", callMonitor.getMetricsMap());
            return builder.build();
        });
    }
}
