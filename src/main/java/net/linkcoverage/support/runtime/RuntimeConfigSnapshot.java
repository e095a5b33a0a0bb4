package net.linkcoverage.support.runtime;

import java.util.Map;

/**
 * Detached copy of {@link RuntimeConfig} state.
 *
 * @param providerErrors last error per lowercase provider key
 */
public record RuntimeConfigSnapshot(boolean mockMode, Map<String, String> providerErrors) {

    public RuntimeConfigSnapshot {
        providerErrors = providerErrors == null ? Map.of() : Map.copyOf(providerErrors);
    }
}
