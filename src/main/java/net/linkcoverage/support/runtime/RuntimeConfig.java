package net.linkcoverage.support.runtime;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import net.linkcoverage.model.ProviderName;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Process-wide runtime switches shared by the provider gateway and administrative callers.
 *
 * <p>Many readers, few writers: every provider call reads the mock flag, while the flag only
 * changes through an explicit toggle. Reads return detached snapshots so a caller never observes
 * a half-applied update.</p>
 */
@Slf4j
@Component
public class RuntimeConfig {

    static final int MAX_ERROR_LENGTH = 200;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, String> providerErrors = new LinkedHashMap<>();
    private boolean mockMode;

    public RuntimeConfig(@Value("${app.runtime.mock-mode:true}") boolean initialMockMode) {
        this.mockMode = initialMockMode;
    }

    public boolean isMockMode() {
        lock.readLock().lock();
        try {
            return mockMode;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Flips mock mode. In-flight provider calls keep the value they read when they started.
     *
     * @return the snapshot after the change
     */
    public RuntimeConfigSnapshot setMockMode(boolean enabled) {
        lock.writeLock().lock();
        try {
            if (mockMode != enabled) {
                log.info("Runtime mock mode changed from {} to {}", mockMode, enabled);
            }
            mockMode = enabled;
            return snapshotUnderLock();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores the latest failure for a provider. The message is flattened to one line and
     * truncated; callers are responsible for keeping credentials out of it.
     */
    public void recordProviderError(ProviderName provider, String message) {
        recordProviderError(provider.key(), message);
    }

    public void recordProviderError(String provider, String message) {
        if (provider == null || provider.isBlank()) {
            return;
        }
        String key = provider.trim().toLowerCase(Locale.ROOT);
        String sanitized = sanitize(message);
        lock.writeLock().lock();
        try {
            providerErrors.put(key, sanitized);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clearProviderError(ProviderName provider) {
        lock.writeLock().lock();
        try {
            providerErrors.remove(provider.key());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clearProviderErrors() {
        lock.writeLock().lock();
        try {
            providerErrors.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public RuntimeConfigSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return snapshotUnderLock();
        } finally {
            lock.readLock().unlock();
        }
    }

    private RuntimeConfigSnapshot snapshotUnderLock() {
        return new RuntimeConfigSnapshot(mockMode, Map.copyOf(providerErrors));
    }

    static String sanitize(String message) {
        if (message == null || message.isBlank()) {
            return "Unknown provider error";
        }
        String flattened = message.replaceAll("\\s+", " ").trim();
        return flattened.length() > MAX_ERROR_LENGTH
            ? flattened.substring(0, MAX_ERROR_LENGTH)
            : flattened;
    }
}
