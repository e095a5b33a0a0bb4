package net.linkcoverage.exception;

import net.linkcoverage.model.ProviderName;
import net.linkcoverage.model.ProviderStatus;

/**
 * Live provider call failed.
 * RETRYABLE: only when {@link #isRetryable()} (network errors and 5xx responses)
 *
 * <p>Messages must stay free of credentials and raw response bodies because the gateway copies
 * them into the runtime provider error map.</p>
 */
public class ProviderCallException extends RuntimeException {
    private final ProviderName provider;
    private final ProviderStatus status;
    private final boolean retryable;

    public ProviderCallException(ProviderName provider, ProviderStatus status, String message,
                                 boolean retryable, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.status = status;
        this.retryable = retryable;
    }

    public static ProviderCallException authError(ProviderName provider, String message) {
        return new ProviderCallException(provider, ProviderStatus.AUTH_ERROR, message, false, null);
    }

    public static ProviderCallException rateLimited(ProviderName provider, String message) {
        return new ProviderCallException(provider, ProviderStatus.RATE_LIMITED, message, false, null);
    }

    public static ProviderCallException transientFailure(ProviderName provider, String message, Throwable cause) {
        return new ProviderCallException(provider, ProviderStatus.ERROR, message, true, cause);
    }

    public ProviderName getProvider() {
        return provider;
    }

    public ProviderStatus getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
