package net.linkcoverage.model;

/**
 * Outcome tag attached to every provider query result.
 *
 * <p>{@link #ERROR} marks a transient live failure (network or 5xx after retries) that the
 * gateway resolved with mock data; the other non-OK tags keep their literal meaning.</p>
 */
public enum ProviderStatus {
    OK("ok"),
    RATE_LIMITED("rate_limited"),
    AUTH_ERROR("auth_error"),
    EMPTY("empty"),
    ERROR("error");

    private final String wireValue;

    ProviderStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
