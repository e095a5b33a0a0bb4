package net.linkcoverage.util;

import org.slf4j.Logger;

/**
 * Uniform console lines for provider traffic so a single grep on {@code [EXTERNAL-API]} shows
 * every live call, rate-limit rejection and mock substitution for a domain.
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    public static void logApiCallAttempt(Logger log, String apiName, String operation, String domain) {
        log.info(String.format("%s [%s] ATTEMPT: %s for domain='%s'", PREFIX, apiName, operation, domain));
    }

    public static void logApiCallSuccess(Logger log, String apiName, String operation, String domain, int resultCount) {
        log.info(String.format("%s [%s] SUCCESS: %s returned %d row(s) for domain='%s'",
            PREFIX, apiName, operation, resultCount, domain));
    }

    public static void logApiCallFailure(Logger log, String apiName, String operation, String domain, String reason) {
        log.warn(String.format("%s [%s] FAILURE: %s failed for domain='%s' - %s",
            PREFIX, apiName, operation, domain, reason));
    }

    public static void logRateLimited(Logger log, String apiName, String domain) {
        log.info(String.format("%s [%s] RATE-LIMITED: budget exhausted, rejecting call for domain='%s'",
            PREFIX, apiName, domain));
    }

    public static void logMockServed(Logger log, String apiName, String domain, int resultCount) {
        log.debug(String.format("%s [%s] MOCK: served %d deterministic row(s) for domain='%s'",
            PREFIX, apiName, resultCount, domain));
    }

    public static void logMockFallback(Logger log, String apiName, String domain, String status) {
        log.info(String.format("%s [%s] FALLBACK: live call ended with %s, serving mock data for domain='%s'",
            PREFIX, apiName, status, domain));
    }

    public static void logHttpResponse(Logger log, String apiName, int statusCode, String url, int bodySize) {
        log.debug(String.format("%s [%s] [HTTP] Response: status=%d, url=%s, bodySize=%d bytes",
            PREFIX, apiName, statusCode, url, bodySize));
    }
}
