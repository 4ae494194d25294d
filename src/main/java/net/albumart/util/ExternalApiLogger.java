package net.albumart.util;

import org.slf4j.Logger;

/**
 * Centralized logging for outbound calls to the artwork lookup service and the playback device.
 *
 * Every line carries the {@code [EXTERNAL-API]} prefix so lookups, rejections and
 * cooldown skips can be followed with a single grep.
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query) {
        log.debug("{} [{}] ATTEMPT: {} for query='{}'", PREFIX, apiName, operation, query);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info("{} [{}] SUCCESS: {} returned {} result(s) for query='{}'",
            PREFIX, apiName, operation, resultCount, query);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for query='{}' - {}", PREFIX, apiName, operation, query, reason);
    }

    /**
     * Log a rate-limit rejection, whether signalled by the server or by the local budget
     */
    public static void logRateLimited(Logger log, String apiName, String query, String detail) {
        log.warn("{} [{}] RATE-LIMITED: query='{}' - {}", PREFIX, apiName, query, detail);
    }

    /**
     * Log a call skipped because the cooldown gate is closed
     */
    public static void logCooldownSkip(Logger log, String apiName, String query, long remainingSeconds) {
        log.debug("{} [{}] COOLDOWN: skipping query='{}' ({}s remaining)", PREFIX, apiName, query, remainingSeconds);
    }
}
