package com.skindx.infrastructure.ai.routing;

import java.util.List;
import java.util.Map;

/**
 * Outcome of routing one task through its provider chain.
 *
 * @param data         output of the winning provider, null on total failure
 * @param provider     winning provider name, empty on total failure
 * @param fallbackUsed true iff some candidate failed before the final outcome
 * @param attempts     every candidate actually invoked, in order
 */
public record AiResult(
        boolean success,
        Map<String, Object> data,
        String error,
        String provider,
        long durationMs,
        boolean fallbackUsed,
        List<ProviderAttempt> attempts
) {

    public AiResult {
        attempts = attempts != null ? List.copyOf(attempts) : List.of();
    }

    public static AiResult succeeded(String provider, Map<String, Object> data, long durationMs,
                                     boolean fallbackUsed, List<ProviderAttempt> attempts) {
        return new AiResult(true, data, null, provider, durationMs, fallbackUsed, attempts);
    }

    public static AiResult exhausted(String taskKey, List<ProviderAttempt> attempts) {
        return new AiResult(false, null, "All AI providers failed for " + taskKey, "", 0, true, attempts);
    }

    /**
     * @param error null for a successful attempt
     */
    public record ProviderAttempt(String provider, boolean success, long durationMs, String error) {}
}
