package com.skindx.infrastructure.ai.routing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide per-provider call counters.
 */
@Slf4j
@Component
public class ProviderCallMetrics {

    private final Map<String, Counters> byProvider = new ConcurrentHashMap<>();

    public void recordCall(String provider, boolean success, long durationMs) {
        Counters counters = byProvider.computeIfAbsent(provider, p -> new Counters());
        counters.calls.incrementAndGet();
        counters.totalLatencyMs.addAndGet(durationMs);
        if (success) {
            counters.successes.incrementAndGet();
        }

        log.debug("Provider metrics - {} call #{}: success={}, latencyMs={}, cumulative: successRate={}%, avgLatencyMs={}",
                provider, counters.calls.get(), success, durationMs,
                String.format("%.1f", getSuccessRate(provider)), String.format("%.0f", getAverageLatencyMs(provider)));
    }

    public long getCalls(String provider) {
        Counters counters = byProvider.get(provider);
        return counters != null ? counters.calls.get() : 0;
    }

    public long getSuccesses(String provider) {
        Counters counters = byProvider.get(provider);
        return counters != null ? counters.successes.get() : 0;
    }

    public double getSuccessRate(String provider) {
        long calls = getCalls(provider);
        return calls > 0 ? (double) getSuccesses(provider) / calls * 100 : 0;
    }

    public double getAverageLatencyMs(String provider) {
        Counters counters = byProvider.get(provider);
        if (counters == null || counters.calls.get() == 0) return 0;
        return (double) counters.totalLatencyMs.get() / counters.calls.get();
    }

    private static final class Counters {
        private final AtomicLong calls = new AtomicLong();
        private final AtomicLong successes = new AtomicLong();
        private final AtomicLong totalLatencyMs = new AtomicLong();
    }
}
