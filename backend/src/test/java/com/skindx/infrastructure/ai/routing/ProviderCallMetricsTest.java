package com.skindx.infrastructure.ai.routing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProviderCallMetricsTest {

    @Test
    void tracks_per_provider_counters() {
        ProviderCallMetrics metrics = new ProviderCallMetrics();

        metrics.recordCall("openrouter", true, 100);
        metrics.recordCall("openrouter", false, 300);
        metrics.recordCall("groq", true, 40);

        assertThat(metrics.getCalls("openrouter")).isEqualTo(2);
        assertThat(metrics.getSuccesses("openrouter")).isEqualTo(1);
        assertThat(metrics.getSuccessRate("openrouter")).isCloseTo(50.0, within(0.001));
        assertThat(metrics.getAverageLatencyMs("openrouter")).isCloseTo(200.0, within(0.001));
        assertThat(metrics.getSuccessRate("groq")).isCloseTo(100.0, within(0.001));
        assertThat(metrics.getCalls("gemini")).isZero();
    }
}
