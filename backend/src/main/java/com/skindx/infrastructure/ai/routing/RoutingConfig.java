package com.skindx.infrastructure.ai.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.skindx.domain.diagnosis.model.AiTask;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider routing table, read from {@code ai_routing.json}. Immutable; a reload
 * builds a new instance.
 *
 * @param providers        provider name to enablement/priority/timeout; models are set per
 *                         provider in {@code application.yml}
 * @param stageRouting     task key to ordered candidate lists
 * @param fallbackBehavior retry settings for {@code routeWithRetry}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingConfig(
        Map<String, ProviderSettings> providers,
        @JsonProperty("stage_routing") Map<String, StageRoute> stageRouting,
        @JsonProperty("fallback_behavior") FallbackBehavior fallbackBehavior
) {

    static final String DEFAULT_PRIMARY = "internal";
    static final int DEFAULT_MAX_RETRIES = 3;
    static final long DEFAULT_RETRY_DELAY_MS = 500;
    static final long DEFAULT_TIMEOUT_MS = 30_000;

    public RoutingConfig {
        providers = providers != null ? Map.copyOf(providers) : Map.of();
        stageRouting = stageRouting != null ? Map.copyOf(stageRouting) : Map.of();
        fallbackBehavior = fallbackBehavior != null ? fallbackBehavior : FallbackBehavior.defaults();
    }

    /**
     * Settings used when no config file exists: every provider enabled, no stage
     * routing (so every task goes to the internal model), three retries.
     */
    public static RoutingConfig defaults() {
        Map<String, ProviderSettings> providers = new LinkedHashMap<>();
        providers.put("internal", new ProviderSettings(true, 1, null));
        providers.put("openrouter", new ProviderSettings(true, 2, null));
        providers.put("gemini", new ProviderSettings(true, 3, null));
        providers.put("groq", new ProviderSettings(true, 4, null));
        return new RoutingConfig(providers, Map.of(), FallbackBehavior.defaults());
    }

    /**
     * Primary candidates followed by fallbacks, in configured order.
     */
    public List<String> candidateChain(AiTask task) {
        StageRoute route = stageRouting.get(task.configKey());
        if (route == null) {
            return List.of(DEFAULT_PRIMARY);
        }
        return route.chain();
    }

    /**
     * Providers absent from the table count as enabled.
     */
    public boolean isEnabled(String providerName) {
        ProviderSettings settings = providers.get(providerName);
        return settings == null || settings.enabled() == null || settings.enabled();
    }

    public Long timeoutMsFor(String providerName) {
        ProviderSettings settings = providers.get(providerName);
        return settings != null ? settings.timeoutMs() : null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProviderSettings(
            Boolean enabled,
            Integer priority,
            @JsonProperty("timeout_ms") Long timeoutMs
    ) {}

    /**
     * @param primary  defaults to {@code ["internal"]} when missing
     * @param fallback tried after every primary candidate
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StageRoute(List<String> primary, List<String> fallback) {

        public StageRoute {
            primary = primary != null ? List.copyOf(primary) : List.of(DEFAULT_PRIMARY);
            fallback = fallback != null ? List.copyOf(fallback) : List.of();
        }

        public List<String> chain() {
            List<String> chain = new ArrayList<>(primary);
            chain.addAll(fallback);
            return List.copyOf(chain);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FallbackBehavior(
            @JsonProperty("max_retries") Integer maxRetries,
            @JsonProperty("retry_delay_ms") Long retryDelayMs,
            @JsonProperty("exponential_backoff") Boolean exponentialBackoff
    ) {

        public static FallbackBehavior defaults() {
            return new FallbackBehavior(DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY_MS, true);
        }

        public int effectiveMaxRetries() {
            return maxRetries != null && maxRetries > 0 ? maxRetries : DEFAULT_MAX_RETRIES;
        }

        public long effectiveRetryDelayMs() {
            return retryDelayMs != null && retryDelayMs >= 0 ? retryDelayMs : DEFAULT_RETRY_DELAY_MS;
        }

        public boolean effectiveExponentialBackoff() {
            return exponentialBackoff == null || exponentialBackoff;
        }
    }
}
