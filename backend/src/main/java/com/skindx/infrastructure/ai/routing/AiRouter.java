package com.skindx.infrastructure.ai.routing;

import com.skindx.domain.diagnosis.model.AiTask;
import com.skindx.domain.diagnosis.service.RecordSink;
import com.skindx.infrastructure.ai.provider.AiProvider;
import com.skindx.infrastructure.ai.provider.ProviderResponse;
import com.skindx.infrastructure.ai.routing.AiResult.ProviderAttempt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes each pipeline task through its configured provider chain.
 * <p>
 * Candidates are tried strictly in order: primary list, then fallback list. Disabled,
 * unknown and unavailable providers are skipped without counting as failures. Every
 * invoked candidate runs under its own timeout; the first usable answer wins.
 * </p>
 * The routing table can be swapped at runtime with {@link #replaceConfig}; a single
 * {@link #route} call always sees one consistent table.
 */
@Slf4j
@Component
public class AiRouter {

    private final ProviderRegistry registry;
    private final ProviderOutputPolicy outputPolicy;
    private final RecordSink recordSink;
    private final ProviderCallMetrics metrics;
    private final ExecutorService executor;
    private final Sleeper sleeper;

    private volatile RoutingConfig config;

    @Autowired
    public AiRouter(RoutingConfig config,
                    ProviderRegistry registry,
                    ProviderOutputPolicy outputPolicy,
                    RecordSink recordSink,
                    ProviderCallMetrics metrics,
                    @Qualifier("providerCallExecutor") ExecutorService executor) {
        this(config, registry, outputPolicy, recordSink, metrics, executor, Thread::sleep);
    }

    AiRouter(RoutingConfig config,
             ProviderRegistry registry,
             ProviderOutputPolicy outputPolicy,
             RecordSink recordSink,
             ProviderCallMetrics metrics,
             ExecutorService executor,
             Sleeper sleeper) {
        this.config = config;
        this.registry = registry;
        this.outputPolicy = outputPolicy;
        this.recordSink = recordSink;
        this.metrics = metrics;
        this.executor = executor;
        this.sleeper = sleeper;
    }

    /**
     * Tries each candidate for the task once.
     *
     * @param correlationId diagnosis id, used for logs and AI-call records
     * @return the first successful answer, or an exhausted result; never throws for provider faults
     */
    public AiResult route(AiTask task, Map<String, Object> input, String correlationId) {
        RoutingConfig current = this.config;
        List<ProviderAttempt> attempts = new ArrayList<>();

        for (String providerName : current.candidateChain(task)) {
            if (!current.isEnabled(providerName)) {
                log.debug("[Router] {} disabled, skipping for {}", providerName, task);
                continue;
            }
            Optional<AiProvider> resolved = registry.resolve(providerName);
            if (resolved.isEmpty()) {
                log.debug("[Router] {} not available, skipping for {}", providerName, task);
                continue;
            }

            CallOutcome outcome = invoke(resolved.get(), providerName, task, input, correlationId, current);
            boolean earlierFailure = !attempts.isEmpty();
            attempts.add(outcome.attempt());

            if (outcome.attempt().success()) {
                log.info("[Router] {} handled {} in {}ms (diagnosis={}, fallback={})",
                        providerName, task, outcome.attempt().durationMs(), correlationId, earlierFailure);
                return AiResult.succeeded(providerName, outcome.data(), outcome.attempt().durationMs(),
                        earlierFailure, attempts);
            }
            log.warn("[Router] {} failed for {} (diagnosis={}): {}",
                    providerName, task, correlationId, outcome.attempt().error());

            if (Thread.currentThread().isInterrupted()) {
                log.warn("[Router] Interrupted while routing {} (diagnosis={})", task, correlationId);
                break;
            }
        }

        log.error("[Router] All AI providers failed for {} (diagnosis={}, attempts={})",
                task, correlationId, attempts.size());
        return AiResult.exhausted(task.configKey(), attempts);
    }

    /**
     * Repeats {@link #route} while the whole chain is exhausted, backing off between rounds.
     *
     * @param maxRetries total rounds; null or non-positive uses {@code fallback_behavior.max_retries}
     * @return the first successful result, else the last exhausted one
     */
    public AiResult routeWithRetry(AiTask task, Map<String, Object> input, String correlationId, Integer maxRetries) {
        RoutingConfig.FallbackBehavior behavior = this.config.fallbackBehavior();
        int rounds = maxRetries != null && maxRetries > 0 ? maxRetries : behavior.effectiveMaxRetries();

        AiResult result = null;
        for (int round = 0; round < rounds; round++) {
            result = route(task, input, correlationId);
            if (result.success()) {
                return result;
            }
            if (round == rounds - 1) {
                break;
            }

            long delayMs = backoffDelayMs(behavior, round);
            log.warn("[Router] Chain exhausted for {} (diagnosis={}), round {}/{}, retrying in {}ms",
                    task, correlationId, round + 1, rounds, delayMs);
            try {
                sleeper.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[Router] Retry of {} interrupted (diagnosis={})", task, correlationId);
                break;
            }
        }
        return result;
    }

    /**
     * Installs a new routing table. Calls already in flight keep the table they started with.
     */
    public void replaceConfig(RoutingConfig newConfig) {
        this.config = newConfig;
        log.info("[Router] Routing config replaced ({} stage routes)", newConfig.stageRouting().size());
    }

    /**
     * Re-reads the routing table and installs it when it changed. A table that cannot be
     * parsed is logged and the current one stays in place.
     *
     * @return true when a new table was installed
     */
    public boolean reloadConfig(RoutingConfigLoader loader) {
        RoutingConfig reloaded;
        try {
            reloaded = loader.load();
        } catch (IllegalStateException e) {
            log.warn("[Router] Keeping current routing config: {}", e.getMessage());
            return false;
        }
        if (reloaded.equals(this.config)) {
            return false;
        }
        replaceConfig(reloaded);
        return true;
    }

    public RoutingConfig currentConfig() {
        return config;
    }

    static long backoffDelayMs(RoutingConfig.FallbackBehavior behavior, int round) {
        long base = behavior.effectiveRetryDelayMs();
        if (!behavior.effectiveExponentialBackoff()) {
            return base;
        }
        return base * (1L << Math.min(round, 20));
    }

    private CallOutcome invoke(AiProvider provider, String providerName, AiTask task,
                               Map<String, Object> input, String correlationId, RoutingConfig current) {
        long timeoutMs = timeoutMsFor(provider, providerName, current);
        long start = System.nanoTime();
        String error = null;
        Map<String, Object> data = null;

        CompletableFuture<ProviderResponse> future =
                CompletableFuture.supplyAsync(() -> provider.execute(task, input), executor);
        try {
            ProviderResponse response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (response == null) {
                error = "empty response";
            } else if (!response.success()) {
                error = response.error() != null ? response.error() : "unknown provider error";
            } else {
                Optional<String> rejection = outputPolicy.findRejection(task, response.data());
                if (rejection.isPresent()) {
                    error = rejection.get();
                } else {
                    data = response.data();
                }
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            error = "timeout after " + timeoutMs + "ms";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            error = "interrupted";
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        boolean success = error == null;
        metrics.recordCall(providerName, success, durationMs);
        record(correlationId, task, providerName, success, durationMs, error);
        return new CallOutcome(new ProviderAttempt(providerName, success, durationMs, error), data);
    }

    private long timeoutMsFor(AiProvider provider, String providerName, RoutingConfig current) {
        Long configured = current.timeoutMsFor(providerName);
        if (configured != null && configured > 0) {
            return configured;
        }
        Duration timeout = provider.timeout();
        return timeout != null ? timeout.toMillis() : RoutingConfig.DEFAULT_TIMEOUT_MS;
    }

    private void record(String correlationId, AiTask task, String providerName,
                        boolean success, long durationMs, String error) {
        try {
            recordSink.recordAiCall(correlationId, task, providerName, success, durationMs, error);
        } catch (RuntimeException e) {
            log.warn("[Router] Failed to record AI call for {} (diagnosis={}): {}", task, correlationId, e.getMessage());
        }
    }

    private record CallOutcome(ProviderAttempt attempt, Map<String, Object> data) {}

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
