package com.skindx.infrastructure.ai.provider;

import com.skindx.domain.diagnosis.model.AiTask;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Uniform capability of every inference backend. Implementations are shared across
 * concurrent diagnosis requests and must be safe for concurrent use.
 */
public interface AiProvider {

    ProviderKind kind();

    /**
     * Runs one pipeline task. Failures are reported through {@link ProviderResponse#failure(String)};
     * callers still guard against runtime exceptions.
     */
    ProviderResponse execute(AiTask task, Map<String, Object> input);

    /**
     * Open-ended chat completion, used by the assistant only.
     *
     * @throws ProviderCallException when the provider cannot answer
     */
    String chat(List<ChatMessage> messages);

    /**
     * Upper bound the router waits for {@link #execute} before moving to the next candidate.
     */
    Duration timeout();
}
