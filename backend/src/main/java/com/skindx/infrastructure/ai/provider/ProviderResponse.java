package com.skindx.infrastructure.ai.provider;

import java.util.Map;

/**
 * Answer of a single provider to a single task.
 *
 * @param data  provider output, present when {@code success}
 * @param error failure detail, present when not {@code success}
 */
public record ProviderResponse(boolean success, Map<String, Object> data, String error) {

    public static ProviderResponse ok(Map<String, Object> data) {
        return new ProviderResponse(true, data != null ? data : Map.of(), null);
    }

    public static ProviderResponse failure(String error) {
        return new ProviderResponse(false, null, error);
    }
}
