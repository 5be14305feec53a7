package com.skindx.infrastructure.ai.pipeline;

import com.skindx.infrastructure.ai.provider.ProviderFlags;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed reads over a provider answer. Providers return loosely typed JSON, so every
 * accessor takes the value to use when a field is missing or has the wrong shape.
 */
final class ProviderPayload {

    private final Map<String, Object> data;

    private ProviderPayload(Map<String, Object> data) {
        this.data = data != null ? data : Map.of();
    }

    static ProviderPayload of(Map<String, Object> data) {
        return new ProviderPayload(data);
    }

    boolean bool(String key, boolean defaultValue) {
        return ProviderFlags.read(data.get(key)).orElse(defaultValue);
    }

    /**
     * NaN and infinities count as missing.
     */
    double number(String key, double defaultValue) {
        Object value = data.get(key);
        double number;
        if (value instanceof Number n) {
            number = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                number = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        } else {
            return defaultValue;
        }
        return Double.isFinite(number) ? number : defaultValue;
    }

    String text(String key, String defaultValue) {
        Object value = data.get(key);
        if (value == null) return defaultValue;
        String text = value.toString();
        return text.isBlank() ? defaultValue : text;
    }

    Object raw(String key) {
        return data.get(key);
    }

    boolean has(String key) {
        return data.get(key) != null;
    }

    List<String> strings(String key) {
        if (!(data.get(key) instanceof List<?> list)) return List.of();
        return list.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    List<Object> list(String key) {
        if (!(data.get(key) instanceof List<?> list)) return List.of();
        return list.stream()
                .filter(Objects::nonNull)
                .map(Object.class::cast)
                .toList();
    }
}
