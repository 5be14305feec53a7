package com.skindx.infrastructure.ai.provider;

import java.util.Arrays;
import java.util.Optional;

/**
 * Providers the router knows how to build. Routing config refers to them by {@link #configName()}.
 */
public enum ProviderKind {
    INTERNAL("internal"),
    OPENROUTER("openrouter"),
    GEMINI("gemini"),
    GROQ("groq");

    private final String configName;

    ProviderKind(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static Optional<ProviderKind> fromConfigName(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(k -> k.configName.equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}
