package com.skindx.infrastructure.ai.routing;

import com.skindx.infrastructure.ai.provider.AiProvider;
import com.skindx.infrastructure.ai.provider.AiProviderFactory;
import com.skindx.infrastructure.ai.provider.ProviderKind;
import com.skindx.infrastructure.ai.provider.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily builds and caches one adapter per provider kind. A provider that cannot be
 * built is not cached, so it is attempted again on the next request.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final Map<ProviderKind, AiProviderFactory> factories = new EnumMap<>(ProviderKind.class);
    private final Map<ProviderKind, AiProvider> instances = new ConcurrentHashMap<>();

    public ProviderRegistry(List<AiProviderFactory> factories) {
        for (AiProviderFactory factory : factories) {
            this.factories.put(factory.kind(), factory);
        }
    }

    /**
     * @return empty for unknown names and for providers that are currently unavailable
     */
    public Optional<AiProvider> resolve(String providerName) {
        return ProviderKind.fromConfigName(providerName).flatMap(this::resolve);
    }

    public Optional<AiProvider> resolve(ProviderKind kind) {
        AiProviderFactory factory = factories.get(kind);
        if (factory == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(instances.computeIfAbsent(kind, k -> factory.create()));
        } catch (ProviderUnavailableException e) {
            log.debug("[Registry] {} unavailable: {}", kind.configName(), e.getMessage());
            return Optional.empty();
        }
    }
}
