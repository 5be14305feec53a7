package com.skindx.infrastructure.ai.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the routing table. A missing resource yields {@link RoutingConfig#defaults()}.
 */
@Slf4j
public class RoutingConfigLoader {

    private final ObjectMapper objectMapper;
    private final Resource resource;

    public RoutingConfigLoader(ObjectMapper objectMapper, Resource resource) {
        this.objectMapper = objectMapper;
        this.resource = resource;
    }

    public String description() {
        return resource != null ? resource.getDescription() : "no routing resource";
    }

    /**
     * Reads the resource again on every call.
     *
     * @throws IllegalStateException when the resource exists but cannot be parsed
     */
    public RoutingConfig load() {
        if (resource == null || !resource.exists()) {
            log.info("[RoutingConfig] {} not found, using built-in defaults", resource);
            return RoutingConfig.defaults();
        }
        try (InputStream in = resource.getInputStream()) {
            RoutingConfig config = objectMapper.readValue(in, RoutingConfig.class);
            log.debug("[RoutingConfig] Loaded {} providers, {} stage routes from {}",
                    config.providers().size(), config.stageRouting().size(), resource.getDescription());
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Invalid routing config " + resource.getDescription() + ": " + e.getMessage(), e);
        }
    }
}
