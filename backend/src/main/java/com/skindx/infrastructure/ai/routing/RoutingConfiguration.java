package com.skindx.infrastructure.ai.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class RoutingConfiguration {

    @Value("${skindx.routing.config-path:classpath:config/ai_routing.json}")
    private Resource routingConfigResource;

    @Bean
    public RoutingConfigLoader routingConfigLoader(ObjectMapper objectMapper) {
        return new RoutingConfigLoader(objectMapper, routingConfigResource);
    }

    @Bean
    public RoutingConfig routingConfig(RoutingConfigLoader routingConfigLoader) {
        RoutingConfig config = routingConfigLoader.load();
        log.info("[RoutingConfig] {} providers, {} stage routes from {}",
                config.providers().size(), config.stageRouting().size(), routingConfigLoader.description());
        return config;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerCallExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "provider-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
