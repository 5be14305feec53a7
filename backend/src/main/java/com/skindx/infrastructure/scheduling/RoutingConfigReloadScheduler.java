package com.skindx.infrastructure.scheduling;

import com.skindx.infrastructure.ai.routing.AiRouter;
import com.skindx.infrastructure.ai.routing.RoutingConfigLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Picks up edits to the routing file without a restart.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoutingConfigReloadScheduler {

    private final AiRouter aiRouter;
    private final RoutingConfigLoader routingConfigLoader;

    @Scheduled(initialDelayString = "${skindx.routing.reload-interval-ms:60000}",
            fixedDelayString = "${skindx.routing.reload-interval-ms:60000}")
    public void reloadRoutingConfig() {
        if (aiRouter.reloadConfig(routingConfigLoader)) {
            log.info("Routing config reloaded from {}", routingConfigLoader.description());
        } else {
            log.debug("Routing config unchanged");
        }
    }
}
