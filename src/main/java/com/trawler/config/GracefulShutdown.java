package com.trawler.config;

import com.trawler.proxy.ProxyClientFactory;
import com.trawler.proxy.ProxyPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import jakarta.annotation.PreDestroy;

/**
 * Saves the pool and releases the probe connections on shutdown
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GracefulShutdown {

    private final ProxyPoolManager poolManager;
    private final ProxyClientFactory clientFactory;

    @PreDestroy
    public void shutdown() {
        log.info("Starting graceful shutdown...");

        try {
            poolManager.persistNow();
            log.info("Proxy pool state saved");

            clientFactory.shutdown();
            log.info("Probe connection pool shutdown completed");

            log.info("Graceful shutdown completed successfully");
        } catch (Exception e) {
            log.error("Error during graceful shutdown", e);
        }
    }
}
