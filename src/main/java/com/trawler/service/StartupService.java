package com.trawler.service;

import com.trawler.bean.ProxyPoolProperties;
import com.trawler.proxy.ProxyPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class StartupService {

    private final ProxyPoolManager poolManager;
    private final ProxyPoolProperties props;

    /**
     * Warms the pool off the startup thread so the application comes up even when every proxy
     * source is unreachable.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Async
    public void startup() {
        if (!props.isWarmOnStartup()) {
            log.info("Proxy pool warm-up disabled; the pool fills on first use");
            return;
        }

        log.info("=== Application Ready - Warming Proxy Pool ===");
        try {
            if (poolManager.load()) {
                log.info("Using cached proxy state from {}", props.getStateDir());
                return;
            }
            if (!poolManager.refresh()) {
                log.warn("Proxy pool still empty after warm-up; direct connection allowed: {}",
                        props.isAllowDirectConnection());
            }
        } catch (RuntimeException e) {
            log.error("CRITICAL: Proxy pool warm-up failed: {}", e.getMessage(), e);
        }
    }
}
