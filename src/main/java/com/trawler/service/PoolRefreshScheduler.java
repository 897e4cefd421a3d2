package com.trawler.service;

import com.trawler.proxy.PoolStatus;
import com.trawler.proxy.ProxyPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-harvests once the pool goes stale or runs dry, so scrape loops rarely pay for a harvest inline.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PoolRefreshScheduler {

    private final ProxyPoolManager poolManager;

    @Scheduled(fixedDelayString = "${proxy-pool.refresh-check-interval:PT15M}",
            initialDelayString = "${proxy-pool.refresh-check-interval:PT15M}")
    public void refreshIfNeeded() {
        PoolStatus status = poolManager.status();
        if (!status.stale() && status.workingProxies() > 0) {
            log.debug("Proxy pool healthy: {} working, {} blacklisted", status.workingProxies(), status.blacklistedProxies());
            return;
        }

        log.info("Proxy pool {} ({} working), refreshing", status.stale() ? "stale" : "empty", status.workingProxies());
        try {
            poolManager.refresh();
        } catch (RuntimeException e) {
            log.error("Scheduled proxy pool refresh failed: {}", e.getMessage(), e);
        }
    }
}
