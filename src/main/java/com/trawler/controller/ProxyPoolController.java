package com.trawler.controller;

import com.trawler.proxy.PoolStatus;
import com.trawler.proxy.ProxyPoolManager;
import com.trawler.proxy.ProxyRecord;
import com.trawler.proxy.ProxySelection;
import com.trawler.service.ProxyHarvestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin endpoints for inspecting and driving the proxy pool
 */
@RestController
@RequestMapping("/api/admin/pool")
@RequiredArgsConstructor
@Slf4j
public class ProxyPoolController {

    private final ProxyPoolManager poolManager;
    private final ProxyHarvestService harvestService;

    /**
     * GET /api/admin/pool/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        PoolStatus status = poolManager.status();

        Map<String, Object> response = new HashMap<>();
        response.put("workingProxies", status.workingProxies());
        response.put("blacklistedProxies", status.blacklistedProxies());
        response.put("cursor", status.cursor());
        response.put("consecutiveFailures", status.consecutiveFailures());
        response.put("maxFailures", status.maxFailures());
        response.put("directConnectionAllowed", status.directConnectionAllowed());
        response.put("usingDirectConnection", status.usesDirectConnection());
        response.put("generatedAt", status.generatedAt());
        response.put("stale", status.stale());
        harvestService.lastReport().ifPresent(report -> response.put("lastHarvest", report));
        response.put("timestamp", System.currentTimeMillis());

        return ResponseEntity.ok(response);
    }

    @GetMapping("/working")
    public ResponseEntity<List<ProxyRecord>> getWorking() {
        return ResponseEntity.ok(poolManager.workingProxies());
    }

    @GetMapping("/blacklisted")
    public ResponseEntity<List<ProxyRecord>> getBlacklisted() {
        return ResponseEntity.ok(poolManager.blacklistedProxies());
    }

    /**
     * Re-harvests synchronously. Probing runs on the bounded elastic scheduler, off the event loop.
     * POST /api/admin/pool/refresh
     */
    @PostMapping("/refresh")
    public Mono<ResponseEntity<Map<String, Object>>> refresh() {
        log.info("Manual proxy pool refresh requested via admin endpoint");
        return Mono.fromCallable(poolManager::refresh)
                .subscribeOn(Schedulers.boundedElastic())
                .map(refreshed -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("refreshed", refreshed);
                    response.put("workingProxies", poolManager.status().workingProxies());
                    response.put("message", refreshed
                            ? "Proxy pool refreshed"
                            : "Harvest produced no working proxies; previous pool kept");
                    response.put("timestamp", System.currentTimeMillis());
                    return ResponseEntity.ok(response);
                });
    }

    /**
     * Hands out the next rotation slot, mainly for manual testing. May trigger a harvest when the
     * pool is empty; exhaustion maps to 503.
     */
    @GetMapping("/next")
    public Mono<ResponseEntity<Map<String, Object>>> next() {
        return Mono.fromCallable(poolManager::nextProxy)
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::toResponse);
    }

    private ResponseEntity<Map<String, Object>> toResponse(ProxySelection selection) {
        Map<String, Object> response = new HashMap<>();
        response.put("direct", selection.isDirect());
        selection.proxy().ifPresent(p -> response.put("proxy", p));
        response.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(response);
    }
}
