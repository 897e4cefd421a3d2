package com.trawler.proxy.source;

import com.trawler.proxy.ProxyCandidate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every configured source and deduplicates the union on address, first occurrence winning.
 */
@Slf4j
public class CandidateCollector {

    private final List<ProxySource> sources;

    public CandidateCollector(List<ProxySource> sources) {
        this.sources = List.copyOf(sources);
    }

    public List<ProxyCandidate> collect() {
        log.info("Commencing proxy extraction from {} sources", sources.size());

        Map<String, ProxyCandidate> unique = new LinkedHashMap<>();
        int total = 0;
        for (ProxySource source : sources) {
            List<ProxyCandidate> fetched;
            try {
                fetched = source.fetchCandidates();
            } catch (RuntimeException e) {
                log.warn("Proxy source {} failed unexpectedly: {}", source.name(), e.getMessage());
                continue;
            }
            total += fetched.size();
            for (ProxyCandidate candidate : fetched) {
                unique.putIfAbsent(candidate.address(), candidate);
            }
        }

        log.info("Extracted {} unique proxies for testing ({} before deduplication)", unique.size(), total);
        return new ArrayList<>(unique.values());
    }

    public int sourceCount() {
        return sources.size();
    }
}
