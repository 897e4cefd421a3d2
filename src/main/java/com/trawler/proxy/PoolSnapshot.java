package com.trawler.proxy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Persisted pool state. {@code timestamp} is when the snapshot was written; {@code generatedAt} is
 * when the working pool was harvested and is what freshness is judged by. Blacklist and shutdown
 * writes carry the harvest time forward unchanged.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PoolSnapshot(
        @JsonProperty("working_proxies") List<ProxyRecord> workingProxies,
        @JsonProperty("blacklisted_proxies") List<ProxyRecord> blacklistedProxies,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("generated_at") Instant generatedAt
) {

    public PoolSnapshot {
        workingProxies = workingProxies == null ? List.of() : List.copyOf(workingProxies);
        blacklistedProxies = blacklistedProxies == null ? List.of() : List.copyOf(blacklistedProxies);
    }

    /**
     * Harvest time, falling back to the write time for snapshots that predate {@code generated_at}.
     */
    public Instant harvestedAt() {
        return generatedAt != null ? generatedAt : timestamp;
    }
}
