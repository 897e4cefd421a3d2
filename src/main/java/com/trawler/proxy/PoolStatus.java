package com.trawler.proxy;

import java.time.Instant;

public record PoolStatus(
        int workingProxies,
        int blacklistedProxies,
        int cursor,
        int consecutiveFailures,
        int maxFailures,
        boolean directConnectionAllowed,
        Instant generatedAt,
        boolean stale
) {
    public boolean usesDirectConnection() {
        return directConnectionAllowed && consecutiveFailures >= maxFailures;
    }
}
