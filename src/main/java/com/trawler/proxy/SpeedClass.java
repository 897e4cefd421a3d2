package com.trawler.proxy;

public enum SpeedClass {
    FAST,
    MEDIUM,
    SLOW;

    private static final long FAST_BELOW_MS = 1_000;
    private static final long MEDIUM_BELOW_MS = 3_000;

    public static SpeedClass fromLatency(long latencyMillis) {
        if (latencyMillis < FAST_BELOW_MS) {
            return FAST;
        }
        if (latencyMillis < MEDIUM_BELOW_MS) {
            return MEDIUM;
        }
        return SLOW;
    }
}
