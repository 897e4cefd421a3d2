package com.trawler.exception;

/**
 * Thrown when the pool has no working proxy left, a re-harvest produced nothing and direct
 * connections are disabled. Needs operator action: re-harvest or allow direct connection.
 */
public class ProxyPoolExhaustedException extends RuntimeException {

    private final int blacklistedCount;
    private final int consecutiveFailures;

    public ProxyPoolExhaustedException(int blacklistedCount, int consecutiveFailures) {
        super(String.format("No usable proxies: working pool empty, %d blacklisted, %d consecutive failures",
                blacklistedCount, consecutiveFailures));
        this.blacklistedCount = blacklistedCount;
        this.consecutiveFailures = consecutiveFailures;
    }

    public int getBlacklistedCount() {
        return blacklistedCount;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
