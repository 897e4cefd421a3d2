package com.trawler.defense;

public enum DefenseSignalKind {
    CAPTCHA,
    RATE_LIMIT,
    TIMEOUT,
    NETWORK_ERROR,
    OFF_TARGET;

    /**
     * Signals that burn the current proxy immediately instead of retrying on it.
     */
    public boolean rotatesProxy() {
        return this != TIMEOUT;
    }
}
