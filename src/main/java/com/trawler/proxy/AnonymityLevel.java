package com.trawler.proxy;

import com.trawler.util.AddressUtil;

/**
 * How much of the caller's origin a proxy leaks, judged from the address an echo endpoint saw.
 */
public enum AnonymityLevel {
    ELITE(30),
    ANONYMOUS(20),
    TRANSPARENT(10);

    public final int points;

    AnonymityLevel(int points) {
        this.points = points;
    }

    /**
     * No usable echoed address means the origin was hidden entirely; the proxy's own address
     * means it presents itself; any other address is a leaked origin.
     */
    public static AnonymityLevel classify(String proxyHost, String echoedIp) {
        if (echoedIp == null || !AddressUtil.isIpv4(echoedIp)) {
            return ELITE;
        }
        if (echoedIp.trim().equals(proxyHost)) {
            return ANONYMOUS;
        }
        return TRANSPARENT;
    }
}
