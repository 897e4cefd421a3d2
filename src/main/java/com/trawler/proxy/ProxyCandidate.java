package com.trawler.proxy;

import com.trawler.util.AddressUtil;

/**
 * Untested proxy endpoint pulled from a feed. Identity is {@link #address()}.
 */
public record ProxyCandidate(
        String host,
        int port,
        boolean https,
        String source,
        String country
) {

    public ProxyCandidate {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Proxy host cannot be null or empty");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Invalid proxy port " + port + " for host " + host);
        }
        host = host.trim();
        source = source == null ? "" : source;
        country = AddressUtil.normalizeCountry(country);
    }

    public String address() {
        return host + ":" + port;
    }

    public boolean hasCountry() {
        return !country.isEmpty();
    }
}
