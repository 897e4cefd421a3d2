package com.trawler.proxy;

import java.util.Objects;
import java.util.Optional;

/**
 * What the pool hands a scrape loop: either a pooled proxy or the direct-connection sentinel.
 */
public final class ProxySelection {

    private static final ProxySelection DIRECT = new ProxySelection(null);

    private final ProxyRecord proxy;

    private ProxySelection(ProxyRecord proxy) {
        this.proxy = proxy;
    }

    public static ProxySelection of(ProxyRecord proxy) {
        return new ProxySelection(Objects.requireNonNull(proxy, "proxy"));
    }

    public static ProxySelection direct() {
        return DIRECT;
    }

    public boolean isDirect() {
        return proxy == null;
    }

    public Optional<ProxyRecord> proxy() {
        return Optional.ofNullable(proxy);
    }

    public String describe() {
        return isDirect() ? "direct connection" : proxy.address();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProxySelection other)) return false;
        return Objects.equals(proxy, other.proxy);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(proxy);
    }

    @Override
    public String toString() {
        return "ProxySelection{" + describe() + "}";
    }
}
