package com.trawler.proxy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Objects;

/**
 * A candidate that answered a health probe. Identity is {@link #address()}, so a record keeps its
 * place in the pool and the blacklist no matter how often it is re-scored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProxyRecord(
        String host,
        int port,
        boolean https,
        String source,
        String country,
        boolean reachable,
        long latencyMillis,
        String returnedIp,
        AnonymityLevel anonymity,
        SpeedClass speed,
        int score,
        Instant lastChecked
) {

    public ProxyRecord {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Proxy host cannot be null or empty");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Invalid proxy port " + port + " for host " + host);
        }
        if (latencyMillis < 0) {
            throw new IllegalArgumentException("Latency cannot be negative: " + latencyMillis);
        }
        Objects.requireNonNull(anonymity, "anonymity");
        Objects.requireNonNull(speed, "speed");
        source = source == null ? "" : source;
        country = country == null ? "" : country;
    }

    /**
     * Record for a candidate that passed its probe; anonymity and speed are derived here so every
     * record in the pool carries them.
     */
    public static ProxyRecord tested(ProxyCandidate candidate, long latencyMillis, String echoedIp, Instant checkedAt) {
        return new ProxyRecord(
                candidate.host(),
                candidate.port(),
                candidate.https(),
                candidate.source(),
                candidate.country(),
                true,
                latencyMillis,
                echoedIp,
                AnonymityLevel.classify(candidate.host(), echoedIp),
                SpeedClass.fromLatency(latencyMillis),
                0,
                checkedAt);
    }

    public ProxyRecord withScore(int newScore) {
        return new ProxyRecord(host, port, https, source, country, reachable, latencyMillis,
                returnedIp, anonymity, speed, newScore, lastChecked);
    }

    public String address() {
        return host + ":" + port;
    }

    public ProxyCandidate candidate() {
        return new ProxyCandidate(host, port, https, source, country);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProxyRecord other)) return false;
        return port == other.port && host.equals(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return String.format("%s (%s, %s, %dms, score %d)", address(), anonymity, speed, latencyMillis, score);
    }
}
