package com.trawler.proxy;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Additive proxy ranking:
 *
 * Latency (max 50): &lt;0.5s 50, &lt;1s 40, &lt;2s 30, &lt;3s 20, else 10
 * Anonymity (max 30): elite 30, anonymous 20, transparent 10
 * Transport (max 20): https-capable 20
 *
 * Pure functions of the record, no side effects.
 */
@Component
public class ProxyScorer {

    public static final int MIN_SCORE = 10;
    public static final int MAX_SCORE = 100;
    private static final int HTTPS_POINTS = 20;

    private static final Comparator<ProxyRecord> RANKING = Comparator
            .comparingInt(ProxyRecord::score).reversed()
            .thenComparingLong(ProxyRecord::latencyMillis);

    public int score(ProxyRecord record) {
        int total = latencyPoints(record.latencyMillis())
                + record.anonymity().points
                + (record.https() ? HTTPS_POINTS : 0);
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, total));
    }

    /**
     * Scored copies of the best {@code count} records, highest score first, ties to the faster
     * proxy. Equal score and latency keep input order.
     */
    public List<ProxyRecord> selectBest(List<ProxyRecord> records, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative: " + count);
        }
        if (records == null || records.isEmpty() || count == 0) {
            return List.of();
        }

        return records.stream()
                .map(r -> r.withScore(score(r)))
                .sorted(RANKING)
                .limit(count)
                .toList();
    }

    private int latencyPoints(long latencyMillis) {
        if (latencyMillis < 500) return 50;
        if (latencyMillis < 1_000) return 40;
        if (latencyMillis < 2_000) return 30;
        if (latencyMillis < 3_000) return 20;
        return 10;
    }
}
