package com.trawler.defense;

import java.util.Objects;

/**
 * Classified failure of a single scrape attempt. Lives only for that attempt.
 */
public record DefenseSignal(DefenseSignalKind kind, int retryCount) {

    public DefenseSignal {
        Objects.requireNonNull(kind, "kind");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount cannot be negative: " + retryCount);
        }
    }

    public static DefenseSignal of(DefenseSignalKind kind) {
        return new DefenseSignal(kind, 0);
    }

    public DefenseSignal nextRetry() {
        return new DefenseSignal(kind, retryCount + 1);
    }
}
