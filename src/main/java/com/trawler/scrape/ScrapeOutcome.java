package com.trawler.scrape;

import com.trawler.defense.DefenseSignalKind;
import com.trawler.proxy.ProxySelection;

import java.util.Optional;

/**
 * Result of {@link ScrapeAttemptRunner#run}.
 *
 * @param attempts   proxies used, including the successful one
 * @param selection  the proxy used by the last attempt
 * @param lastSignal the signal that ended the last failed attempt, null on success
 */
public record ScrapeOutcome<T>(Status status, T value, int attempts, ProxySelection selection, DefenseSignalKind lastSignal) {

    public enum Status {
        SUCCEEDED,
        /** retries on one URL ran out; the caller may try the query again later */
        ABORTED,
        /** every allowed rotation hit a defense */
        ROTATIONS_EXHAUSTED
    }

    public static <T> ScrapeOutcome<T> succeeded(T value, int attempts, ProxySelection selection) {
        return new ScrapeOutcome<>(Status.SUCCEEDED, value, attempts, selection, null);
    }

    public static <T> ScrapeOutcome<T> failed(Status status, int attempts, ProxySelection selection, DefenseSignalKind signal) {
        return new ScrapeOutcome<>(status, null, attempts, selection, signal);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public Optional<T> result() {
        return Optional.ofNullable(value);
    }
}
