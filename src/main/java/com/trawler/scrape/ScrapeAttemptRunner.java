package com.trawler.scrape;

import com.trawler.bean.DefenseProperties;
import com.trawler.defense.DefenseAction;
import com.trawler.defense.DefenseDetector;
import com.trawler.defense.DefenseSignal;
import com.trawler.defense.DefenseSignalKind;
import com.trawler.defense.NavigationResult;
import com.trawler.defense.RecentErrorWindow;
import com.trawler.defense.RetryController;
import com.trawler.exception.NavigationTimeoutException;
import com.trawler.exception.ProxyPoolExhaustedException;
import com.trawler.proxy.ProxyPoolManager;
import com.trawler.proxy.ProxySelection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Drives one URL through the pool: take a proxy, open a browser on it, navigate, check for
 * defenses and extract. Every proxy use gets exactly one success or failure report before the next
 * proxy is requested.
 *
 * A proxy that succeeds is kept for the next {@code defense.listings-per-proxy} runs, so one runner
 * belongs to one scrape loop and is not shared between threads.
 *
 * Not a Spring bean: it needs a {@link BrowserDriverFactory}, which the embedding scraper provides.
 */
@Slf4j
@RequiredArgsConstructor
public class ScrapeAttemptRunner {

    private final ProxyPoolManager poolManager;
    private final BrowserDriverFactory driverFactory;
    private final DefenseDetector detector;
    private final RetryController retryController;
    private final PageStateInspector inspector;
    private final RecentErrorWindow errorWindow;
    private final DefenseProperties props;

    private ProxySelection current;
    private int listingsOnCurrent;

    /**
     * @param resultsExpected whether the page must show the results container to count as loaded
     * @param extraction      runs against the live page once it passed the defense checks
     * @throws ProxyPoolExhaustedException when the pool has nothing left and direct connection is off
     */
    public <T> ScrapeOutcome<T> run(String url, boolean resultsExpected, Function<BrowserDriver, T> extraction) {
        int maxAttempts = Math.max(1, props.getMaxRotations());
        ProxySelection selection = null;
        DefenseSignalKind lastSignal = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            retryController.coolDownIfNeeded(errorWindow.count());
            selection = takeProxy();
            log.info("Attempt {}/{} for {} via {}", attempt, maxAttempts, url, selection.describe());

            BrowserDriver driver;
            try {
                driver = driverFactory.open(selection);
            } catch (RuntimeException e) {
                log.error("Failed to initialize browser with {}: {}", selection.describe(), e.getMessage());
                failed(selection);
                lastSignal = DefenseSignalKind.NETWORK_ERROR;
                continue;
            }

            try (driver) {
                Optional<DefenseSignal> signal = navigate(driver, url, resultsExpected);
                if (signal.isPresent() && signal.get().kind() == DefenseSignalKind.TIMEOUT) {
                    errorWindow.record();
                    AtomicReference<NavigationResult> lastLoad = new AtomicReference<>(NavigationResult.TIMED_OUT);
                    Optional<DefenseAction> terminal = retryController.retryWithBackoff(url, selection, u -> {
                        NavigationResult result = attemptNavigation(driver, u);
                        lastLoad.set(result);
                        if (result != NavigationResult.COMPLETED) {
                            errorWindow.record();
                        }
                        return result;
                    });
                    if (terminal.isPresent()) {
                        release();
                        lastSignal = lastLoad.get() == NavigationResult.FAILED
                                ? DefenseSignalKind.NETWORK_ERROR
                                : DefenseSignalKind.TIMEOUT;
                        if (terminal.get() == DefenseAction.ABORT) {
                            return ScrapeOutcome.failed(ScrapeOutcome.Status.ABORTED, attempt, selection, lastSignal);
                        }
                        continue;
                    }
                    // the retried load completed; it still has to pass the page checks
                    signal = detector.classify(inspector.inspect(driver, resultsExpected));
                }

                if (signal.isPresent()) {
                    lastSignal = signal.get().kind();
                    errorWindow.record();
                    release();
                    if (retryController.handle(signal.get(), selection) == DefenseAction.ABORT) {
                        return ScrapeOutcome.failed(ScrapeOutcome.Status.ABORTED, attempt, selection, lastSignal);
                    }
                    continue;
                }

                T value;
                try {
                    value = extraction.apply(driver);
                } catch (RuntimeException e) {
                    log.error("Extraction failed on {} via {}: {}", url, selection.describe(), e.getMessage());
                    failed(selection);
                    throw e;
                }
                poolManager.reportSuccess(selection);
                countListing(selection);
                return ScrapeOutcome.succeeded(value, attempt, selection);
            }
        }

        log.error("Giving up on {} after {} proxy rotations", url, maxAttempts);
        return ScrapeOutcome.failed(ScrapeOutcome.Status.ROTATIONS_EXHAUSTED, maxAttempts, selection, lastSignal);
    }

    /**
     * The proxy kept from the previous listing while its budget lasts and nobody blacklisted it,
     * otherwise the next one from the pool.
     */
    private ProxySelection takeProxy() {
        if (current != null && !poolManager.isBlacklisted(current)) {
            return current;
        }
        current = poolManager.nextProxy();
        listingsOnCurrent = 0;
        return current;
    }

    private void countListing(ProxySelection selection) {
        listingsOnCurrent++;
        int budget = props.getListingsPerProxy();
        if (selection.isDirect() || (budget > 0 && listingsOnCurrent >= budget)) {
            log.debug("{} used for {} listings, rotating", selection.describe(), listingsOnCurrent);
            release();
        }
    }

    private void release() {
        current = null;
        listingsOnCurrent = 0;
    }

    /**
     * Loads the page and classifies it. Empty means the page is usable.
     */
    private Optional<DefenseSignal> navigate(BrowserDriver driver, String url, boolean resultsExpected) {
        NavigationResult result = attemptNavigation(driver, url);
        if (result != NavigationResult.COMPLETED) {
            return detector.classify(inspector.failedNavigation(result == NavigationResult.TIMED_OUT));
        }
        return detector.classify(inspector.inspect(driver, resultsExpected));
    }

    private static NavigationResult attemptNavigation(BrowserDriver driver, String url) {
        try {
            return driver.navigate(url) ? NavigationResult.COMPLETED : NavigationResult.FAILED;
        } catch (NavigationTimeoutException e) {
            log.warn("Navigation to {} timed out", e.getUrl());
            return NavigationResult.TIMED_OUT;
        }
    }

    private void failed(ProxySelection selection) {
        release();
        errorWindow.record();
        poolManager.reportFailure(selection);
    }
}
