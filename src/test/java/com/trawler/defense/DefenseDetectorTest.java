package com.trawler.defense;

import com.trawler.bean.DefenseProperties;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class DefenseDetectorTest {

    private static final String MAPS_URL = "https://www.google.com/maps/search/coffee+near+austin";

    private final DefenseDetector detector = new DefenseDetector(new DefenseProperties());

    @Test
    void captchaTextWins() {
        ObservedPageState state = page()
                .pageText("Our systems have detected unusual traffic from your computer network")
                .httpStatus(429)
                .build();

        assertEquals(Optional.of(DefenseSignalKind.CAPTCHA), kind(state));
    }

    @Test
    void challengeWidgetIsCaptcha() {
        assertEquals(Optional.of(DefenseSignalKind.CAPTCHA), kind(page().challengeElementPresent(true).build()));
    }

    @Test
    void blockingStatusesAreRateLimits() {
        for (int status : new int[]{429, 403, 503}) {
            assertEquals(Optional.of(DefenseSignalKind.RATE_LIMIT), kind(page().httpStatus(status).build()), "status " + status);
        }
        assertEquals(Optional.empty(), kind(page().httpStatus(200).build()));
    }

    @Test
    void rateLimitTextIsCaseInsensitive() {
        assertEquals(Optional.of(DefenseSignalKind.RATE_LIMIT), kind(page().pageText("Too Many Requests").build()));
    }

    @Test
    void redirectAwayFromTargetIsOffTarget() {
        ObservedPageState state = page().currentUrl("https://consent.google.com/ml?continue=maps").build();

        assertEquals(Optional.of(DefenseSignalKind.OFF_TARGET), kind(state));
    }

    @Test
    void blankStartPageIsNotOffTarget() {
        assertEquals(Optional.of(DefenseSignalKind.TIMEOUT),
                kind(ObservedPageState.builder().currentUrl("about:blank").timedOut(true).build()));
    }

    @Test
    void timeoutAndNetworkErrors() {
        assertEquals(Optional.of(DefenseSignalKind.TIMEOUT), kind(ObservedPageState.builder().timedOut(true).build()));
        assertEquals(Optional.of(DefenseSignalKind.NETWORK_ERROR),
                kind(ObservedPageState.builder().navigationFailed(true).build()));
    }

    @Test
    void missingResultsContainerIsTreatedAsBlock() {
        ObservedPageState state = page().resultsExpected(true).resultsContainerPresent(false).build();

        assertEquals(Optional.of(DefenseSignalKind.RATE_LIMIT), kind(state));
    }

    @Test
    void explicitNoResultsIsNotABlock() {
        ObservedPageState state = page()
                .pageText("No results found for 'zzzz'")
                .resultsExpected(true)
                .resultsContainerPresent(false)
                .build();

        assertEquals(Optional.empty(), kind(state));
    }

    @Test
    void healthyResultsPageIsClean() {
        ObservedPageState state = page()
                .pageText("Coffee shops near Austin")
                .httpStatus(200)
                .resultsExpected(true)
                .resultsContainerPresent(true)
                .build();

        assertTrue(detector.classify(state).isEmpty());
    }

    @Test
    void signalCarriesRetryCount() {
        DefenseSignal signal = detector.classify(ObservedPageState.builder().timedOut(true).build(), 2).orElseThrow();

        assertEquals(2, signal.retryCount());
        assertEquals(3, signal.nextRetry().retryCount());
    }

    private Optional<DefenseSignalKind> kind(ObservedPageState state) {
        return detector.classify(state).map(DefenseSignal::kind);
    }

    private static ObservedPageState.ObservedPageStateBuilder page() {
        return ObservedPageState.builder().currentUrl(MAPS_URL).pageText("");
    }
}
