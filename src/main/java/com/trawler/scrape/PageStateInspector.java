package com.trawler.scrape;

import com.trawler.bean.DefenseProperties;
import com.trawler.defense.ObservedPageState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Collects what the defense detector needs from a loaded page.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageStateInspector {

    // Navigation Timing Level 2; browsers without responseStatus return undefined
    static final String STATUS_SCRIPT =
            "var e = window.performance && performance.getEntriesByType('navigation')[0];"
                    + " return e && e.responseStatus ? e.responseStatus : null;";

    private final DefenseProperties props;

    public ObservedPageState inspect(BrowserDriver driver, boolean resultsExpected) {
        boolean resultsPresent = resultsExpected && !driver.findElements(props.getResultsSelector()).isEmpty();

        return ObservedPageState.builder()
                .currentUrl(driver.currentUrl())
                .pageText(driver.pageText())
                .httpStatus(readStatus(driver))
                .challengeElementPresent(hasVisibleChallenge(driver))
                .resultsExpected(resultsExpected)
                .resultsContainerPresent(resultsPresent)
                .build();
    }

    /**
     * State for a navigation that never produced a page. The URL is left out since whatever the
     * browser shows is its own error page.
     */
    public ObservedPageState failedNavigation(boolean timedOut) {
        return ObservedPageState.builder()
                .timedOut(timedOut)
                .navigationFailed(!timedOut)
                .build();
    }

    private boolean hasVisibleChallenge(BrowserDriver driver) {
        String selector = props.getChallengeSelector();
        if (selector == null || selector.isBlank()) {
            return false;
        }
        return driver.findElements(selector).stream().anyMatch(BrowserElement::isDisplayed);
    }

    private Integer readStatus(BrowserDriver driver) {
        try {
            Object value = driver.executeScript(STATUS_SCRIPT);
            if (value instanceof Number number) {
                int status = number.intValue();
                return status > 0 ? status : null;
            }
            return null;
        } catch (RuntimeException e) {
            log.debug("Response status unavailable: {}", e.getMessage());
            return null;
        }
    }
}
