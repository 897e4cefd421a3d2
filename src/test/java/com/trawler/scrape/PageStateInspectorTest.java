package com.trawler.scrape;

import com.trawler.bean.DefenseProperties;
import com.trawler.defense.ObservedPageState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PageStateInspectorTest {

    private static final String URL = "https://www.google.com/maps/search/coffee";

    private final PageStateInspector inspector = new PageStateInspector(new DefenseProperties());

    @Test
    void readsLoadedPage() {
        FakeBrowserDriver driver = new FakeBrowserDriver(FakeBrowserDriver.Page.results(URL));
        driver.navigate(URL);

        ObservedPageState state = inspector.inspect(driver, true);

        assertEquals(URL, state.currentUrl());
        assertEquals(200, state.httpStatus());
        assertTrue(state.resultsExpected());
        assertTrue(state.resultsContainerPresent());
        assertFalse(state.challengeElementPresent());
        assertFalse(state.timedOut());
    }

    @Test
    void detectsChallengeWidget() {
        FakeBrowserDriver driver = new FakeBrowserDriver(new FakeBrowserDriver.Page(URL, "", null, false, true));
        driver.navigate(URL);

        ObservedPageState state = inspector.inspect(driver, false);

        assertTrue(state.challengeElementPresent());
        assertNull(state.httpStatus());
        assertFalse(state.resultsContainerPresent());
    }

    @Test
    void scriptFailureLeavesStatusUnknown() {
        FakeBrowserDriver driver = new FakeBrowserDriver(FakeBrowserDriver.Page.results(URL)).failingScripts();
        driver.navigate(URL);

        assertNull(inspector.inspect(driver, true).httpStatus());
    }

    @Test
    void failedNavigationStates() {
        assertTrue(inspector.failedNavigation(true).timedOut());
        assertFalse(inspector.failedNavigation(true).navigationFailed());
        assertTrue(inspector.failedNavigation(false).navigationFailed());
    }
}
