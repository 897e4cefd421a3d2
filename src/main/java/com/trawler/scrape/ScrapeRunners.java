package com.trawler.scrape;

import com.trawler.bean.DefenseProperties;
import com.trawler.defense.DefenseDetector;
import com.trawler.defense.RecentErrorWindow;
import com.trawler.defense.RetryController;
import com.trawler.proxy.ProxyPoolManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Hands out scrape loops wired to the shared pool and defense components. The embedding scraper
 * supplies the browser.
 */
@Component
@RequiredArgsConstructor
public class ScrapeRunners {

    private final ProxyPoolManager poolManager;
    private final DefenseDetector detector;
    private final RetryController retryController;
    private final PageStateInspector inspector;
    private final RecentErrorWindow errorWindow;
    private final DefenseProperties props;

    public ScrapeAttemptRunner runner(BrowserDriverFactory driverFactory) {
        return new ScrapeAttemptRunner(poolManager, driverFactory, detector, retryController, inspector,
                errorWindow, props);
    }

    public ParallelQueryScraper parallel(BrowserDriverFactory driverFactory, int workers) {
        return new ParallelQueryScraper(() -> runner(driverFactory), workers);
    }
}
