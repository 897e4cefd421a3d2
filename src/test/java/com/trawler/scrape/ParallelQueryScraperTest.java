package com.trawler.scrape;

import com.trawler.bean.DefenseProperties;
import com.trawler.bean.ProxyPoolProperties;
import com.trawler.defense.DefenseDetector;
import com.trawler.defense.RecentErrorWindow;
import com.trawler.defense.RetryController;
import com.trawler.exception.ProxyPoolExhaustedException;
import com.trawler.proxy.PoolStateStore;
import com.trawler.proxy.ProxyPoolManager;
import com.trawler.proxy.ProxyRecord;
import com.trawler.scrape.FakeBrowserDriver.Page;
import com.trawler.support.MutableClock;
import com.trawler.support.Proxies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

final class ParallelQueryScraperTest {

    private static final String PAGE = "https://www.google.com/maps/search/results";
    private static final Function<String, String> SEARCH_URL = q -> "https://www.google.com/maps/search/" + q;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final DefenseProperties defenseProps = new DefenseProperties();
    private final ProxyPoolProperties poolProps = new ProxyPoolProperties();
    private final Map<String, AtomicInteger> servedBy = new ConcurrentHashMap<>();
    private List<ProxyRecord> harvest;
    private ProxyPoolManager poolManager;
    private ScrapeRunners runners;

    @BeforeEach
    void setUp() {
        harvest = List.of(
                Proxies.record("10.0.0.1:8080"),
                Proxies.record("10.0.0.2:8080"),
                Proxies.record("10.0.0.3:8080"),
                Proxies.record("10.0.0.4:8080"));
        PoolStateStore store = mock(PoolStateStore.class);
        when(store.loadLatest(any())).thenReturn(Optional.empty());
        poolManager = new ProxyPoolManager(store, () -> harvest, poolProps, clock);
        runners = new ScrapeRunners(
                poolManager,
                new DefenseDetector(defenseProps),
                new RetryController(poolManager, defenseProps, d -> { }),
                new PageStateInspector(defenseProps),
                new RecentErrorWindow(Duration.ofMinutes(5), clock),
                defenseProps);
    }

    @Test
    void queriesShareOnePoolAcrossWorkers() {
        List<String> queries = new ArrayList<>();
        for (int i = 1; i <= 8; i++) {
            queries.add("coffee+" + i);
        }
        ParallelQueryScraper scraper = runners.parallel(selection -> {
            servedBy.computeIfAbsent(selection.describe(), k -> new AtomicInteger()).incrementAndGet();
            return new FakeBrowserDriver(Page.results(PAGE));
        }, 4);

        Map<String, ScrapeOutcome<String>> results = scraper.scrapeAll(queries, SEARCH_URL, true,
                driver -> ((FakeBrowserDriver) driver).navigations().get(0));

        assertEquals(queries, new ArrayList<>(results.keySet()));
        results.forEach((query, outcome) -> {
            assertTrue(outcome.isSuccess());
            assertEquals(SEARCH_URL.apply(query), outcome.value());
        });
        assertEquals(4, servedBy.size());
        servedBy.values().forEach(count -> assertEquals(2, count.get()));
        assertEquals(0, poolManager.consecutiveFailures());
    }

    @Test
    void blockedProxyIsBlacklistedForEveryWorker() {
        ParallelQueryScraper scraper = runners.parallel(selection -> {
            servedBy.computeIfAbsent(selection.describe(), k -> new AtomicInteger()).incrementAndGet();
            boolean blocked = "10.0.0.1:8080".equals(selection.describe());
            return new FakeBrowserDriver(blocked ? Page.blocked(PAGE) : Page.results(PAGE));
        }, 3);

        Map<String, ScrapeOutcome<String>> results = scraper.scrapeAll(
                List.of("pizza", "tacos", "ramen", "bagels", "pho", "sushi"), SEARCH_URL, true, BrowserDriver::pageText);

        assertTrue(results.values().stream().allMatch(ScrapeOutcome::isSuccess));
        assertTrue(servedBy.containsKey("10.0.0.1:8080"));
        assertEquals(List.of("10.0.0.1:8080"),
                poolManager.blacklistedProxies().stream().map(ProxyRecord::address).toList());
        assertTrue(results.values().stream().noneMatch(o -> o.selection().describe().equals("10.0.0.1:8080")));
    }

    @Test
    void poolExhaustionStopsTheRun() {
        poolProps.setAllowDirectConnection(false);
        harvest = List.of();
        ParallelQueryScraper scraper = runners.parallel(selection -> new FakeBrowserDriver(Page.results(PAGE)), 2);

        assertThrows(ProxyPoolExhaustedException.class,
                () -> scraper.scrapeAll(List.of("pizza", "tacos"), SEARCH_URL, true, BrowserDriver::pageText));
    }

    @Test
    void noQueriesNoWork() {
        ParallelQueryScraper scraper = runners.parallel(selection -> fail("no browser expected"), 2);

        assertTrue(scraper.scrapeAll(List.of(), SEARCH_URL, true, BrowserDriver::pageText).isEmpty());
    }

    @Test
    void requiresAWorker() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelQueryScraper(() -> null, 0));
    }
}
