package com.trawler.scrape;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Scrapes several search queries at once. Each query gets its own {@link ScrapeAttemptRunner};
 * every runner draws from the same proxy pool, so rotation and blacklisting are shared.
 */
@Slf4j
public class ParallelQueryScraper {

    private final Supplier<ScrapeAttemptRunner> runners;
    private final int workers;

    public ParallelQueryScraper(Supplier<ScrapeAttemptRunner> runners, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("At least one worker is required: " + workers);
        }
        this.runners = runners;
        this.workers = workers;
    }

    /**
     * Blocks until every query finished.
     *
     * @param urlForQuery maps a query to the page to scrape for it
     * @return outcome per query, in the order the queries were given
     * @throws com.trawler.exception.ProxyPoolExhaustedException when the pool runs dry and direct
     *         connection is off; queries still in flight are cancelled
     */
    public <T> Map<String, ScrapeOutcome<T>> scrapeAll(List<String> queries,
                                                       Function<String, String> urlForQuery,
                                                       boolean resultsExpected,
                                                       Function<BrowserDriver, T> extraction) {
        if (queries == null || queries.isEmpty()) {
            return Map.of();
        }

        int parallelism = Math.min(workers, queries.size());
        log.info("Scraping {} queries on {} workers", queries.size(), parallelism);

        Map<String, ScrapeOutcome<T>> results = Flux.fromIterable(queries)
                .flatMapSequential(query -> Mono.fromCallable(() -> {
                            ScrapeOutcome<T> outcome = runners.get()
                                    .run(urlForQuery.apply(query), resultsExpected, extraction);
                            log.info("Query '{}' finished: {} after {} attempts", query, outcome.status(),
                                    outcome.attempts());
                            return Map.entry(query, outcome);
                        })
                        .subscribeOn(Schedulers.boundedElastic()), parallelism)
                .collect(() -> new LinkedHashMap<String, ScrapeOutcome<T>>(),
                        (map, entry) -> map.put(entry.getKey(), entry.getValue()))
                .block();

        long succeeded = results.values().stream().filter(ScrapeOutcome::isSuccess).count();
        log.info("All {} queries processed, {} succeeded", results.size(), succeeded);
        return results;
    }
}
