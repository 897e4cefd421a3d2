package com.trawler.service;

import com.trawler.bean.HarvesterProperties;
import com.trawler.bean.ProxyPoolProperties;
import com.trawler.proxy.HarvestExporter;
import com.trawler.proxy.ProxyCandidate;
import com.trawler.proxy.ProxyHarvester;
import com.trawler.proxy.ProxyHealthTester;
import com.trawler.proxy.ProxyRecord;
import com.trawler.proxy.ProxyScorer;
import com.trawler.proxy.source.CandidateCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One full harvest cycle: collect candidates from every source, probe them concurrently and keep
 * the best scored ones for the pool. The selection is also exported as a standalone harvest file
 * when {@code harvester.export-results} is on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProxyHarvestService implements ProxyHarvester {

    private static final int LOGGED_TOP = 5;

    private final CandidateCollector collector;
    private final ProxyHealthTester tester;
    private final ProxyScorer scorer;
    private final HarvesterProperties harvesterProps;
    private final ProxyPoolProperties poolProps;
    private final HarvestExporter exporter;
    private final Clock clock;

    private final AtomicReference<HarvestReport> lastReport = new AtomicReference<>();

    @Override
    public List<ProxyRecord> harvest() {
        Instant started = clock.instant();
        log.info("=== Proxy harvest started: {} sources, country filter {} ===",
                collector.sourceCount(), harvesterProps.getCountryFilter());

        List<ProxyCandidate> candidates = collector.collect();
        if (candidates.isEmpty()) {
            log.warn("No proxy candidates found from any source");
            record(0, 0, 0, started);
            return List.of();
        }

        List<ProxyRecord> working = tester.testBatch(candidates, harvesterProps.getWorkers());
        if (working.isEmpty()) {
            log.warn("None of the {} candidates passed the health check", candidates.size());
            record(candidates.size(), 0, 0, started);
            return List.of();
        }

        List<ProxyRecord> best = scorer.selectBest(working, poolProps.getTargetCount());
        HarvestReport report = record(candidates.size(), working.size(), best.size(), started);

        log.info("=== Proxy harvest finished in {}s: {}/{} working, {} selected ===",
                report.elapsed().toSeconds(), working.size(), candidates.size(), best.size());
        if (harvesterProps.isExportResults()) {
            exporter.export(best, harvesterProps.filtersCountry() ? harvesterProps.getCountryFilter() : null);
        }
        best.stream().limit(LOGGED_TOP).forEach(r -> log.info("  {} {}ms {} {} score={}",
                r.address(), r.latencyMillis(), r.anonymity(), r.https() ? "https" : "http", r.score()));
        return best;
    }

    public Optional<HarvestReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    private HarvestReport record(int candidates, int working, int selected, Instant started) {
        Instant finished = clock.instant();
        HarvestReport report = new HarvestReport(collector.sourceCount(), candidates, working, selected,
                Duration.between(started, finished), finished);
        lastReport.set(report);
        return report;
    }
}
