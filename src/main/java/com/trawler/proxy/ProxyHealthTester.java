package com.trawler.proxy;

import com.trawler.bean.HarvesterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probes candidates through themselves against echo endpoints. One trial decides: a candidate
 * that errors, times out or answers anything but 200 is dropped.
 */
@Service
@Slf4j
public class ProxyHealthTester {

    private static final int PROGRESS_EVERY = 10;

    private final ProxiedHttpClient httpClient;
    private final EchoResponseParser echoParser;
    private final List<String> echoEndpoints;
    private final List<String> userAgents;
    private final Duration timeout;
    private final Clock clock;
    private final Random random;

    @Autowired
    public ProxyHealthTester(ProxiedHttpClient httpClient, EchoResponseParser echoParser,
                             HarvesterProperties props, Clock clock) {
        this(httpClient, echoParser, props, clock, new Random());
    }

    ProxyHealthTester(ProxiedHttpClient httpClient, EchoResponseParser echoParser,
                      HarvesterProperties props, Clock clock, Random random) {
        if (props.getEchoEndpoints().isEmpty()) {
            throw new IllegalArgumentException("At least one echo endpoint is required");
        }
        if (props.getUserAgents().isEmpty()) {
            throw new IllegalArgumentException("At least one user agent is required");
        }
        this.httpClient = httpClient;
        this.echoParser = echoParser;
        this.echoEndpoints = List.copyOf(props.getEchoEndpoints());
        this.userAgents = List.copyOf(props.getUserAgents());
        this.timeout = props.getTimeout();
        this.clock = clock;
        this.random = random;
    }

    public Optional<ProxyRecord> test(ProxyCandidate candidate) {
        String endpoint = echoEndpoints.get(nextIndex(echoEndpoints.size()));
        Map<String, String> headers = Map.of(HttpHeaders.USER_AGENT, userAgents.get(nextIndex(userAgents.size())));

        long start = System.nanoTime();
        try {
            ProxiedHttpClient.ProbeResponse response = httpClient.get(candidate, endpoint, headers, timeout);
            long latencyMillis = (System.nanoTime() - start) / 1_000_000;

            if (response == null || response.status() != 200) {
                log.debug("Proxy {} answered {} from {}", candidate.address(),
                        response == null ? "nothing" : response.status(), endpoint);
                return Optional.empty();
            }

            String echoed = echoParser.extractOrigin(response.body());
            ProxyRecord record = ProxyRecord.tested(candidate, latencyMillis, echoed, clock.instant());
            log.debug("Working proxy {} ({}) - {}ms via {}", record.address(), record.country(), latencyMillis, endpoint);
            return Optional.of(record);
        } catch (Exception e) {
            // many free proxies fail; keep this at debug to avoid spam
            log.debug("Proxy {} failed probe against {}: {}", candidate.address(), endpoint, e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    /**
     * Probes the batch with at most {@code concurrency} trials in flight. Result order is
     * unspecified.
     */
    public List<ProxyRecord> testBatch(List<ProxyCandidate> candidates, int concurrency) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        int total = candidates.size();
        int workers = Math.max(1, concurrency);
        AtomicInteger tested = new AtomicInteger();
        log.info("Testing {} proxies for viability with {} workers", total, workers);

        List<ProxyRecord> working = Flux.fromIterable(candidates)
                .flatMap(candidate -> Mono.fromCallable(() -> test(candidate))
                        .subscribeOn(Schedulers.boundedElastic())
                        .doOnNext(result -> reportProgress(tested.incrementAndGet(), total)), workers)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collectList()
                .block();

        List<ProxyRecord> result = working == null ? List.of() : working;
        if (result.isEmpty()) {
            log.warn("No operational proxies found among {} candidates", total);
        } else {
            log.info("Validation complete: {}/{} proxies operational", result.size(), total);
        }
        return result;
    }

    private void reportProgress(int done, int total) {
        if (done % PROGRESS_EVERY == 0 || done == total) {
            log.info("Tested {}/{} proxies", done, total);
        }
    }

    private int nextIndex(int bound) {
        return random.nextInt(bound);
    }
}
