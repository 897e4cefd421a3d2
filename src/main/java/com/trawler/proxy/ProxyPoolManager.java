package com.trawler.proxy;

import com.trawler.bean.ProxyPoolProperties;
import com.trawler.exception.PoolStatePersistenceException;
import com.trawler.exception.ProxyPoolExhaustedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the live rotation: the working pool in rotation order, the blacklist, the cursor and the
 * consecutive-failure counter. Every operation on that state runs under the instance monitor, so
 * concurrent scrape loops never receive the same rotation slot twice or skip one. Harvesting runs
 * outside the monitor behind its own lock; only the swap to the new generation is synchronized.
 *
 * Invariants: an address is never both working and blacklisted; the cursor is below the working
 * size whenever the pool is non-empty and 0 otherwise.
 */
@Slf4j
public class ProxyPoolManager {

    private final PoolStateStore store;
    private final ProxyHarvester harvester;
    private final ProxyPoolProperties props;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private final List<ProxyRecord> working = new ArrayList<>();
    private final Map<String, ProxyRecord> blacklisted = new LinkedHashMap<>();
    private int cursor;
    private int consecutiveFailures;
    private Instant generatedAt;
    private long generation;

    public ProxyPoolManager(PoolStateStore store, ProxyHarvester harvester, ProxyPoolProperties props, Clock clock) {
        this.store = store;
        this.harvester = harvester;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Restores the newest snapshot whose harvest is younger than the freshness window. Proxies
     * blacklisted in this process stay blacklisted even when the snapshot on disk predates them.
     *
     * @return false when nothing fresh and readable with at least one usable proxy exists
     */
    public synchronized boolean load() {
        Optional<PoolSnapshot> loaded = store.loadLatest(props.getFreshness());
        if (loaded.isEmpty() || loaded.get().workingProxies().isEmpty()) {
            return false;
        }

        PoolSnapshot snapshot = loaded.get();
        Instant harvestedAt = snapshot.harvestedAt() == null ? clock.instant() : snapshot.harvestedAt();
        if (olderThanFreshness(harvestedAt)) {
            log.info("Cached proxy pool was harvested at {}, past the {} freshness window", harvestedAt,
                    props.getFreshness());
            return false;
        }

        Map<String, ProxyRecord> mergedBlacklist = new LinkedHashMap<>(blacklisted);
        snapshot.blacklistedProxies().forEach(r -> mergedBlacklist.putIfAbsent(r.address(), r));

        List<ProxyRecord> restored = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (ProxyRecord record : snapshot.workingProxies()) {
            if (!mergedBlacklist.containsKey(record.address()) && seen.add(record.address())) {
                restored.add(record);
            }
        }
        if (restored.isEmpty()) {
            log.info("Every proxy in the cached pool is blacklisted");
            return false;
        }

        blacklisted.clear();
        blacklisted.putAll(mergedBlacklist);
        working.clear();
        working.addAll(restored);
        cursor = 0;
        generatedAt = harvestedAt;
        generation++;

        log.info("Restored proxy pool: {} working, {} blacklisted", working.size(), blacklisted.size());
        return true;
    }

    /**
     * Next proxy in round-robin order, or the direct-connection sentinel once the failure threshold
     * is reached. An empty pool is re-harvested first.
     *
     * @throws ProxyPoolExhaustedException when no proxy is usable and direct connection is disabled
     */
    public ProxySelection nextProxy() {
        Optional<ProxySelection> selection;
        long seenGeneration;
        synchronized (this) {
            selection = select();
            if (selection.isPresent()) {
                return selection.get();
            }
            seenGeneration = generation;
        }

        refresh(seenGeneration);

        synchronized (this) {
            selection = select();
            if (selection.isPresent()) {
                return selection.get();
            }
            if (props.isAllowDirectConnection()) {
                log.warn("No working proxies available. Using direct connection.");
                return ProxySelection.direct();
            }
            throw new ProxyPoolExhaustedException(blacklisted.size(), consecutiveFailures);
        }
    }

    public synchronized void reportSuccess(ProxySelection selection) {
        if (consecutiveFailures > 0) {
            log.info("{} succeeded, clearing {} consecutive failures", describe(selection), consecutiveFailures);
        }
        consecutiveFailures = 0;
    }

    /**
     * Counts the failure and blacklists the proxy, persisting the new state before returning.
     * The direct sentinel and already blacklisted proxies only bump the counter.
     */
    public synchronized void reportFailure(ProxySelection selection) {
        consecutiveFailures++;

        if (selection == null || selection.isDirect()) {
            log.warn("Direct connection failed ({} consecutive failures)", consecutiveFailures);
            return;
        }

        ProxyRecord record = selection.proxy().orElseThrow();
        if (blacklisted.containsKey(record.address())) {
            log.debug("Proxy {} already blacklisted", record.address());
            return;
        }

        ProxyRecord pooled = record;
        int index = indexOf(record.address());
        if (index >= 0) {
            pooled = working.remove(index);
            // keep the cursor on the proxy that was next in line
            if (index < cursor) {
                cursor--;
            }
            if (cursor >= working.size()) {
                cursor = 0;
            }
        }
        blacklisted.put(pooled.address(), pooled);

        log.warn("Proxy {} blacklisted ({} working left, {} consecutive failures)",
                record.address(), working.size(), consecutiveFailures);
        persist();
    }

    /**
     * Replaces the working pool with a fresh harvest. Addresses that come back healthy leave the
     * blacklist since they belong to the new generation. Callers that queue up behind a running
     * harvest reuse its result instead of starting another one.
     *
     * @return false when the harvest produced nothing; the current state is then kept
     */
    public boolean refresh() {
        return refresh(currentGeneration());
    }

    private boolean refresh(long seenGeneration) {
        refreshLock.lock();
        try {
            if (currentGeneration() != seenGeneration) {
                log.debug("Proxy pool was refreshed while waiting, skipping harvest");
                return !workingProxies().isEmpty();
            }

            log.info("Running proxy harvester to refresh proxy pool...");
            List<ProxyRecord> harvested;
            try {
                harvested = harvester.harvest();
            } catch (RuntimeException e) {
                log.error("Proxy harvest failed: {}", e.getMessage(), e);
                return false;
            }

            if (harvested == null || harvested.isEmpty()) {
                log.warn("Proxy harvest produced no working proxies");
                return false;
            }
            install(harvested);
            return true;
        } finally {
            refreshLock.unlock();
        }
    }

    public synchronized PoolStatus status() {
        return new PoolStatus(
                working.size(),
                blacklisted.size(),
                cursor,
                consecutiveFailures,
                props.getMaxFailures(),
                props.isAllowDirectConnection(),
                generatedAt,
                isStale());
    }

    /**
     * True when the pool was never populated or is older than the freshness window.
     */
    public synchronized boolean isStale() {
        if (generatedAt == null) {
            return true;
        }
        return olderThanFreshness(generatedAt);
    }

    public synchronized List<ProxyRecord> workingProxies() {
        return List.copyOf(working);
    }

    public synchronized List<ProxyRecord> blacklistedProxies() {
        return List.copyOf(blacklisted.values());
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized int cursor() {
        return cursor;
    }

    public synchronized boolean isBlacklisted(ProxySelection selection) {
        return selection != null && selection.proxy()
                .map(r -> blacklisted.containsKey(r.address()))
                .orElse(false);
    }

    /**
     * Writes the current state; used on shutdown. Never throws.
     */
    public synchronized void persistNow() {
        if (working.isEmpty() && blacklisted.isEmpty()) {
            return;
        }
        persist();
    }

    private synchronized Optional<ProxySelection> select() {
        if (consecutiveFailures >= props.getMaxFailures() && props.isAllowDirectConnection()) {
            log.warn("Using direct connection after {} consecutive proxy failures", consecutiveFailures);
            return Optional.of(ProxySelection.direct());
        }
        if (working.isEmpty()) {
            return Optional.empty();
        }

        if (cursor >= working.size()) {
            cursor = 0;
        }
        ProxyRecord record = working.get(cursor);
        cursor = (cursor + 1) % working.size();
        log.debug("Rotating to proxy {} (next slot {}/{})", record.address(), cursor, working.size());
        return Optional.of(ProxySelection.of(record));
    }

    private synchronized void install(List<ProxyRecord> harvested) {
        working.clear();
        Set<String> seen = new LinkedHashSet<>();
        for (ProxyRecord record : harvested) {
            if (seen.add(record.address())) {
                working.add(record);
                blacklisted.remove(record.address());
            }
        }
        cursor = 0;
        generatedAt = clock.instant();
        generation++;

        log.info("Proxy pool refreshed: {} working, {} blacklisted", working.size(), blacklisted.size());
        persist();
    }

    private synchronized long currentGeneration() {
        return generation;
    }

    private boolean olderThanFreshness(Instant harvestedAt) {
        return Duration.between(harvestedAt, clock.instant()).compareTo(props.getFreshness()) > 0;
    }

    private void persist() {
        PoolSnapshot snapshot = new PoolSnapshot(working, new ArrayList<>(blacklisted.values()),
                clock.instant(), generatedAt);
        try {
            store.save(snapshot);
        } catch (PoolStatePersistenceException e) {
            // in-memory state stays authoritative; the next restart re-harvests
            log.error("Error saving proxy state: {}", e.getMessage(), e);
        }
    }

    private int indexOf(String address) {
        for (int i = 0; i < working.size(); i++) {
            if (working.get(i).address().equals(address)) {
                return i;
            }
        }
        return -1;
    }

    private static String describe(ProxySelection selection) {
        return selection == null ? "unknown selection" : selection.describe();
    }
}
