package com.trawler.proxy;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable home of the pool state. Writes replace whole snapshots; reads never throw.
 */
public interface PoolStateStore {

    /**
     * @throws com.trawler.exception.PoolStatePersistenceException when the snapshot cannot be written
     */
    void save(PoolSnapshot snapshot);

    /**
     * Newest snapshot, provided it is younger than {@code maxAge} and readable.
     */
    Optional<PoolSnapshot> loadLatest(Duration maxAge);
}
