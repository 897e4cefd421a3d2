package com.trawler.service;

import com.trawler.proxy.PoolStatus;
import com.trawler.proxy.ProxyPoolManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.mockito.Mockito.*;

final class PoolRefreshSchedulerTest {

    private ProxyPoolManager poolManager;
    private PoolRefreshScheduler scheduler;

    @BeforeEach
    void setUp() {
        poolManager = mock(ProxyPoolManager.class);
        scheduler = new PoolRefreshScheduler(poolManager);
    }

    @Test
    void healthyPoolIsLeftAlone() {
        when(poolManager.status()).thenReturn(status(5, false));

        scheduler.refreshIfNeeded();

        verify(poolManager, never()).refresh();
    }

    @Test
    void stalePoolIsRefreshed() {
        when(poolManager.status()).thenReturn(status(5, true));

        scheduler.refreshIfNeeded();

        verify(poolManager).refresh();
    }

    @Test
    void emptyPoolIsRefreshed() {
        when(poolManager.status()).thenReturn(status(0, false));

        scheduler.refreshIfNeeded();

        verify(poolManager).refresh();
    }

    @Test
    void refreshFailureIsContained() {
        when(poolManager.status()).thenReturn(status(0, true));
        when(poolManager.refresh()).thenThrow(new IllegalStateException("boom"));

        scheduler.refreshIfNeeded();

        verify(poolManager).refresh();
    }

    private static PoolStatus status(int working, boolean stale) {
        return new PoolStatus(working, 2, 0, 0, 3, true, Instant.parse("2024-01-01T00:00:00Z"), stale);
    }
}
