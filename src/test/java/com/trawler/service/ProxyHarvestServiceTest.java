package com.trawler.service;

import com.trawler.bean.HarvesterProperties;
import com.trawler.bean.ProxyPoolProperties;
import com.trawler.proxy.HarvestExporter;
import com.trawler.proxy.ProxyCandidate;
import com.trawler.proxy.ProxyHealthTester;
import com.trawler.proxy.ProxyRecord;
import com.trawler.proxy.ProxyScorer;
import com.trawler.proxy.source.CandidateCollector;
import com.trawler.support.Proxies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

final class ProxyHarvestServiceTest {

    private CandidateCollector collector;
    private ProxyHealthTester tester;
    private HarvestExporter exporter;
    private final HarvesterProperties harvesterProps = new HarvesterProperties();
    private final ProxyPoolProperties poolProps = new ProxyPoolProperties();
    private ProxyHarvestService service;

    @BeforeEach
    void setUp() {
        collector = mock(CandidateCollector.class);
        tester = mock(ProxyHealthTester.class);
        exporter = mock(HarvestExporter.class);
        when(collector.sourceCount()).thenReturn(3);
        service = new ProxyHarvestService(collector, tester, new ProxyScorer(), harvesterProps, poolProps,
                exporter, Clock.fixed(Proxies.CHECKED_AT, ZoneOffset.UTC));
    }

    @Test
    void keepsTheBestScoredProxies() {
        poolProps.setTargetCount(2);
        harvesterProps.setWorkers(7);
        List<ProxyCandidate> candidates = List.of(
                Proxies.candidate("10.0.0.1", 8080),
                Proxies.candidate("10.0.0.2", 8080),
                Proxies.candidate("10.0.0.3", 8080));
        when(collector.collect()).thenReturn(candidates);
        when(tester.testBatch(candidates, 7)).thenReturn(List.of(
                Proxies.record("10.0.0.1", 8080, 2_500),
                Proxies.record("10.0.0.2", 8080, 300),
                Proxies.record("10.0.0.3", 8080, 800)));

        List<ProxyRecord> best = service.harvest();

        assertEquals(List.of("10.0.0.2:8080", "10.0.0.3:8080"), best.stream().map(ProxyRecord::address).toList());
        assertTrue(best.get(0).score() > best.get(1).score());

        HarvestReport report = service.lastReport().orElseThrow();
        assertEquals(3, report.sources());
        assertEquals(3, report.candidates());
        assertEquals(3, report.working());
        assertEquals(2, report.selected());
        verify(exporter).export(best, "US");
    }

    @Test
    void exportCanBeSwitchedOff() {
        harvesterProps.setExportResults(false);
        harvesterProps.setCountryFilter("ALL");
        List<ProxyCandidate> candidates = List.of(Proxies.candidate("10.0.0.1", 8080));
        when(collector.collect()).thenReturn(candidates);
        when(tester.testBatch(anyList(), anyInt())).thenReturn(List.of(Proxies.record("10.0.0.1", 8080, 300)));

        assertEquals(1, service.harvest().size());
        verifyNoInteractions(exporter);
    }

    @Test
    void noCandidatesSkipsTesting() {
        when(collector.collect()).thenReturn(List.of());

        assertTrue(service.harvest().isEmpty());
        verify(tester, never()).testBatch(anyList(), anyInt());
        verifyNoInteractions(exporter);
        assertEquals(0, service.lastReport().orElseThrow().candidates());
    }

    @Test
    void nothingWorkingYieldsEmptyHarvest() {
        List<ProxyCandidate> candidates = new ArrayList<>(List.of(Proxies.candidate("10.0.0.1", 8080)));
        when(collector.collect()).thenReturn(candidates);
        when(tester.testBatch(anyList(), anyInt())).thenReturn(List.of());

        assertTrue(service.harvest().isEmpty());
        assertEquals(1, service.lastReport().orElseThrow().candidates());
        assertEquals(0, service.lastReport().orElseThrow().working());
    }
}
