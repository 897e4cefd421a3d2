package com.trawler.proxy.source;

import com.trawler.proxy.ProxyCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CandidateCollectorTest {

    @Test
    void deduplicatesOnAddressFirstSourceWins() {
        ProxySource first = source("first", new ProxyCandidate("10.0.0.1", 8080, true, "first", "US"));
        ProxySource second = source("second",
                new ProxyCandidate("10.0.0.1", 8080, false, "second", "US"),
                new ProxyCandidate("10.0.0.2", 8080, false, "second", "US"));

        List<ProxyCandidate> collected = new CandidateCollector(List.of(first, second)).collect();

        assertEquals(2, collected.size());
        assertEquals("first", collected.get(0).source());
        assertTrue(collected.get(0).https());
    }

    @Test
    void brokenSourceDoesNotStopTheHarvest() {
        ProxySource broken = new ProxySource() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public List<ProxyCandidate> fetchCandidates() {
                throw new IllegalStateException("boom");
            }
        };
        ProxySource healthy = source("healthy", new ProxyCandidate("10.0.0.9", 3128, false, "healthy", ""));

        CandidateCollector collector = new CandidateCollector(List.of(broken, healthy));

        assertEquals(1, collector.collect().size());
        assertEquals(2, collector.sourceCount());
    }

    private static ProxySource source(String name, ProxyCandidate... candidates) {
        return new ProxySource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<ProxyCandidate> fetchCandidates() {
                return List.of(candidates);
            }
        };
    }
}
