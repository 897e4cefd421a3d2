package com.trawler.proxy;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.trawler.bean.HarvesterProperties;
import com.trawler.support.Proxies;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class ProxyHealthTesterTest {

    private final HarvesterProperties props = new HarvesterProperties();
    private final EchoResponseParser echoParser = new EchoResponseParser(JsonMapper.builder().build());
    private final Clock clock = Clock.fixed(Proxies.CHECKED_AT, ZoneOffset.UTC);

    @Test
    void successfulProbeBecomesRecord() {
        ProxiedHttpClient client = (via, url, headers, timeout) ->
                new ProxiedHttpClient.ProbeResponse(200, "{\"origin\": \"" + via.host() + "\"}");

        Optional<ProxyRecord> record = tester(client).test(Proxies.candidate("34.82.11.5", 3128));

        assertTrue(record.isPresent());
        assertEquals(AnonymityLevel.ANONYMOUS, record.get().anonymity());
        assertEquals(Proxies.CHECKED_AT, record.get().lastChecked());
        assertEquals("34.82.11.5", record.get().returnedIp());
    }

    @Test
    void sendsUserAgentAndConfiguredTimeout() {
        props.setTimeout(Duration.ofSeconds(3));
        List<Map<String, String>> seenHeaders = new ArrayList<>();
        List<Duration> seenTimeouts = new ArrayList<>();
        ProxiedHttpClient client = (via, url, headers, timeout) -> {
            seenHeaders.add(headers);
            seenTimeouts.add(timeout);
            assertTrue(props.getEchoEndpoints().contains(url));
            return new ProxiedHttpClient.ProbeResponse(200, "1.1.1.1");
        };

        tester(client).test(Proxies.candidate("34.82.11.5", 3128));

        assertTrue(props.getUserAgents().contains(seenHeaders.get(0).get("User-Agent")));
        assertEquals(Duration.ofSeconds(3), seenTimeouts.get(0));
    }

    @Test
    void non200AndErrorsAreDropped() {
        ProxiedHttpClient forbidden = (via, url, headers, timeout) -> new ProxiedHttpClient.ProbeResponse(403, "");
        ProxiedHttpClient refused = (via, url, headers, timeout) -> {
            throw new IllegalStateException(new ConnectException("Connection refused"));
        };

        assertTrue(tester(forbidden).test(Proxies.candidate("10.0.0.1", 80)).isEmpty());
        assertTrue(tester(refused).test(Proxies.candidate("10.0.0.1", 80)).isEmpty());
    }

    @Test
    void batchKeepsOnlyWorkingProxiesAndRespectsConcurrency() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        Set<String> probed = ConcurrentHashMap.newKeySet();
        ProxiedHttpClient client = (via, url, headers, timeout) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(5);
                probed.add(via.address());
                int lastOctet = Integer.parseInt(via.host().substring(via.host().lastIndexOf('.') + 1));
                return new ProxiedHttpClient.ProbeResponse(lastOctet % 2 == 0 ? 200 : 503, "8.8.8.8");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            } finally {
                inFlight.decrementAndGet();
            }
        };
        List<ProxyCandidate> candidates = new ArrayList<>();
        for (int i = 1; i <= 30; i++) {
            candidates.add(Proxies.candidate("10.0.0." + i, 8080));
        }

        List<ProxyRecord> working = tester(client).testBatch(candidates, 4);

        assertEquals(30, probed.size());
        assertEquals(15, working.size());
        assertTrue(maxInFlight.get() <= 4, "max in flight " + maxInFlight.get());
        Set<String> hosts = working.stream().map(ProxyRecord::host).collect(Collectors.toSet());
        assertTrue(hosts.contains("10.0.0.2"));
        assertFalse(hosts.contains("10.0.0.1"));
    }

    @Test
    void emptyBatchIsEmpty() {
        ProxiedHttpClient client = (via, url, headers, timeout) -> fail("no probe expected");

        assertTrue(tester(client).testBatch(List.of(), 20).isEmpty());
    }

    @Test
    void requiresEchoEndpoints() {
        props.setEchoEndpoints(new ArrayList<>());

        assertThrows(IllegalArgumentException.class,
                () -> tester((via, url, headers, timeout) -> null));
    }

    private ProxyHealthTester tester(ProxiedHttpClient client) {
        return new ProxyHealthTester(client, echoParser, props, clock, new Random(1));
    }
}
