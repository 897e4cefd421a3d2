package com.trawler.proxy;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.ProxyProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds WebClients for probing candidates through a forward proxy and for fetching feeds directly.
 * All clients share one connection provider so thousands of probe clients do not each hold a pool.
 */
@Component
@Slf4j
public class ProxyClientFactory {

    // proxy feeds can be large HTML pages
    private static final int MAX_BUFFER_SIZE = 10 * 1024 * 1024;

    private static final int MAX_CONNECTIONS = 200;
    private static final int PENDING_ACQUIRE_TIMEOUT = 30; // seconds
    private static final int MAX_IDLE_TIME = 20; // seconds
    private static final int MAX_LIFE_TIME = 60; // seconds

    private final ConnectionProvider connectionProvider;
    private final ExchangeStrategies strategies;
    private final AtomicLong probeClients = new AtomicLong(0);

    public ProxyClientFactory() {
        this.connectionProvider = ConnectionProvider.builder("proxy-probe")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(Duration.ofSeconds(PENDING_ACQUIRE_TIMEOUT))
                .maxIdleTime(Duration.ofSeconds(MAX_IDLE_TIME))
                .maxLifeTime(Duration.ofSeconds(MAX_LIFE_TIME))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
        this.strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_BUFFER_SIZE))
                .build();

        log.info("Initialized ProxyClientFactory (max connections: {}, idle: {}s, lifetime: {}s)",
                MAX_CONNECTIONS, MAX_IDLE_TIME, MAX_LIFE_TIME);
    }

    /**
     * Client that tunnels every request through the given candidate. Connect, response and read
     * budgets all equal {@code timeout} so a hung proxy cannot outlive its probe.
     */
    public WebClient forProxy(ProxyCandidate candidate, Duration timeout) {
        int timeoutMs = (int) timeout.toMillis();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .proxy(proxy -> proxy
                        .type(ProxyProvider.Proxy.HTTP)
                        .host(candidate.host())
                        .port(candidate.port())
                        .connectTimeoutMillis(timeoutMs))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMs)
                .responseTimeout(timeout)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS)));

        long created = probeClients.incrementAndGet();
        log.trace("Created probe client #{} for {}", created, candidate.address());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }

    public WebClient direct(Duration timeout) {
        HttpClient httpClient = HttpClient.create(connectionProvider)
                .followRedirect(true)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .responseTimeout(timeout);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }

    @PreDestroy
    public void shutdown() {
        if (connectionProvider.isDisposed()) {
            return;
        }
        log.info("Shutting down ProxyClientFactory ({} probe clients created)", probeClients.get());
        try {
            connectionProvider.dispose();
        } catch (Exception e) {
            log.error("Error during connection provider shutdown: {}", e.getMessage());
        }
    }
}
