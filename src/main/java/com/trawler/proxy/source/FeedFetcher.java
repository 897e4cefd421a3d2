package com.trawler.proxy.source;

import com.trawler.bean.HarvesterProperties;
import com.trawler.exception.ProxySourceException;
import com.trawler.proxy.ProxyClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Downloads raw feed payloads over a direct connection.
 */
@Component
@Slf4j
public class FeedFetcher {

    private final WebClient webClient;
    private final Duration timeout;
    private final List<String> userAgents;

    public FeedFetcher(ProxyClientFactory clientFactory, HarvesterProperties props) {
        this.webClient = clientFactory.direct(props.getFetchTimeout());
        this.timeout = props.getFetchTimeout();
        this.userAgents = List.copyOf(props.getUserAgents());
    }

    public String fetch(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Feed URL cannot be null or empty");
        }

        log.info("Fetching proxy feed {}", url);
        try {
            String body = webClient.get()
                    .uri(url)
                    .header(HttpHeaders.USER_AGENT, userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size())))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return body == null ? "" : body;
        } catch (Exception e) {
            throw new ProxySourceException(url, "Fetch failed: " + e.getMessage(), e);
        }
    }
}
