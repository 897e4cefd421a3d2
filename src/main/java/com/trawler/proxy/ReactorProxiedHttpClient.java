package com.trawler.proxy;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ReactorProxiedHttpClient implements ProxiedHttpClient {

    private final ProxyClientFactory clientFactory;

    @Override
    public ProbeResponse get(ProxyCandidate via, String url, Map<String, String> headers, Duration timeout) {
        return clientFactory.forProxy(via, timeout)
                .get()
                .uri(url)
                .headers(h -> headers.forEach(h::add))
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ProbeResponse(response.statusCode().value(), body)))
                .timeout(timeout)
                .block();
    }
}
