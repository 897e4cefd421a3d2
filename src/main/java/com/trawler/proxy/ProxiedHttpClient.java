package com.trawler.proxy;

import java.time.Duration;
import java.util.Map;

/**
 * Blocking GET through a forward proxy. Connection, proxy and timeout failures surface as
 * runtime exceptions; non-200 statuses come back as a response.
 */
public interface ProxiedHttpClient {

    ProbeResponse get(ProxyCandidate via, String url, Map<String, String> headers, Duration timeout);

    record ProbeResponse(int status, String body) {
    }
}
