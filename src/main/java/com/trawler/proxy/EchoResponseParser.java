package com.trawler.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pulls the caller address an echo endpoint reports: httpbin's {@code origin} (first entry when a
 * proxy chain is listed), {@code ip} for myip-style APIs, or the plain body for icanhazip.
 */
@Component
@Slf4j
public class EchoResponseParser {

    static final String UNKNOWN = "unknown";

    private final ObjectMapper objectMapper;

    public EchoResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String extractOrigin(String body) {
        if (body == null || body.isBlank()) {
            return UNKNOWN;
        }

        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) {
            return trimmed.lines().findFirst().map(String::trim).orElse(UNKNOWN);
        }

        try {
            JsonNode node = objectMapper.readTree(trimmed);
            JsonNode origin = node.hasNonNull("origin") ? node.get("origin") : node.get("ip");
            if (origin == null || origin.isNull()) {
                return UNKNOWN;
            }
            return origin.asText().split(",")[0].trim();
        } catch (Exception e) {
            log.debug("Unreadable echo response: {}", e.getMessage());
            return UNKNOWN;
        }
    }
}
