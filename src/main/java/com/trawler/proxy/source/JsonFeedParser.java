package com.trawler.proxy.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trawler.exception.ProxySourceException;
import com.trawler.proxy.ProxyCandidate;
import com.trawler.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Best-effort reader for JSON proxy APIs. Each field is looked up through an ordered list of the
 * key names seen across providers; entries missing a usable host or port are skipped.
 */
@Component
@Slf4j
public class JsonFeedParser implements ProxyFeedParser {

    private static final List<String> CONTAINER_KEYS = List.of("data", "proxies", "list", "items", "results");
    private static final List<String> HOST_KEYS = List.of("ip", "host", "address", "ipAddress", "proxy_address");
    private static final List<String> PORT_KEYS = List.of("port", "proxy_port");
    private static final List<String> COUNTRY_KEYS = List.of("country", "countryCode", "country_code", "code");
    private static final List<String> HTTPS_KEYS = List.of("https", "ssl", "supportsHttps", "secure");

    private final ObjectMapper objectMapper;

    public JsonFeedParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public FeedKind kind() {
        return FeedKind.JSON;
    }

    @Override
    public List<ProxyCandidate> parse(String raw, String sourceUrl) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProxySourceException(sourceUrl, "Malformed JSON payload", e);
        }

        JsonNode entries = locateEntries(root);
        if (entries == null) {
            log.warn("No proxy array found in JSON payload from {}", sourceUrl);
            return List.of();
        }

        List<ProxyCandidate> candidates = new ArrayList<>();
        for (JsonNode entry : entries) {
            ProxyCandidate candidate = toCandidate(entry, sourceUrl);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    private JsonNode locateEntries(JsonNode root) {
        if (root == null) {
            return null;
        }
        if (root.isArray()) {
            return root;
        }
        if (root.isObject()) {
            for (String key : CONTAINER_KEYS) {
                JsonNode node = root.get(key);
                if (node != null && node.isArray()) {
                    return node;
                }
                // {"data": {"proxies": [...]}} style nesting
                if (node != null && node.isObject()) {
                    JsonNode nested = locateEntries(node);
                    if (nested != null) {
                        return nested;
                    }
                }
            }
        }
        return null;
    }

    private ProxyCandidate toCandidate(JsonNode entry, String sourceUrl) {
        if (entry.isTextual()) {
            return fromCombined(entry.asText(), -1, false, "", sourceUrl);
        }
        if (!entry.isObject()) {
            return null;
        }

        String host = firstText(entry, HOST_KEYS);
        if (host == null) {
            return null;
        }
        int port = AddressUtil.parsePort(firstText(entry, PORT_KEYS));
        String country = firstText(entry, COUNTRY_KEYS);
        return fromCombined(host, port, supportsHttps(entry), country, sourceUrl);
    }

    private ProxyCandidate fromCombined(String host, int port, boolean https, String country, String sourceUrl) {
        String value = host.trim();
        int colon = value.lastIndexOf(':');
        if (colon > 0) {
            if (port < 0) {
                port = AddressUtil.parsePort(value.substring(colon + 1));
            }
            value = value.substring(0, colon);
        }
        if (!AddressUtil.isIpv4(value) || port < 0) {
            return null;
        }
        return new ProxyCandidate(value, port, https, sourceUrl, country);
    }

    private boolean supportsHttps(JsonNode entry) {
        for (String key : HTTPS_KEYS) {
            JsonNode node = entry.get(key);
            if (node == null || node.isNull()) {
                continue;
            }
            if (node.isBoolean()) {
                return node.asBoolean();
            }
            String text = node.asText().trim().toLowerCase(Locale.ROOT);
            return text.equals("yes") || text.equals("true") || text.equals("1");
        }

        JsonNode protocols = entry.get("protocols");
        if (protocols != null && protocols.isArray()) {
            for (JsonNode protocol : protocols) {
                if ("https".equalsIgnoreCase(protocol.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private String firstText(JsonNode entry, List<String> keys) {
        for (String key : keys) {
            JsonNode node = entry.get(key);
            if (node != null && !node.isNull() && !node.isContainerNode()) {
                String text = node.asText();
                if (!text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }
}
