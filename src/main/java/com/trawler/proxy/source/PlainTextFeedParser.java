package com.trawler.proxy.source;

import com.trawler.proxy.ProxyCandidate;
import com.trawler.util.AddressUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;

/**
 * Line-oriented feeds such as {@code 1.2.3.4:8080 US https}. Comment lines start with # or //.
 */
@Component
public class PlainTextFeedParser implements ProxyFeedParser {

    @Override
    public FeedKind kind() {
        return FeedKind.PLAIN_TEXT;
    }

    @Override
    public List<ProxyCandidate> parse(String raw, String sourceUrl) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }

        List<ProxyCandidate> candidates = new ArrayList<>();
        for (String line : raw.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("//")) {
                continue;
            }

            Matcher matcher = AddressUtil.IP_PORT.matcher(trimmed);
            String remainder = AddressUtil.IP_PORT.matcher(trimmed).replaceAll(" ");
            String country = sniffCountry(remainder);
            boolean https = remainder.toLowerCase(Locale.ROOT).contains("https");

            while (matcher.find()) {
                String ip = matcher.group(1);
                int port = AddressUtil.parsePort(matcher.group(2));
                if (AddressUtil.isIpv4(ip) && port > 0) {
                    candidates.add(new ProxyCandidate(ip, port, https, sourceUrl, country));
                }
            }
        }
        return candidates;
    }

    private String sniffCountry(String remainder) {
        for (String token : remainder.split("[\\s,;|\\t\\[\\]()]+")) {
            if (AddressUtil.isCountryCode(token)) {
                return token;
            }
        }
        return "";
    }
}
