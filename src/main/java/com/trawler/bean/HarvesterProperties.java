package com.trawler.bean;

import com.trawler.proxy.source.FeedKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {

    /** Two-letter country code, or ALL to keep every country */
    private String countryFilter = "US";
    private Duration timeout = Duration.ofSeconds(5);
    private Duration fetchTimeout = Duration.ofSeconds(10);
    private int workers = 20;
    private boolean exportResults = true;
    private List<String> echoEndpoints = new ArrayList<>(List.of(
            "http://httpbin.org/ip",
            "http://icanhazip.com",
            "https://api.myip.com"));
    private List<String> userAgents = new ArrayList<>(List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36 Edg/124.0.0.0",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:125.0) Gecko/20100101 Firefox/125.0",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36"));
    private List<Source> sources = new ArrayList<>();

    public boolean filtersCountry() {
        return countryFilter != null && !countryFilter.isBlank() && !"ALL".equalsIgnoreCase(countryFilter);
    }

    @Data
    public static class Source {
        private String url;
        private FeedKind kind = FeedKind.HTML_TABLE;
        private int maxCandidates = 300;
    }
}
