package com.trawler.proxy.source;

import com.trawler.proxy.ProxyCandidate;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * One configured feed: download, parse with the adapter for its shape, filter by country and cap.
 */
@Slf4j
public class FeedProxySource implements ProxySource {

    private final String url;
    private final ProxyFeedParser parser;
    private final Function<String, String> fetcher;
    private final int maxCandidates;
    private final String countryFilter;

    /**
     * @param countryFilter two-letter code to keep, or {@code null} to keep every country
     */
    public FeedProxySource(String url, ProxyFeedParser parser, Function<String, String> fetcher,
                           int maxCandidates, String countryFilter) {
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("maxCandidates must be positive for " + url);
        }
        this.url = url;
        this.parser = parser;
        this.fetcher = fetcher;
        this.maxCandidates = maxCandidates;
        this.countryFilter = countryFilter == null ? null : countryFilter.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String name() {
        return url;
    }

    @Override
    public List<ProxyCandidate> fetchCandidates() {
        List<ProxyCandidate> parsed;
        try {
            parsed = parser.parse(fetcher.apply(url), url);
        } catch (RuntimeException e) {
            log.warn("Proxy source {} contributed no candidates: {}", url, e.getMessage());
            log.debug("Proxy source failure detail", e);
            return List.of();
        }

        List<ProxyCandidate> accepted = parsed.stream()
                .filter(this::matchesCountry)
                .limit(maxCandidates)
                .toList();

        log.info("Decoded {} candidate proxies from {} ({} parsed, {} kind)",
                accepted.size(), url, parsed.size(), parser.kind());
        return accepted;
    }

    // feeds that carry no country keep their candidates
    private boolean matchesCountry(ProxyCandidate candidate) {
        return countryFilter == null || !candidate.hasCountry() || countryFilter.equals(candidate.country());
    }
}
