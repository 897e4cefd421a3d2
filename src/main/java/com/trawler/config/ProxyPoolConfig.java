package com.trawler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trawler.bean.DefenseProperties;
import com.trawler.bean.HarvesterProperties;
import com.trawler.bean.ProxyPoolProperties;
import com.trawler.proxy.HarvestExporter;
import com.trawler.proxy.JsonFilePoolStateStore;
import com.trawler.proxy.PoolStateStore;
import com.trawler.proxy.ProxyHarvester;
import com.trawler.proxy.ProxyPoolManager;
import com.trawler.proxy.source.CandidateCollector;
import com.trawler.proxy.source.FeedFetcher;
import com.trawler.proxy.source.FeedKind;
import com.trawler.proxy.source.FeedProxySource;
import com.trawler.proxy.source.ProxyFeedParser;
import com.trawler.proxy.source.ProxySource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({ProxyPoolProperties.class, HarvesterProperties.class, DefenseProperties.class})
@Slf4j
public class ProxyPoolConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    PoolStateStore poolStateStore(ProxyPoolProperties props, ObjectMapper objectMapper, Clock clock) {
        return new JsonFilePoolStateStore(Path.of(props.getStateDir()), objectMapper, props.getRetainedSnapshots(), clock);
    }

    @Bean
    HarvestExporter harvestExporter(ProxyPoolProperties props, ObjectMapper objectMapper, Clock clock) {
        return new HarvestExporter(Path.of(props.getStateDir()), objectMapper, clock);
    }

    @Bean
    ProxyPoolManager proxyPoolManager(PoolStateStore store, ProxyHarvester harvester, ProxyPoolProperties props, Clock clock) {
        return new ProxyPoolManager(store, harvester, props, clock);
    }

    /**
     * One feed source per configured entry, each paired with the parser for its payload format.
     */
    @Bean
    CandidateCollector candidateCollector(HarvesterProperties props, List<ProxyFeedParser> parsers, FeedFetcher fetcher) {
        Map<FeedKind, ProxyFeedParser> byKind = new EnumMap<>(FeedKind.class);
        parsers.forEach(p -> byKind.put(p.kind(), p));

        String countryFilter = props.filtersCountry() ? props.getCountryFilter() : null;
        List<ProxySource> sources = new ArrayList<>();
        for (HarvesterProperties.Source source : props.getSources()) {
            if (source.getUrl() == null || source.getUrl().isBlank()) {
                log.warn("Skipping proxy source without url");
                continue;
            }
            ProxyFeedParser parser = byKind.get(source.getKind());
            if (parser == null) {
                throw new IllegalStateException("No parser for feed kind " + source.getKind());
            }
            sources.add(new FeedProxySource(source.getUrl(), parser, fetcher::fetch,
                    source.getMaxCandidates(), countryFilter));
        }

        log.info("Configured {} proxy sources (country filter: {})", sources.size(),
                countryFilter == null ? "ALL" : countryFilter);
        return new CandidateCollector(sources);
    }
}
