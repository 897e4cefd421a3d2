package com.trawler.proxy.source;

import com.trawler.proxy.ProxyCandidate;

import java.util.List;

/**
 * Turns the raw payload of one kind of proxy feed into candidates. A payload that does not look
 * like the expected shape yields an empty list; only unreadable payloads throw.
 */
public interface ProxyFeedParser {

    FeedKind kind();

    List<ProxyCandidate> parse(String raw, String sourceUrl);
}
