package com.trawler.proxy.source;

public enum FeedKind {
    HTML_TABLE,
    JSON,
    PLAIN_TEXT
}
