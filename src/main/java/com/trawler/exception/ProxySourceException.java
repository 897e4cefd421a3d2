package com.trawler.exception;

/**
 * Exception thrown when a proxy feed cannot be fetched or parsed
 */
public class ProxySourceException extends RuntimeException {

    private final String sourceUrl;

    public ProxySourceException(String sourceUrl, String message) {
        super(String.format("Proxy source '%s': %s", sourceUrl, message));
        this.sourceUrl = sourceUrl;
    }

    public ProxySourceException(String sourceUrl, String message, Throwable cause) {
        super(String.format("Proxy source '%s': %s", sourceUrl, message), cause);
        this.sourceUrl = sourceUrl;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }
}
