package com.trawler.exception;

/**
 * Thrown by a browser driver when a page load exceeds its timeout budget
 */
public class NavigationTimeoutException extends RuntimeException {

    private final String url;

    public NavigationTimeoutException(String url, Throwable cause) {
        super("Navigation timed out: " + url, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
