package com.trawler.scrape;

import com.trawler.proxy.ProxySelection;

/**
 * Starts browser sessions. The proxy is fixed when the session starts; rotating means closing the
 * driver and opening a new one.
 */
@FunctionalInterface
public interface BrowserDriverFactory {

    BrowserDriver open(ProxySelection selection);
}
