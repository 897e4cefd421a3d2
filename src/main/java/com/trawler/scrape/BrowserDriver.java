package com.trawler.scrape;

import com.trawler.exception.NavigationTimeoutException;

import java.util.List;
import java.util.Optional;

/**
 * A controlled browser session bound to a single proxy selection for its whole lifetime.
 * Selectors are CSS selectors.
 */
public interface BrowserDriver extends AutoCloseable {

    /**
     * Loads the page and waits for it to settle.
     *
     * @return false when the page could not be loaded (proxy refused the tunnel, connection reset...)
     * @throws NavigationTimeoutException when the load exceeded the driver's page-load timeout
     */
    boolean navigate(String url);

    String currentUrl();

    /**
     * Visible text of the whole document.
     */
    String pageText();

    Optional<BrowserElement> findElement(String selector);

    List<BrowserElement> findElements(String selector);

    boolean click(BrowserElement element);

    boolean sendKeys(BrowserElement element, CharSequence text);

    Object executeScript(String script, Object... args);

    default String getText(BrowserElement element) {
        return element == null ? "" : element.text();
    }

    @Override
    void close();
}
