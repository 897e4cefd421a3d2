package com.trawler.scrape;

public interface BrowserElement {

    String text();

    boolean isDisplayed();

    /**
     * @return null when the attribute is not set
     */
    String attribute(String name);
}
