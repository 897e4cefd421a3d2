package com.trawler.defense;

import lombok.Builder;

/**
 * What a scrape attempt saw after navigating: the landing URL, visible text and whatever the driver
 * could tell about the response.
 *
 * @param httpStatus              null when the driver could not read it
 * @param challengeElementPresent a CAPTCHA widget was found on the page
 * @param resultsExpected         the page should show a results container
 */
@Builder
public record ObservedPageState(
        String currentUrl,
        String pageText,
        Integer httpStatus,
        boolean timedOut,
        boolean navigationFailed,
        boolean challengeElementPresent,
        boolean resultsExpected,
        boolean resultsContainerPresent
) {
}
