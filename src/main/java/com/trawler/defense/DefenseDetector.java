package com.trawler.defense;

import com.trawler.bean.DefenseProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies what a scrape attempt observed. Rules are checked in order and the first match wins:
 * CAPTCHA markers, rate-limit markers or blocking status codes, a landing URL outside the target
 * domain, a timeout, a failed navigation, and finally an expected results container that never
 * appeared. The last rule treats an empty page as a block unless the page says there are no results.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DefenseDetector {

    private static final Set<Integer> BLOCKING_STATUSES = Set.of(429, 403, 503);

    private final DefenseProperties props;

    public Optional<DefenseSignal> classify(ObservedPageState state) {
        return classify(state, 0);
    }

    public Optional<DefenseSignal> classify(ObservedPageState state, int retryCount) {
        Optional<DefenseSignalKind> kind = detect(state);
        kind.ifPresent(k -> log.debug("Detected {} at {} (status {})", k, state.currentUrl(), state.httpStatus()));
        return kind.map(k -> new DefenseSignal(k, retryCount));
    }

    private Optional<DefenseSignalKind> detect(ObservedPageState state) {
        String text = state.pageText() == null ? "" : state.pageText().toLowerCase(Locale.ROOT);

        if (state.challengeElementPresent() || containsAny(text, props.getCaptchaMarkers())) {
            return Optional.of(DefenseSignalKind.CAPTCHA);
        }
        if (isBlockingStatus(state.httpStatus()) || containsAny(text, props.getRateLimitMarkers())) {
            return Optional.of(DefenseSignalKind.RATE_LIMIT);
        }
        if (isOffTarget(state.currentUrl())) {
            return Optional.of(DefenseSignalKind.OFF_TARGET);
        }
        if (state.timedOut()) {
            return Optional.of(DefenseSignalKind.TIMEOUT);
        }
        if (state.navigationFailed()) {
            return Optional.of(DefenseSignalKind.NETWORK_ERROR);
        }
        if (state.resultsExpected()
                && !state.resultsContainerPresent()
                && !containsAny(text, props.getNoResultsMarkers())) {
            return Optional.of(DefenseSignalKind.RATE_LIMIT);
        }
        return Optional.empty();
    }

    private boolean isOffTarget(String currentUrl) {
        String domain = props.getTargetDomain();
        if (domain == null || domain.isBlank() || currentUrl == null || currentUrl.isBlank()) {
            return false;
        }
        String url = currentUrl.toLowerCase(Locale.ROOT);
        // a browser that never left its start page has not been redirected anywhere
        if (url.equals("about:blank") || url.startsWith("data:")) {
            return false;
        }
        return !url.contains(domain.toLowerCase(Locale.ROOT));
    }

    private static boolean isBlockingStatus(Integer status) {
        return status != null && BLOCKING_STATUSES.contains(status);
    }

    private static boolean containsAny(String text, List<String> markers) {
        if (text.isEmpty() || markers == null) {
            return false;
        }
        for (String marker : markers) {
            if (marker != null && !marker.isBlank() && text.contains(marker.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
