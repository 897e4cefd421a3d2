package com.trawler.defense;

import com.trawler.bean.DefenseProperties;
import com.trawler.proxy.ProxyPoolManager;
import com.trawler.proxy.ProxySelection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns defense signals into actions against the pool.
 *
 * Blocking signals (CAPTCHA, rate limit, off target, network error) burn the proxy at once: one
 * failure report, then rotation. Timeouts are retried on the same proxy with 1s, 2s, 4s... backoff
 * until {@code defense.max-retries} is used up, and only that final exhaustion is reported.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RetryController {

    static final int MAX_COOL_DOWN_SECONDS = 30;

    private final ProxyPoolManager poolManager;
    private final DefenseProperties props;
    private final Sleeper sleeper;

    public DefenseAction handle(DefenseSignal signal, ProxySelection selection) {
        if (signal.kind().rotatesProxy()) {
            log.warn("{} detected on {}, rotating proxy", signal.kind(), selection.describe());
            poolManager.reportFailure(selection);
            return DefenseAction.ROTATE;
        }

        if (signal.retryCount() < props.getMaxRetries()) {
            Duration wait = backoff(signal.retryCount());
            log.info("Timeout on {}, retrying in {}s (attempt {}/{})", selection.describe(),
                    wait.toSeconds(), signal.retryCount() + 1, props.getMaxRetries());
            sleeper.sleep(wait);
            return DefenseAction.BACKOFF_RETRY;
        }

        log.warn("Timeout retries exhausted on {} after {} attempts", selection.describe(), signal.retryCount());
        poolManager.reportFailure(selection);
        return DefenseAction.ABORT;
    }

    /**
     * Re-runs a navigation that just timed out until it completes or the retry budget runs out.
     *
     * @return empty when a retry completed; the caller still owns the success report in that case
     */
    public Optional<DefenseAction> retryWithBackoff(String url, ProxySelection selection, TimedNavigation navigation) {
        DefenseSignal signal = DefenseSignal.of(DefenseSignalKind.TIMEOUT);
        while (true) {
            DefenseAction action = handle(signal, selection);
            if (action != DefenseAction.BACKOFF_RETRY) {
                return Optional.of(action);
            }

            NavigationResult result = navigation.attempt(url);
            if (result == NavigationResult.COMPLETED) {
                log.info("Retry {} succeeded for {}", signal.retryCount() + 1, url);
                return Optional.empty();
            }
            if (result == NavigationResult.FAILED) {
                return Optional.of(handle(DefenseSignal.of(DefenseSignalKind.NETWORK_ERROR), selection));
            }
            signal = signal.nextRetry();
        }
    }

    /**
     * Throttles everything when errors pile up: above two recent errors, sleeps
     * {@code min(30, 5 * 2^(errors - 2))} seconds.
     *
     * @return the delay applied, zero when none
     */
    public Duration coolDownIfNeeded(int recentErrors) {
        Duration delay = coolDownFor(recentErrors);
        if (!delay.isZero()) {
            log.warn("Detected {} recent errors, cooling down for {}s", recentErrors, delay.toSeconds());
            sleeper.sleep(delay);
        }
        return delay;
    }

    static Duration coolDownFor(int recentErrors) {
        if (recentErrors <= 2) {
            return Duration.ZERO;
        }
        int exponent = recentErrors - 2;
        // 5 * 2^3 already exceeds the cap
        long seconds = exponent >= 3 ? MAX_COOL_DOWN_SECONDS : Math.min(MAX_COOL_DOWN_SECONDS, 5L << exponent);
        return Duration.ofSeconds(seconds);
    }

    static Duration backoff(int retryCount) {
        return Duration.ofSeconds(1L << Math.min(retryCount, 30));
    }
}
