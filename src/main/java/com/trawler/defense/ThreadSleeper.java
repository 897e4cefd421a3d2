package com.trawler.defense;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Blocks the calling thread. An interrupt ends the sleep early and keeps the interrupt flag set for
 * the caller's own interrupt handling.
 */
@Component
@Slf4j
public class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Backoff sleep of {}s interrupted", duration.toSeconds());
        }
    }
}
