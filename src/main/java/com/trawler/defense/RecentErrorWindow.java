package com.trawler.defense;

import com.trawler.bean.DefenseProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling count of scrape errors seen within the configured window. Shared by every scrape loop in
 * the process and feeds {@link RetryController#coolDownIfNeeded(int)}.
 */
@Component
public class RecentErrorWindow {

    private final Clock clock;
    private final Duration window;
    private final Deque<Instant> errors = new ArrayDeque<>();

    @Autowired
    public RecentErrorWindow(DefenseProperties props, Clock clock) {
        this(props.getErrorWindow(), clock);
    }

    public RecentErrorWindow(Duration window, Clock clock) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Error window must be positive: " + window);
        }
        this.window = window;
        this.clock = clock;
    }

    public synchronized void record() {
        Instant now = clock.instant();
        evictBefore(now.minus(window));
        errors.addLast(now);
    }

    public synchronized int count() {
        evictBefore(clock.instant().minus(window));
        return errors.size();
    }

    public synchronized void clear() {
        errors.clear();
    }

    private void evictBefore(Instant cutoff) {
        while (!errors.isEmpty() && errors.peekFirst().isBefore(cutoff)) {
            errors.pollFirst();
        }
    }
}
