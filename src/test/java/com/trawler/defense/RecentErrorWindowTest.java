package com.trawler.defense;

import com.trawler.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class RecentErrorWindowTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final RecentErrorWindow window = new RecentErrorWindow(Duration.ofMinutes(5), clock);

    @Test
    void countsErrorsInsideWindow() {
        window.record();
        clock.advance(Duration.ofMinutes(2));
        window.record();
        window.record();

        assertEquals(3, window.count());
    }

    @Test
    void oldErrorsExpire() {
        window.record();
        clock.advance(Duration.ofMinutes(3));
        window.record();
        clock.advance(Duration.ofMinutes(3));

        assertEquals(1, window.count());

        clock.advance(Duration.ofMinutes(5));
        assertEquals(0, window.count());
    }

    @Test
    void clearResets() {
        window.record();
        window.clear();

        assertEquals(0, window.count());
    }

    @Test
    void rejectsEmptyWindow() {
        assertThrows(IllegalArgumentException.class, () -> new RecentErrorWindow(Duration.ZERO, clock));
    }
}
