package com.cardioclaw.app.dashboard;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RefreshRateLimiterTest {

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-05-01T12:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    void oneRefreshPerInterval() {
        MutableClock clock = new MutableClock();
        RefreshRateLimiter limiter = new RefreshRateLimiter(Duration.ofSeconds(10), clock);

        assertTrue(limiter.tryAcquire().isEmpty());

        clock.advance(Duration.ofMillis(2_500));
        assertEquals(8, limiter.tryAcquire().getAsLong());

        clock.advance(Duration.ofMillis(7_499));
        assertEquals(1, limiter.tryAcquire().getAsLong());

        clock.advance(Duration.ofMillis(1));
        assertTrue(limiter.tryAcquire().isEmpty());
    }
}
