package com.cardioclaw.app.dashboard;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * Allows one manual refresh per interval, process-wide.
 */
public class RefreshRateLimiter {

    private final Duration interval;
    private final Clock clock;
    private Instant last;

    public RefreshRateLimiter(Duration interval, Clock clock) {
        this.interval = interval;
        this.clock = clock;
    }

    /**
     * @return empty when the refresh may proceed (and is counted), otherwise
     *         the seconds to wait, rounded up
     */
    public synchronized OptionalLong tryAcquire() {
        Instant now = clock.instant();
        if (last != null) {
            Duration remaining = interval.minus(Duration.between(last, now));
            if (remaining.compareTo(Duration.ZERO) > 0) {
                return OptionalLong.of((remaining.toMillis() + 999) / 1000);
            }
        }
        last = now;
        return OptionalLong.empty();
    }
}
