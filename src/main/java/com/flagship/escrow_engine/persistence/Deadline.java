package com.flagship.escrow_engine.persistence;

import lombok.Value;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Caller-supplied point in time after which an engine call must give up.
 *
 * The remaining time becomes the database transaction timeout, so a call that
 * runs out of time is rolled back as a whole and leaves no partial effect.
 */
@Value
public class Deadline {
    Instant expiresAt;

    public static Deadline at(Instant expiresAt) {
        return new Deadline(Objects.requireNonNull(expiresAt, "expiresAt"));
    }

    public static Deadline after(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        return new Deadline(clock.instant().plus(timeout));
    }

    public Duration remaining(Clock clock) {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired(Clock clock) {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * Remaining time rounded up to whole seconds, the granularity Spring transaction timeouts use.
     */
    public int remainingSeconds(Clock clock) {
        long millis = remaining(clock).toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }
}
