package com.tradeledger.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed time interval [from, to] over exchange timestamps.
 */
public record TimeWindow(Instant from, Instant to) {

    public TimeWindow {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Window start " + from + " is after end " + to);
        }
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(from) && !instant.isAfter(to);
    }

    public Duration length() {
        return Duration.between(from, to);
    }
}
