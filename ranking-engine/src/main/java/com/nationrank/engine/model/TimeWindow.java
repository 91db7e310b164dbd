package com.nationrank.engine.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open time interval {@code [start, end)} selecting the matches of a run.
 */
public record TimeWindow(Instant start, Instant end) {

    public static final TimeWindow ALL_TIME = new TimeWindow(Instant.EPOCH, Instant.MAX);

    public TimeWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time window bounds are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time window ends before it starts: " + start + " > " + end);
        }
    }

    /**
     * Rolling window of the last {@code days} days ending at {@code now}.
     */
    public static TimeWindow lastDays(Instant now, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("Window length must be positive: " + days);
        }
        return new TimeWindow(now.minus(Duration.ofDays(days)), now);
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && instant.isBefore(end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
