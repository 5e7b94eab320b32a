package io.stackcontroller.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed period aligned to the epoch, so every scheduler instance computes the same fire
 * times regardless of when it started.
 */
public class IntervalSchedule implements Schedule {

    private final Duration interval;

    public IntervalSchedule(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive");
        }
        this.interval = interval;
    }

    @Override
    public Instant next(Instant after) {
        long period = interval.toMillis();
        long millis = after.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(millis, period) * period + period);
    }

    @Override
    public String toString() {
        return "every(" + interval + ")";
    }
}
