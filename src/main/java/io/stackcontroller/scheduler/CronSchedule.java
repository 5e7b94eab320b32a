package io.stackcontroller.scheduler;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Six-field cron expression (second minute hour day month weekday) evaluated in UTC.
 */
public class CronSchedule implements Schedule {

    private final String expression;
    private final CronExpression cron;

    public CronSchedule(String expression) {
        this.expression = expression;
        this.cron = CronExpression.parse(expression);
    }

    @Override
    public Instant next(Instant after) {
        ZonedDateTime next = cron.next(after.atZone(ZoneOffset.UTC));
        if (next == null) {
            throw new IllegalStateException("Cron expression " + expression + " has no future fire time");
        }
        return next.toInstant();
    }

    @Override
    public String toString() {
        return "cron(" + expression + ")";
    }
}
