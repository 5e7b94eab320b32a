package io.stackcontroller.scheduler;

import io.stackcontroller.models.ScheduledTask;

import java.time.Instant;

/**
 * Fire times of a scheduled task.
 */
public interface Schedule {

    /**
     * The first fire time strictly after {@code after}.
     */
    Instant next(Instant after);

    static Schedule of(ScheduledTask task) {
        task.validate();
        if (task.getCronExpression() != null && !task.getCronExpression().isBlank()) {
            return new CronSchedule(task.getCronExpression());
        }
        return new IntervalSchedule(task.getInterval());
    }
}
