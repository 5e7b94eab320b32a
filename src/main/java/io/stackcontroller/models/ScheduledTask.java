package io.stackcontroller.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A recurring task definition owned by a tier's periodic scheduler.
 * Exactly one of {@code cronExpression} and {@code interval} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledTask {

    /**
     * Schedule entry name, unique per tier, e.g. {@code update-car-bids-every-15-minutes}.
     */
    private String name;

    /**
     * Handler name of the task enqueued on every firing.
     */
    private String taskName;

    /**
     * Six-field cron expression evaluated in UTC.
     */
    private String cronExpression;

    private Duration interval;

    private String targetQueue;

    @Builder.Default
    private Map<String, Object> payloadTemplate = new LinkedHashMap<>();

    @Builder.Default
    private int maxAttempts = 3;

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Scheduled task name cannot be null or empty");
        }
        boolean hasCron = cronExpression != null && !cronExpression.isBlank();
        boolean hasInterval = interval != null && !interval.isZero() && !interval.isNegative();
        if (hasCron == hasInterval) {
            throw new IllegalArgumentException("Scheduled task " + name + " needs exactly one of cron or interval");
        }
    }
}
