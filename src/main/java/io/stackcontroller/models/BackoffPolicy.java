package io.stackcontroller.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Exponential backoff with a ceiling: {@code min(initial * multiplier^(attempt-1), max)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackoffPolicy {

    @JsonProperty("initial_delay_millis")
    @Builder.Default
    private long initialDelayMillis = 1000L;

    @JsonProperty("multiplier")
    @Builder.Default
    private double multiplier = 2.0;

    @JsonProperty("max_delay_millis")
    @Builder.Default
    private long maxDelayMillis = 60_000L;

    public static BackoffPolicy defaults() {
        return BackoffPolicy.builder().build();
    }

    public static BackoffPolicy none() {
        return BackoffPolicy.builder().initialDelayMillis(0).multiplier(1.0).maxDelayMillis(0).build();
    }

    /**
     * Delay before the given attempt (1-based) is retried.
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1 || initialDelayMillis <= 0) {
            return Duration.ZERO;
        }
        double delay = initialDelayMillis * Math.pow(multiplier, attempt - 1);
        if (Double.isInfinite(delay) || delay > maxDelayMillis) {
            return Duration.ofMillis(maxDelayMillis);
        }
        return Duration.ofMillis((long) delay);
    }
}
