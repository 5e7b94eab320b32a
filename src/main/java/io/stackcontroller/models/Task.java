package io.stackcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A unit of work travelling through a broker endpoint.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    @JsonProperty("id")
    private String id;

    /**
     * Handler name, e.g. {@code tasks.task.update_car_bids}.
     */
    @JsonProperty("name")
    private String name;

    @JsonProperty("queue_name")
    private String queueName;

    @JsonProperty("payload")
    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    @JsonProperty("attempt_count")
    private int attemptCount;

    @JsonProperty("max_attempts")
    @Builder.Default
    private int maxAttempts = 3;

    @JsonProperty("backoff_policy")
    @Builder.Default
    private BackoffPolicy backoffPolicy = BackoffPolicy.defaults();

    @JsonProperty("enqueued_at")
    private Instant enqueuedAt;

    /**
     * Earliest instant the task may be claimed; null means immediately.
     */
    @JsonProperty("not_before")
    private Instant notBefore;

    @JsonProperty("last_error")
    private String lastError;

    public static Task create(String name, String queueName, Map<String, Object> payload, int maxAttempts) {
        return Task.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .queueName(queueName)
                .payload(payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>())
                .maxAttempts(maxAttempts)
                .build();
    }

    /**
     * Copy for the next attempt after a failure.
     */
    public Task nextAttempt(String error, Instant notBefore) {
        return toBuilder()
                .attemptCount(attemptCount + 1)
                .lastError(error)
                .notBefore(notBefore)
                .build();
    }

    @JsonIgnore
    public boolean isExhaustedAfterFailure() {
        return attemptCount + 1 >= maxAttempts;
    }
}
