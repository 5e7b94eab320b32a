package io.stackcontroller.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A task that exhausted its attempts, kept with its original payload for replay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterRecord {

    @JsonProperty("broker_endpoint_id")
    private String brokerEndpointId;

    @JsonProperty("task")
    private Task task;

    @JsonProperty("error")
    private String error;

    @JsonProperty("dead_lettered_at")
    private Instant deadLetteredAt;
}
