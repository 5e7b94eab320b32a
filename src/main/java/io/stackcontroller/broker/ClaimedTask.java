package io.stackcontroller.broker;

import io.stackcontroller.models.Task;

import java.time.Instant;

/**
 * A task delivered to exactly one consumer. The receipt identifies this delivery; once the
 * visibility timeout passes without an acknowledgement the task is delivered again under a new
 * receipt and the old one stops working.
 */
public record ClaimedTask(String brokerEndpointId, String queueName, String receipt, Task task, Instant claimedAt) {
}
