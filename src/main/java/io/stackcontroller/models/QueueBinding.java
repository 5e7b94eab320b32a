package io.stackcontroller.models;

/**
 * Binds a named queue on one broker endpoint. A worker pool may only hold bindings that share
 * its endpoint id.
 */
public record QueueBinding(String brokerEndpointId, String queueName, String routingKey) {

    public QueueBinding {
        if (brokerEndpointId == null || brokerEndpointId.isBlank()) {
            throw new IllegalArgumentException("Broker endpoint id cannot be null or empty");
        }
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("Queue name cannot be null or empty");
        }
        if (routingKey == null || routingKey.isBlank()) {
            routingKey = queueName;
        }
    }

    public static QueueBinding of(String brokerEndpointId, String queueName) {
        return new QueueBinding(brokerEndpointId, queueName, queueName);
    }
}
