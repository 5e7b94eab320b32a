package io.stackcontroller.broker;

import io.stackcontroller.models.DeadLetterRecord;
import io.stackcontroller.models.Task;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * One isolated message broker, dedicated to a single tier. The endpoint is the only shared
 * mutable resource between producers and workers.
 *
 * Operations that settle a claimed task return {@code false} when the receipt is no longer
 * valid (already settled, released, or redelivered after its visibility timeout).
 */
public interface BrokerEndpoint extends AutoCloseable {

    String getId();

    /**
     * Append a task to its queue. A non-null {@link Task#getNotBefore()} delays delivery.
     */
    void enqueue(Task task) throws BrokerException;

    /**
     * Take the oldest deliverable task of a queue, hiding it from other consumers for
     * {@code visibilityTimeout}.
     */
    Optional<ClaimedTask> claim(String queueName, Duration visibilityTimeout) throws BrokerException;

    boolean acknowledge(ClaimedTask claimed) throws BrokerException;

    /**
     * Settle the delivery and enqueue {@code next} in its place.
     */
    boolean retry(ClaimedTask claimed, Task next) throws BrokerException;

    /**
     * Give the task back unchanged, e.g. when a worker abandons it on shutdown.
     */
    boolean release(ClaimedTask claimed) throws BrokerException;

    boolean deadLetter(ClaimedTask claimed, DeadLetterRecord record) throws BrokerException;

    List<DeadLetterRecord> listDeadLetters(String queueName) throws BrokerException;

    /**
     * Move a dead-lettered task back to its queue with its attempt count reset.
     */
    Optional<Task> replayDeadLetter(String queueName, String taskId) throws BrokerException;

    /**
     * Tasks waiting in the queue, delayed ones included, claimed ones excluded.
     */
    long depth(String queueName) throws BrokerException;

    @Override
    void close();
}
