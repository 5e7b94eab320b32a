package io.stackcontroller.broker;

import io.stackcontroller.models.DeadLetterRecord;
import io.stackcontroller.models.Task;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.UUID;

/**
 * Broker endpoint held in process memory. Used for single-host deployments and tests; every
 * instance is its own isolated broker.
 */
@Slf4j
public class InMemoryBrokerEndpoint implements BrokerEndpoint {

    private final String id;
    private final Clock clock;

    private final Map<String, PriorityQueue<Entry>> queues = new HashMap<>();
    private final Map<String, InFlight> inFlight = new HashMap<>();
    private final Map<String, Map<String, DeadLetterRecord>> deadLetters = new HashMap<>();
    private long sequence;
    private boolean closed;

    public InMemoryBrokerEndpoint(String id) {
        this(id, Clock.systemUTC());
    }

    public InMemoryBrokerEndpoint(String id, Clock clock) {
        this.id = id;
        this.clock = clock;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public synchronized void enqueue(Task task) throws BrokerException {
        ensureOpen();
        if (task.getQueueName() == null || task.getQueueName().isBlank()) {
            throw new BrokerException("[Broker: " + id + "] task " + task.getId() + " has no queue");
        }
        if (task.getEnqueuedAt() == null) {
            task.setEnqueuedAt(clock.instant());
        }
        push(task);
        log.debug("[Broker: {}] Enqueued task {} ({}) on {}", id, task.getId(), task.getName(), task.getQueueName());
    }

    @Override
    public synchronized Optional<ClaimedTask> claim(String queueName, Duration visibilityTimeout) throws BrokerException {
        ensureOpen();
        Instant now = clock.instant();
        reclaimExpired(now);
        PriorityQueue<Entry> queue = queues.get(queueName);
        if (queue == null || queue.isEmpty() || queue.peek().readyAt.isAfter(now)) {
            return Optional.empty();
        }
        Task task = queue.poll().task;
        String receipt = UUID.randomUUID().toString();
        ClaimedTask claimed = new ClaimedTask(id, queueName, receipt, task, now);
        inFlight.put(receipt, new InFlight(claimed, now.plus(visibilityTimeout)));
        return Optional.of(claimed);
    }

    @Override
    public synchronized boolean acknowledge(ClaimedTask claimed) {
        return inFlight.remove(claimed.receipt()) != null;
    }

    @Override
    public synchronized boolean retry(ClaimedTask claimed, Task next) throws BrokerException {
        ensureOpen();
        if (inFlight.remove(claimed.receipt()) == null) {
            return false;
        }
        push(next);
        return true;
    }

    @Override
    public synchronized boolean release(ClaimedTask claimed) throws BrokerException {
        ensureOpen();
        InFlight entry = inFlight.remove(claimed.receipt());
        if (entry == null) {
            return false;
        }
        Task task = entry.claimed.task();
        task.setNotBefore(null);
        push(task);
        return true;
    }

    @Override
    public synchronized boolean deadLetter(ClaimedTask claimed, DeadLetterRecord record) throws BrokerException {
        ensureOpen();
        if (inFlight.remove(claimed.receipt()) == null) {
            return false;
        }
        deadLetters.computeIfAbsent(claimed.queueName(), k -> new LinkedHashMap<>())
                .put(record.getTask().getId(), record);
        return true;
    }

    @Override
    public synchronized List<DeadLetterRecord> listDeadLetters(String queueName) {
        return new ArrayList<>(deadLetters.getOrDefault(queueName, Map.of()).values());
    }

    @Override
    public synchronized Optional<Task> replayDeadLetter(String queueName, String taskId) throws BrokerException {
        ensureOpen();
        Map<String, DeadLetterRecord> records = deadLetters.get(queueName);
        DeadLetterRecord record = records != null ? records.remove(taskId) : null;
        if (record == null) {
            return Optional.empty();
        }
        Task replayed = record.getTask().toBuilder()
                .attemptCount(0)
                .notBefore(null)
                .enqueuedAt(clock.instant())
                .build();
        push(replayed);
        return Optional.of(replayed);
    }

    @Override
    public synchronized long depth(String queueName) {
        PriorityQueue<Entry> queue = queues.get(queueName);
        return queue != null ? queue.size() : 0;
    }

    public synchronized int inFlightCount() {
        return inFlight.size();
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    private void push(Task task) {
        Instant readyAt = task.getNotBefore() != null ? task.getNotBefore() : clock.instant();
        queues.computeIfAbsent(task.getQueueName(), k -> new PriorityQueue<>(Entry.ORDER))
                .add(new Entry(task, readyAt, sequence++));
    }

    private void reclaimExpired(Instant now) {
        Iterator<InFlight> iterator = inFlight.values().iterator();
        while (iterator.hasNext()) {
            InFlight entry = iterator.next();
            if (!entry.deadline.isAfter(now)) {
                iterator.remove();
                Task task = entry.claimed.task();
                log.warn("[Broker: {}] Visibility timeout expired for task {}, redelivering", id, task.getId());
                push(task);
            }
        }
    }

    private void ensureOpen() throws BrokerException {
        if (closed) {
            throw new BrokerException("[Broker: " + id + "] endpoint is closed");
        }
    }

    private static final class Entry {
        private static final Comparator<Entry> ORDER = Comparator
                .comparing((Entry e) -> e.readyAt)
                .thenComparingLong(e -> e.sequence);

        private final Task task;
        private final Instant readyAt;
        private final long sequence;

        private Entry(Task task, Instant readyAt, long sequence) {
            this.task = task;
            this.readyAt = readyAt;
            this.sequence = sequence;
        }
    }

    private static final class InFlight {
        private final ClaimedTask claimed;
        private final Instant deadline;

        private InFlight(ClaimedTask claimed, Instant deadline) {
            this.claimed = claimed;
            this.deadline = deadline;
        }
    }
}
