package io.stackcontroller.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.stackcontroller.models.DeadLetterRecord;
import io.stackcontroller.models.Task;
import io.stackcontroller.store.EtcdPathResolver;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Broker endpoint stored in etcd. Each tier gets its own {@link Client}, so a tier's workers
 * never hold a connection that can reach the other tier's queues.
 *
 * Ready tasks are keyed by delivery time so a sorted prefix scan returns the oldest deliverable
 * task first. Claiming moves the key to the in-flight prefix in one compare-and-swap
 * transaction on its mod revision; in-flight entries record a deadline and are moved back when
 * it passes.
 */
@Slf4j
public class EtcdBrokerEndpoint implements BrokerEndpoint {

    private static final int ETCD_OPERATION_TIMEOUT_SECONDS = 5;
    private static final int MAX_CLAIM_ATTEMPTS = 5;
    private static final int REAP_BATCH = 32;
    private static final ByteSequence KEY_SUCCESSOR = ByteSequence.from(new byte[]{0});

    private final String id;
    private final Client etcdClient;
    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EtcdBrokerEndpoint(String id, Client etcdClient, EtcdPathResolver pathResolver, Clock clock) {
        this.id = id;
        this.etcdClient = etcdClient;
        this.kvClient = etcdClient.getKVClient();
        this.pathResolver = pathResolver;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("[Broker: {}] etcd endpoint initialized under {}", id, pathResolver.getNamespace());
    }

    /**
     * Open a dedicated etcd connection for one tier.
     */
    public static EtcdBrokerEndpoint connect(String id, String[] endpoints, String namespace) {
        Client client = Client.builder().endpoints(endpoints).build();
        return new EtcdBrokerEndpoint(id, client, new EtcdPathResolver(namespace), Clock.systemUTC());
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void enqueue(Task task) throws BrokerException {
        if (task.getQueueName() == null || task.getQueueName().isBlank()) {
            throw new BrokerException("[Broker: " + id + "] task " + task.getId() + " has no queue");
        }
        if (task.getEnqueuedAt() == null) {
            task.setEnqueuedAt(clock.instant());
        }
        String key = readyKey(task);
        await(kvClient.put(bytes(key), bytes(toJson(task))), "enqueue " + task.getId());
        log.debug("[Broker: {}] Enqueued task {} ({}) on {}", id, task.getId(), task.getName(), task.getQueueName());
    }

    @Override
    public Optional<ClaimedTask> claim(String queueName, Duration visibilityTimeout) throws BrokerException {
        Instant now = clock.instant();
        reclaimExpired(queueName, now);

        String prefix = pathResolver.getReadyPrefix(queueName);
        GetOption oldestFirst = GetOption.newBuilder()
                .withPrefix(bytes(prefix))
                .withSortField(GetOption.SortTarget.KEY)
                .withSortOrder(GetOption.SortOrder.ASCEND)
                .withLimit(1)
                .build();

        for (int attempt = 0; attempt < MAX_CLAIM_ATTEMPTS; attempt++) {
            GetResponse response = await(kvClient.get(bytes(prefix), oldestFirst), "scan " + queueName);
            if (response.getKvs().isEmpty()) {
                return Optional.empty();
            }
            KeyValue head = response.getKvs().get(0);
            String readyKey = head.getKey().toString(UTF_8);
            if (pathResolver.parseReadyAtMillis(readyKey) > now.toEpochMilli()) {
                return Optional.empty();
            }
            Task task = fromJson(head.getValue().toString(UTF_8), Task.class);
            String receipt = UUID.randomUUID().toString();
            InFlightEntry entry = new InFlightEntry(task, now.plus(visibilityTimeout).toEpochMilli());

            TxnResponse txn = await(kvClient.txn()
                    .If(new Cmp(head.getKey(), Cmp.Op.EQUAL, CmpTarget.modRevision(head.getModRevision())))
                    .Then(Op.delete(head.getKey(), DeleteOption.DEFAULT),
                          Op.put(bytes(pathResolver.getInFlightPath(queueName, receipt)), bytes(toJson(entry)), PutOption.DEFAULT))
                    .commit(), "claim " + readyKey);
            if (txn.isSucceeded()) {
                return Optional.of(new ClaimedTask(id, queueName, receipt, task, now));
            }
            log.debug("[Broker: {}] Lost claim race on {}, retrying", id, readyKey);
        }
        return Optional.empty();
    }

    @Override
    public boolean acknowledge(ClaimedTask claimed) throws BrokerException {
        ByteSequence inFlightKey = bytes(pathResolver.getInFlightPath(claimed.queueName(), claimed.receipt()));
        return settle(inFlightKey, Op.delete(inFlightKey, DeleteOption.DEFAULT), "ack " + claimed.receipt());
    }

    @Override
    public boolean retry(ClaimedTask claimed, Task next) throws BrokerException {
        if (next.getEnqueuedAt() == null) {
            next.setEnqueuedAt(clock.instant());
        }
        ByteSequence inFlightKey = bytes(pathResolver.getInFlightPath(claimed.queueName(), claimed.receipt()));
        return settle(inFlightKey,
                Op.delete(inFlightKey, DeleteOption.DEFAULT),
                Op.put(bytes(readyKey(next)), bytes(toJson(next)), PutOption.DEFAULT),
                "retry " + claimed.receipt());
    }

    @Override
    public boolean release(ClaimedTask claimed) throws BrokerException {
        Task task = claimed.task().toBuilder().notBefore(null).build();
        ByteSequence inFlightKey = bytes(pathResolver.getInFlightPath(claimed.queueName(), claimed.receipt()));
        return settle(inFlightKey,
                Op.delete(inFlightKey, DeleteOption.DEFAULT),
                Op.put(bytes(readyKey(task)), bytes(toJson(task)), PutOption.DEFAULT),
                "release " + claimed.receipt());
    }

    @Override
    public boolean deadLetter(ClaimedTask claimed, DeadLetterRecord record) throws BrokerException {
        ByteSequence inFlightKey = bytes(pathResolver.getInFlightPath(claimed.queueName(), claimed.receipt()));
        String deadLetterKey = pathResolver.getDeadLetterPath(claimed.queueName(), record.getTask().getId());
        return settle(inFlightKey,
                Op.delete(inFlightKey, DeleteOption.DEFAULT),
                Op.put(bytes(deadLetterKey), bytes(toJson(record)), PutOption.DEFAULT),
                "dead-letter " + claimed.receipt());
    }

    @Override
    public List<DeadLetterRecord> listDeadLetters(String queueName) throws BrokerException {
        String prefix = pathResolver.getDeadLetterPrefix(queueName);
        GetResponse response = await(kvClient.get(bytes(prefix),
                GetOption.newBuilder().withPrefix(bytes(prefix)).build()), "list dead letters " + queueName);
        List<DeadLetterRecord> records = new ArrayList<>();
        for (KeyValue kv : response.getKvs()) {
            records.add(fromJson(kv.getValue().toString(UTF_8), DeadLetterRecord.class));
        }
        return records;
    }

    @Override
    public Optional<Task> replayDeadLetter(String queueName, String taskId) throws BrokerException {
        ByteSequence deadLetterKey = bytes(pathResolver.getDeadLetterPath(queueName, taskId));
        GetResponse response = await(kvClient.get(deadLetterKey), "get dead letter " + taskId);
        if (response.getKvs().isEmpty()) {
            return Optional.empty();
        }
        KeyValue kv = response.getKvs().get(0);
        DeadLetterRecord record = fromJson(kv.getValue().toString(UTF_8), DeadLetterRecord.class);
        Task replayed = record.getTask().toBuilder()
                .attemptCount(0)
                .notBefore(null)
                .enqueuedAt(clock.instant())
                .build();
        TxnResponse txn = await(kvClient.txn()
                .If(new Cmp(deadLetterKey, Cmp.Op.EQUAL, CmpTarget.modRevision(kv.getModRevision())))
                .Then(Op.delete(deadLetterKey, DeleteOption.DEFAULT),
                      Op.put(bytes(readyKey(replayed)), bytes(toJson(replayed)), PutOption.DEFAULT))
                .commit(), "replay " + taskId);
        return txn.isSucceeded() ? Optional.of(replayed) : Optional.empty();
    }

    @Override
    public long depth(String queueName) throws BrokerException {
        String prefix = pathResolver.getReadyPrefix(queueName);
        GetResponse response = await(kvClient.get(bytes(prefix),
                GetOption.newBuilder().withPrefix(bytes(prefix)).withCountOnly(true).build()), "depth " + queueName);
        return response.getCount();
    }

    @Override
    public void close() {
        log.info("[Broker: {}] Closing etcd connection", id);
        etcdClient.close();
    }

    /**
     * Walks the whole in-flight range a page at a time, moving entries whose deadline has passed
     * back to the ready set.
     */
    private void reclaimExpired(String queueName, Instant now) throws BrokerException {
        String prefix = pathResolver.getInFlightPrefix(queueName);
        ByteSequence rangeEnd = bytes(prefixEnd(prefix));
        ByteSequence from = bytes(prefix);
        while (true) {
            GetOption page = GetOption.newBuilder()
                    .withRange(rangeEnd)
                    .withSortField(GetOption.SortTarget.KEY)
                    .withSortOrder(GetOption.SortOrder.ASCEND)
                    .withLimit(REAP_BATCH)
                    .build();
            GetResponse response = await(kvClient.get(from, page), "scan in-flight " + queueName);
            List<KeyValue> kvs = response.getKvs();
            for (KeyValue kv : kvs) {
                reclaimIfExpired(kv, now);
            }
            if (!response.isMore() || kvs.isEmpty()) {
                return;
            }
            from = kvs.get(kvs.size() - 1).getKey().concat(KEY_SUCCESSOR);
        }
    }

    private void reclaimIfExpired(KeyValue kv, Instant now) throws BrokerException {
        InFlightEntry entry = fromJson(kv.getValue().toString(UTF_8), InFlightEntry.class);
        if (entry.getDeadlineMillis() > now.toEpochMilli()) {
            return;
        }
        Task task = entry.getTask();
        task.setNotBefore(null);
        TxnResponse txn = await(kvClient.txn()
                .If(new Cmp(kv.getKey(), Cmp.Op.EQUAL, CmpTarget.modRevision(kv.getModRevision())))
                .Then(Op.delete(kv.getKey(), DeleteOption.DEFAULT),
                      Op.put(bytes(readyKey(task)), bytes(toJson(task)), PutOption.DEFAULT))
                .commit(), "reclaim " + task.getId());
        if (txn.isSucceeded()) {
            log.warn("[Broker: {}] Visibility timeout expired for task {}, redelivering", id, task.getId());
        }
    }

    // Prefixes end in '/', so bumping the last character gives the exclusive end of the range
    static String prefixEnd(String prefix) {
        char last = prefix.charAt(prefix.length() - 1);
        return prefix.substring(0, prefix.length() - 1) + (char) (last + 1);
    }

    private boolean settle(ByteSequence inFlightKey, Op op, String action) throws BrokerException {
        return settle(inFlightKey, op, null, action);
    }

    private boolean settle(ByteSequence inFlightKey, Op first, Op second, String action) throws BrokerException {
        Op[] ops = second == null ? new Op[]{first} : new Op[]{first, second};
        TxnResponse txn = await(kvClient.txn()
                .If(new Cmp(inFlightKey, Cmp.Op.GREATER, CmpTarget.version(0)))
                .Then(ops)
                .commit(), action);
        if (!txn.isSucceeded()) {
            log.debug("[Broker: {}] {} skipped, receipt no longer valid", id, action);
        }
        return txn.isSucceeded();
    }

    private String readyKey(Task task) {
        Instant readyAt = task.getNotBefore() != null ? task.getNotBefore() : clock.instant();
        return pathResolver.getReadyPath(task.getQueueName(), readyAt.toEpochMilli(), task.getId());
    }

    private <T> T await(CompletableFuture<T> future, String action) throws BrokerException {
        try {
            return future.get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException("[Broker: " + id + "] interrupted during " + action, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new BrokerException("[Broker: " + id + "] failed to " + action + ": " + e.getMessage(), e);
        }
    }

    private String toJson(Object value) throws BrokerException {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BrokerException("[Broker: " + id + "] cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) throws BrokerException {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new BrokerException("[Broker: " + id + "] cannot parse " + type.getSimpleName(), e);
        }
    }

    private static ByteSequence bytes(String value) {
        return ByteSequence.from(value, UTF_8);
    }

    /**
     * Stored value of an in-flight key.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class InFlightEntry {
        private Task task;
        private long deadlineMillis;
    }
}
