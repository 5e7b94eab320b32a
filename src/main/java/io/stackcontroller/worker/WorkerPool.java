package io.stackcontroller.worker;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.stackcontroller.broker.BrokerEndpoint;
import io.stackcontroller.broker.BrokerException;
import io.stackcontroller.broker.ClaimedTask;
import io.stackcontroller.enums.TaskOutcome;
import io.stackcontroller.metrics.MetricsProvider;
import io.stackcontroller.models.DeadLetterRecord;
import io.stackcontroller.models.QueueBinding;
import io.stackcontroller.models.Task;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static io.stackcontroller.metrics.MetricsConstants.*;

/**
 * Concurrent consumers bound to named queues on exactly one broker endpoint.
 *
 * Every bound queue has its own concurrency limit, so handlers busy on one queue never hold
 * the capacity another queue's tasks need. A single claim thread sweeps the queues round-robin,
 * starting after the queue that last produced a task, and only claims from a queue with a free
 * slot. A task is settled once: by its handler thread, or by {@link #stop()} when the handler
 * did not finish within the grace period.
 */
@Slf4j
public class WorkerPool {

    private final String tierId;
    private final BrokerEndpoint endpoint;
    private final List<QueueBinding> bindings;
    private final TaskHandlerRegistry handlers;
    private final TaskContext context;
    private final WorkerPoolSettings settings;
    private final MetricsProvider metricsProvider;
    private final Clock clock;

    private final Map<String, Semaphore> permits = new LinkedHashMap<>();
    private final int workerThreads;
    private final Map<String, ClaimedTask> inFlight = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> claimedPerQueue = new LinkedHashMap<>();
    private final Map<TaskOutcome, AtomicLong> outcomes = new EnumMap<>(TaskOutcome.class);

    private volatile boolean running = false;
    private ExecutorService claimLoop;
    private ExecutorService handlerExecutor;
    private int cursor = 0;

    public WorkerPool(String tierId,
                      BrokerEndpoint endpoint,
                      List<QueueBinding> bindings,
                      TaskHandlerRegistry handlers,
                      TaskContext context,
                      WorkerPoolSettings settings,
                      MetricsProvider metricsProvider,
                      Clock clock) {
        if (bindings == null || bindings.isEmpty()) {
            throw new IllegalArgumentException("[Tier: " + tierId + "] worker pool needs at least one queue binding");
        }
        for (QueueBinding binding : bindings) {
            if (!endpoint.getId().equals(binding.brokerEndpointId())) {
                throw new IllegalArgumentException("[Tier: " + tierId + "] queue " + binding.queueName()
                        + " is bound to broker " + binding.brokerEndpointId()
                        + " but the pool consumes from " + endpoint.getId());
            }
        }
        this.tierId = tierId;
        this.endpoint = endpoint;
        this.bindings = List.copyOf(bindings);
        this.handlers = handlers;
        this.context = context;
        this.settings = settings;
        this.metricsProvider = metricsProvider;
        this.clock = clock;
        int threads = 0;
        for (QueueBinding binding : this.bindings) {
            int limit = settings.concurrencyFor(binding.queueName());
            if (limit < 1) {
                throw new IllegalArgumentException("[Tier: " + tierId + "] concurrency of queue "
                        + binding.queueName() + " must be >= 1");
            }
            permits.put(binding.queueName(), new Semaphore(limit));
            claimedPerQueue.put(binding.queueName(), new AtomicLong());
            threads += limit;
        }
        this.workerThreads = threads;
        for (TaskOutcome outcome : TaskOutcome.values()) {
            outcomes.put(outcome, new AtomicLong());
        }
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        log.info("[Pool: {}] Starting {} workers on broker {} for queues {}", tierId, workerThreads,
                endpoint.getId(), describeLimits());
        running = true;
        handlerExecutor = Executors.newFixedThreadPool(workerThreads,
                new ThreadFactoryBuilder().setNameFormat("worker-" + tierId + "-%d").setDaemon(true).build());
        claimLoop = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("claim-" + tierId + "-%d").setDaemon(true).build());
        claimLoop.execute(this::claimLoop);
    }

    /**
     * Stop claiming, give running handlers the grace period, then interrupt them and hand any
     * task still in flight back to the broker.
     */
    public void stop() {
        ExecutorService loop;
        ExecutorService executor;
        synchronized (this) {
            if (!running) {
                return;
            }
            log.info("[Pool: {}] Stopping, {} tasks in flight", tierId, inFlight.size());
            running = false;
            loop = claimLoop;
            executor = handlerExecutor;
        }
        loop.shutdownNow();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(settings.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Pool: {}] Handlers still running after {}, interrupting", tierId, settings.getShutdownGrace());
                executor.shutdownNow();
            }
            loop.awaitTermination(settings.getPollInterval().toMillis() + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        releaseAbandoned();
        log.info("[Pool: {}] Stopped", tierId);
    }

    public boolean isRunning() {
        return running;
    }

    public String getTierId() {
        return tierId;
    }

    public String getBrokerEndpointId() {
        return endpoint.getId();
    }

    public List<String> getQueueNames() {
        List<String> names = new ArrayList<>();
        for (QueueBinding binding : bindings) {
            names.add(binding.queueName());
        }
        return names;
    }

    public WorkerPoolStatus getStatus() {
        Map<String, Long> claimed = new LinkedHashMap<>();
        claimedPerQueue.forEach((queue, count) -> claimed.put(queue, count.get()));
        Map<String, Long> settled = new LinkedHashMap<>();
        outcomes.forEach((outcome, count) -> settled.put(outcome.name().toLowerCase(), count.get()));
        return new WorkerPoolStatus(tierId, endpoint.getId(), running, inFlight.size(), claimed, settled);
    }

    public long getOutcomeCount(TaskOutcome outcome) {
        return outcomes.get(outcome).get();
    }

    private void claimLoop() {
        while (running) {
            boolean dispatched = false;
            try {
                dispatched = claimNext();
            } catch (BrokerException e) {
                log.warn("[Pool: {}] Claim failed: {}", tierId, e.getMessage());
            }
            if (!dispatched && !pause()) {
                return;
            }
        }
    }

    /**
     * One round-robin sweep over the queues that have a free slot.
     *
     * @return true if a task was handed to a handler thread
     */
    private boolean claimNext() throws BrokerException {
        int size = bindings.size();
        for (int i = 0; i < size && running; i++) {
            int index = (cursor + i) % size;
            String queueName = bindings.get(index).queueName();
            Semaphore slots = permits.get(queueName);
            if (!slots.tryAcquire()) {
                continue;
            }
            boolean dispatched = false;
            try {
                Optional<ClaimedTask> claimed = endpoint.claim(queueName, settings.getVisibilityTimeout());
                if (claimed.isPresent()) {
                    cursor = (index + 1) % size;
                    claimedPerQueue.get(queueName).incrementAndGet();
                    dispatched = dispatch(claimed.get(), slots);
                    return dispatched;
                }
            } finally {
                if (!dispatched) {
                    slots.release();
                }
            }
        }
        return false;
    }

    private boolean dispatch(ClaimedTask claimed, Semaphore slots) throws BrokerException {
        inFlight.put(claimed.receipt(), claimed);
        metricsProvider.counter(TASKS_CLAIMED_METRIC_NAME, tags(claimed.queueName())).increment();
        try {
            handlerExecutor.execute(() -> {
                try {
                    execute(claimed);
                } finally {
                    slots.release();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            // pool is stopping
            if (inFlight.remove(claimed.receipt()) != null) {
                endpoint.release(claimed);
            }
            return false;
        }
    }

    private void execute(ClaimedTask claimed) {
        Task task = claimed.task();
        Optional<TaskHandler> handler = handlers.find(task.getName());
        if (handler.isEmpty()) {
            if (inFlight.remove(claimed.receipt()) != null) {
                deadLetter(claimed, task, "No handler registered for task " + task.getName());
            }
            return;
        }

        long startNanos = System.nanoTime();
        Exception failure = null;
        try {
            log.debug("[Pool: {}] Running {} ({}) attempt {}/{}", tierId, task.getName(), task.getId(),
                    task.getAttemptCount() + 1, task.getMaxAttempts());
            handler.get().handle(task, context);
        } catch (Exception e) {
            failure = e;
        }
        metricsProvider.timer(TASK_DURATION_METRIC_NAME, tags(claimed.queueName()))
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);

        if (inFlight.remove(claimed.receipt()) == null) {
            // abandoned by stop(), already released
            return;
        }
        if (failure == null) {
            settle(claimed, TaskOutcome.ACKNOWLEDGED, () -> endpoint.acknowledge(claimed));
        } else if (!running && failure instanceof InterruptedException) {
            settle(claimed, TaskOutcome.ABANDONED, () -> endpoint.release(claimed));
        } else {
            onFailure(claimed, failure);
        }
    }

    private void onFailure(ClaimedTask claimed, Exception failure) {
        Task task = claimed.task();
        String error = failure.getClass().getSimpleName() + ": " + failure.getMessage();
        if (task.isExhaustedAfterFailure()) {
            deadLetter(claimed, task.toBuilder().attemptCount(task.getAttemptCount() + 1).lastError(error).build(), error);
            return;
        }
        int attempt = task.getAttemptCount() + 1;
        Duration delay = task.getBackoffPolicy() != null ? task.getBackoffPolicy().delayFor(attempt) : Duration.ZERO;
        Task next = task.nextAttempt(error, clock.instant().plus(delay));
        log.warn("[Pool: {}] Task {} ({}) failed attempt {}/{}, retrying in {}ms: {}", tierId, task.getName(),
                task.getId(), attempt, task.getMaxAttempts(), delay.toMillis(), error);
        settle(claimed, TaskOutcome.RETRIED, () -> endpoint.retry(claimed, next));
    }

    private void deadLetter(ClaimedTask claimed, Task task, String error) {
        DeadLetterRecord record = DeadLetterRecord.builder()
                .brokerEndpointId(endpoint.getId())
                .task(task)
                .error(error)
                .deadLetteredAt(clock.instant())
                .build();
        log.error("[Pool: {}] Task {} ({}) dead-lettered after {} attempts: {}", tierId, task.getName(),
                task.getId(), task.getAttemptCount(), error);
        settle(claimed, TaskOutcome.DEAD_LETTERED, () -> endpoint.deadLetter(claimed, record));
    }

    private void settle(ClaimedTask claimed, TaskOutcome outcome, BrokerCall call) {
        try {
            if (call.run()) {
                outcomes.get(outcome).incrementAndGet();
                metricsProvider.counter(TASKS_COMPLETED_METRIC_NAME, outcomeTags(claimed.queueName(), outcome)).increment();
            } else {
                log.warn("[Pool: {}] Receipt for task {} expired before it was settled as {}", tierId,
                        claimed.task().getId(), outcome);
            }
        } catch (BrokerException e) {
            log.error("[Pool: {}] Failed to settle task {} as {}, it will be redelivered after its visibility timeout: {}",
                    tierId, claimed.task().getId(), outcome, e.getMessage(), e);
        }
    }

    private void releaseAbandoned() {
        for (String receipt : new ArrayList<>(inFlight.keySet())) {
            ClaimedTask claimed = inFlight.remove(receipt);
            if (claimed != null) {
                log.warn("[Pool: {}] Releasing unfinished task {} ({})", tierId, claimed.task().getName(), claimed.task().getId());
                settle(claimed, TaskOutcome.ABANDONED, () -> endpoint.release(claimed));
            }
        }
    }

    private Map<String, Integer> describeLimits() {
        Map<String, Integer> limits = new LinkedHashMap<>();
        for (QueueBinding binding : bindings) {
            limits.put(binding.queueName(), settings.concurrencyFor(binding.queueName()));
        }
        return limits;
    }

    private boolean pause() {
        try {
            Thread.sleep(settings.getPollInterval().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Map<String, String> tags(String queueName) {
        return Map.of(TIER_TAG, tierId, BROKER_TAG, endpoint.getId(), QUEUE_TAG, queueName);
    }

    private Map<String, String> outcomeTags(String queueName, TaskOutcome outcome) {
        return Map.of(TIER_TAG, tierId, BROKER_TAG, endpoint.getId(), QUEUE_TAG, queueName,
                OUTCOME_TAG, outcome.name().toLowerCase());
    }

    @FunctionalInterface
    private interface BrokerCall {
        boolean run() throws BrokerException;
    }
}
