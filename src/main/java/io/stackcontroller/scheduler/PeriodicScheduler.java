package io.stackcontroller.scheduler;

import com.google.common.util.concurrent.AtomicDouble;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.stackcontroller.broker.BrokerException;
import io.stackcontroller.lease.LeaseException;
import io.stackcontroller.lease.LeaseStore;
import io.stackcontroller.metrics.MetricsProvider;
import io.stackcontroller.models.ScheduledTask;
import io.stackcontroller.models.Task;
import io.stackcontroller.worker.TaskPublisher;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.stackcontroller.config.Constants.*;
import static io.stackcontroller.metrics.MetricsConstants.*;

/**
 * Beat for one tier: enqueues every {@link ScheduledTask} at its fire times.
 *
 * Only the holder of the tier's leader lease fires. On top of that each fire time is claimed
 * under its own lease key before the task is published, so two instances that both believe
 * they lead during a handover still publish a given fire time once. A new leader computes
 * fire times from the current clock; firings missed while nobody led are not backfilled.
 */
@Slf4j
public class PeriodicScheduler {

    private final String tierId;
    private final String instanceId;
    private final List<ScheduledTask> tasks;
    private final Map<String, Schedule> schedules = new LinkedHashMap<>();
    private final TaskPublisher publisher;
    private final LeaseStore leaseStore;
    private final SchedulerSettings settings;
    private final MetricsProvider metricsProvider;
    private final Clock clock;
    private final AtomicDouble leaderGauge;

    private final Map<String, Instant> nextFire = new LinkedHashMap<>();
    private boolean leader = false;
    private ScheduledExecutorService executor;

    public PeriodicScheduler(String tierId,
                             String instanceId,
                             List<ScheduledTask> tasks,
                             TaskPublisher publisher,
                             LeaseStore leaseStore,
                             SchedulerSettings settings,
                             MetricsProvider metricsProvider,
                             Clock clock) {
        this.tierId = tierId;
        this.instanceId = instanceId;
        this.tasks = List.copyOf(tasks);
        this.publisher = publisher;
        this.leaseStore = leaseStore;
        this.settings = settings;
        this.metricsProvider = metricsProvider;
        this.clock = clock;
        for (ScheduledTask task : this.tasks) {
            if (schedules.put(task.getName(), Schedule.of(task)) != null) {
                throw new IllegalArgumentException("[Tier: " + tierId + "] duplicate schedule entry " + task.getName());
            }
        }
        this.leaderGauge = metricsProvider.gauge(SCHEDULER_LEADER_METRIC_NAME, Map.of(TIER_TAG, tierId));
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        log.info("[Tier: {}] Starting scheduler {} with {} entries", tierId, instanceId, tasks.size());
        executor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("beat-" + tierId + "-%d").setDaemon(true).build());
        executor.scheduleAtFixedRate(this::safeTick, 0, settings.getTickInterval().toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop ticking and give up the leader lease so another instance can take over at once.
     */
    public void stop() {
        ScheduledExecutorService running;
        synchronized (this) {
            running = executor;
            executor = null;
        }
        if (running == null) {
            return;
        }
        log.info("[Tier: {}] Stopping scheduler {}", tierId, instanceId);
        running.shutdown();
        try {
            if (!running.awaitTermination(settings.getTickInterval().toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                running.shutdownNow();
            }
        } catch (InterruptedException e) {
            running.shutdownNow();
            Thread.currentThread().interrupt();
        }
        resign();
    }

    /**
     * One scheduling round: take or renew the leader lease, then publish every due entry.
     *
     * @return number of tasks this instance published
     */
    public synchronized int tick() {
        Instant now = clock.instant();
        if (!holdLeadership()) {
            return 0;
        }
        if (nextFire.isEmpty() && !tasks.isEmpty()) {
            for (ScheduledTask task : tasks) {
                nextFire.put(task.getName(), schedules.get(task.getName()).next(now));
            }
            log.info("[Tier: {}] Scheduler {} is leader, next fire times {}", tierId, instanceId, nextFire);
        }

        int fired = 0;
        for (ScheduledTask task : tasks) {
            Instant due = nextFire.get(task.getName());
            if (now.isBefore(due)) {
                continue;
            }
            FireResult result = fire(task, due);
            if (result == FireResult.RETRY) {
                continue;
            }
            if (result == FireResult.PUBLISHED) {
                fired++;
            }
            nextFire.put(task.getName(), schedules.get(task.getName()).next(now));
        }
        return fired;
    }

    public synchronized boolean isLeader() {
        return leader;
    }

    public synchronized Map<String, Instant> getNextFireTimes() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(nextFire));
    }

    public String getTierId() {
        return tierId;
    }

    private boolean holdLeadership() {
        boolean held;
        try {
            held = leaseStore.tryAcquireLease(leaderKey(), instanceId, settings.getLeaseTtl());
        } catch (LeaseException e) {
            log.warn("[Tier: {}] Cannot reach lease store, abstaining: {}", tierId, e.getMessage());
            held = false;
        }
        if (held != leader) {
            if (held) {
                log.info("[Tier: {}] Scheduler {} acquired the leader lease", tierId, instanceId);
            } else {
                log.info("[Tier: {}] Scheduler {} lost the leader lease", tierId, instanceId);
                nextFire.clear();
            }
            leader = held;
            leaderGauge.set(held ? 1 : 0);
        }
        return held;
    }

    private FireResult fire(ScheduledTask task, Instant due) {
        String claimKey = fireClaimKey(task, due);
        try {
            if (!leaseStore.tryAcquireLease(claimKey, instanceId, settings.getFireClaimTtl())) {
                log.info("[Tier: {}] {} at {} already fired elsewhere", tierId, task.getName(), due);
                return FireResult.SKIPPED;
            }
        } catch (LeaseException e) {
            log.warn("[Tier: {}] Cannot claim {} at {}, will retry: {}", tierId, task.getName(), due, e.getMessage());
            return FireResult.RETRY;
        }

        Map<String, Object> payload = new LinkedHashMap<>(task.getPayloadTemplate());
        payload.put(PAYLOAD_SCHEDULE_ENTRY, task.getName());
        payload.put(PAYLOAD_SCHEDULED_FOR, due.toString());
        Task scheduled = Task.create(task.getTaskName(), task.getTargetQueue(), payload, task.getMaxAttempts());
        try {
            publisher.publish(scheduled);
        } catch (BrokerException e) {
            log.error("[Tier: {}] Failed to publish {} for {}: {}", tierId, task.getTaskName(), due, e.getMessage(), e);
            releaseQuietly(claimKey);
            return FireResult.RETRY;
        }
        metricsProvider.counter(SCHEDULE_FIRES_METRIC_NAME, Map.of(TIER_TAG, tierId, ENTRY_TAG, task.getName())).increment();
        log.info("[Tier: {}] Fired {} ({}) for {}", tierId, task.getName(), task.getTaskName(), due);
        return FireResult.PUBLISHED;
    }

    private void releaseQuietly(String key) {
        try {
            leaseStore.releaseLease(key, instanceId);
        } catch (LeaseException e) {
            log.warn("[Tier: {}] Failed to release claim {}: {}", tierId, key, e.getMessage());
        }
    }

    private synchronized void resign() {
        if (leader) {
            releaseQuietly(leaderKey());
            leader = false;
            leaderGauge.set(0);
            nextFire.clear();
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("[Tier: {}] Error in scheduler tick: {}", tierId, e.getMessage(), e);
        }
    }

    private String leaderKey() {
        return tierId + PATH_DELIMITER + LEASE_SCHEDULER_LEADER;
    }

    private String fireClaimKey(ScheduledTask task, Instant due) {
        return tierId + PATH_DELIMITER + LEASE_SCHEDULER_FIRED + PATH_DELIMITER + task.getName()
                + PATH_DELIMITER + due.toEpochMilli();
    }

    private enum FireResult {
        PUBLISHED,
        SKIPPED,
        RETRY
    }
}
