package io.stackcontroller.scheduler;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.stackcontroller.broker.BrokerEndpoint;
import io.stackcontroller.broker.BrokerException;
import io.stackcontroller.broker.ClaimedTask;
import io.stackcontroller.broker.InMemoryBrokerEndpoint;
import io.stackcontroller.lease.InMemoryLeaseStore;
import io.stackcontroller.lease.LeaseException;
import io.stackcontroller.lease.LeaseStore;
import io.stackcontroller.metrics.MetricsProvider;
import io.stackcontroller.models.ScheduledTask;
import io.stackcontroller.models.Task;
import io.stackcontroller.support.TestClock;
import io.stackcontroller.worker.TaskPublisher;
import io.stackcontroller.worker.TaskRoutes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PeriodicSchedulerTest {

    private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");
    private static final String QUEUE = "default";

    private TestClock clock;
    private InMemoryLeaseStore leaseStore;
    private InMemoryBrokerEndpoint endpoint;
    private TaskPublisher publisher;
    private MetricsProvider metricsProvider;
    private SchedulerSettings settings;

    @BeforeEach
    void setUp() {
        clock = new TestClock(START);
        leaseStore = new InMemoryLeaseStore(clock);
        endpoint = new InMemoryBrokerEndpoint("parsers-broker", clock);
        publisher = new TaskPublisher(endpoint, new TaskRoutes(QUEUE, Map.of()), 3, clock);
        metricsProvider = new MetricsProvider(new SimpleMeterRegistry(), "test-instance");
        settings = SchedulerSettings.builder()
                .leaseTtl(Duration.ofSeconds(30))
                .tickInterval(Duration.ofSeconds(1))
                .fireClaimTtl(Duration.ofMinutes(10))
                .build();
    }

    private static ScheduledTask everyMinute() {
        return ScheduledTask.builder()
                .name("fetch-api-data-every-minute")
                .taskName("tasks.tasks.fetch_api_data")
                .interval(Duration.ofMinutes(1))
                .targetQueue(QUEUE)
                .payloadTemplate(Map.of("source", "api"))
                .build();
    }

    private PeriodicScheduler scheduler(String instanceId, LeaseStore store, TaskPublisher taskPublisher) {
        return new PeriodicScheduler("parsers", instanceId, List.of(everyMinute()), taskPublisher, store, settings,
                metricsProvider, clock);
    }

    /**
     * Tick every scheduler once per second over [fromSecond, toSecond] and return the tasks published.
     */
    private int run(int fromSecond, int toSecond, PeriodicScheduler... schedulers) {
        int fired = 0;
        for (int second = fromSecond; second <= toSecond; second++) {
            clock.set(START.plusSeconds(second));
            for (PeriodicScheduler scheduler : schedulers) {
                fired += scheduler.tick();
            }
        }
        return fired;
    }

    @Test
    void testTick_FiresOncePerIntervalOverTenMinutes() throws Exception {
        // Given
        PeriodicScheduler scheduler = scheduler("beat-a", leaseStore, publisher);

        // When
        int fired = run(0, 600, scheduler);

        // Then
        assertThat(fired).isEqualTo(10);
        assertThat(endpoint.depth(QUEUE)).isEqualTo(10);
        assertThat(scheduler.isLeader()).isTrue();
        assertThat(scheduler.getNextFireTimes()).containsEntry("fetch-api-data-every-minute", START.plusSeconds(660));
    }

    @Test
    void testTick_PublishedTaskCarriesScheduleMetadata() throws Exception {
        PeriodicScheduler scheduler = scheduler("beat-a", leaseStore, publisher);

        run(0, 60, scheduler);

        ClaimedTask claimed = endpoint.claim(QUEUE, Duration.ofSeconds(30)).orElseThrow();
        assertThat(claimed.task().getName()).isEqualTo("tasks.tasks.fetch_api_data");
        assertThat(claimed.task().getPayload())
                .containsEntry("source", "api")
                .containsEntry("schedule_entry", "fetch-api-data-every-minute")
                .containsEntry("scheduled_for", "2024-03-01T12:01:00Z");
    }

    @Test
    void testTwoInstances_OnlyLeaderFires() {
        // Given
        PeriodicScheduler first = scheduler("beat-a", leaseStore, publisher);
        PeriodicScheduler second = scheduler("beat-b", leaseStore, publisher);

        // When
        int fired = run(0, 600, first, second);

        // Then
        assertThat(fired).isEqualTo(10);
        assertThat(first.isLeader()).isTrue();
        assertThat(second.isLeader()).isFalse();
    }

    @Test
    void testTwoInstancesBothBelievingTheyLead_FireTimeClaimedOnce() throws Exception {
        // Given a lease store that hands out the leader lease to everyone
        LeaseStore splitBrain = new InMemoryLeaseStore(clock) {
            @Override
            public synchronized boolean tryAcquireLease(String key, String holder, Duration ttl) {
                if (key.endsWith("beat-leader")) {
                    return true;
                }
                return super.tryAcquireLease(key, holder, ttl);
            }
        };
        PeriodicScheduler first = scheduler("beat-a", splitBrain, publisher);
        PeriodicScheduler second = scheduler("beat-b", splitBrain, publisher);

        // When
        int fired = run(0, 600, first, second);

        // Then
        assertThat(first.isLeader()).isTrue();
        assertThat(second.isLeader()).isTrue();
        assertThat(fired).isEqualTo(10);
        assertThat(endpoint.depth(QUEUE)).isEqualTo(10);
    }

    @Test
    void testHandover_NewLeaderDoesNotBackfillMissedFires() throws Exception {
        // Given the leader fires at 60s, then stops ticking after 90s without resigning
        PeriodicScheduler first = scheduler("beat-a", leaseStore, publisher);
        PeriodicScheduler second = scheduler("beat-b", leaseStore, publisher);
        assertThat(run(0, 90, first, second)).isEqualTo(1);

        // When the follower keeps ticking; the lease renewed at 90s lapses at 120s
        int fired = run(91, 300, second);

        // Then 120s is missed and not replayed; 180s, 240s and 300s fire
        assertThat(second.isLeader()).isTrue();
        assertThat(fired).isEqualTo(3);
        assertThat(endpoint.depth(QUEUE)).isEqualTo(4);
    }

    @Test
    void testStop_ResignsLeadershipForImmediateHandover() throws Exception {
        // Given
        PeriodicScheduler first = scheduler("beat-a", leaseStore, publisher);
        PeriodicScheduler second = scheduler("beat-b", leaseStore, publisher);
        run(0, 10, first, second);
        assertThat(first.isLeader()).isTrue();

        // When
        first.start();
        first.stop();
        clock.set(START.plusSeconds(11));
        second.tick();

        // Then
        assertThat(first.isLeader()).isFalse();
        assertThat(second.isLeader()).isTrue();
        assertThat(leaseStore.getHolder("parsers/beat-leader")).contains("beat-b");
    }

    @Test
    void testPublishFailure_RetriedOnNextTick() throws Exception {
        // Given a broker that fails once
        BrokerEndpoint flaky = mock(BrokerEndpoint.class);
        when(flaky.getId()).thenReturn("parsers-broker");
        doThrow(new BrokerException("broker unreachable")).doNothing().when(flaky).enqueue(any(Task.class));
        TaskPublisher flakyPublisher = new TaskPublisher(flaky, new TaskRoutes(QUEUE, Map.of()), 3, clock);
        PeriodicScheduler scheduler = scheduler("beat-a", leaseStore, flakyPublisher);

        // When
        int atDue = run(0, 60, scheduler);
        int afterRetry = run(61, 61, scheduler);

        // Then the fire at 60s is published on the following tick for the same fire time
        assertThat(atDue).isZero();
        assertThat(afterRetry).isEqualTo(1);
        ArgumentCaptor<Task> published = ArgumentCaptor.forClass(Task.class);
        verify(flaky, times(2)).enqueue(published.capture());
        assertThat(published.getAllValues().get(1).getPayload()).containsEntry("scheduled_for", "2024-03-01T12:01:00Z");
        assertThat(scheduler.getNextFireTimes()).containsEntry("fetch-api-data-every-minute", START.plusSeconds(120));
    }

    @Test
    void testLeaseStoreUnreachable_Abstains() throws Exception {
        LeaseStore unreachable = mock(LeaseStore.class);
        when(unreachable.tryAcquireLease(anyString(), anyString(), any())).thenThrow(new LeaseException("etcd down"));
        PeriodicScheduler scheduler = scheduler("beat-a", unreachable, publisher);

        assertThat(run(0, 120, scheduler)).isZero();
        assertThat(scheduler.isLeader()).isFalse();
        assertThat(endpoint.depth(QUEUE)).isZero();
    }

    @Test
    void testDuplicateEntryNames_Rejected() {
        assertThatThrownBy(() -> new PeriodicScheduler("parsers", "beat-a", List.of(everyMinute(), everyMinute()),
                publisher, leaseStore, settings, metricsProvider, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fetch-api-data-every-minute");
    }
}
