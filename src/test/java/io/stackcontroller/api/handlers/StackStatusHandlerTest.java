package io.stackcontroller.api.handlers;

import io.stackcontroller.StackRunner;
import io.stackcontroller.api.models.responses.DeadLetterResponse;
import io.stackcontroller.api.models.responses.ErrorResponse;
import io.stackcontroller.api.models.responses.NodeStatusResponse;
import io.stackcontroller.api.models.responses.ReplayResponse;
import io.stackcontroller.api.models.responses.TierStatusResponse;
import io.stackcontroller.broker.BrokerEndpoint;
import io.stackcontroller.broker.BrokerException;
import io.stackcontroller.broker.ClaimedTask;
import io.stackcontroller.broker.InMemoryBrokerEndpoint;
import io.stackcontroller.config.Topology;
import io.stackcontroller.models.DeadLetterRecord;
import io.stackcontroller.models.Task;
import io.stackcontroller.orchestration.NodeStateRegistry;
import io.stackcontroller.orchestration.NodeStateRegistryTestSupport;
import io.stackcontroller.tier.Tier;
import io.stackcontroller.tier.TierManager;
import io.stackcontroller.worker.WorkerPool;
import io.stackcontroller.worker.WorkerPoolStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StackStatusHandlerTest {

    private NodeStateRegistry registry;
    private InMemoryBrokerEndpoint endpoint;
    private WorkerPool pool;
    private StackRunner runner;
    private StackStatusHandler handler;

    @BeforeEach
    void setUp() {
        registry = new NodeStateRegistry();
        NodeStateRegistryTestSupport.register(registry, "db", "entities");
        NodeStateRegistryTestSupport.markHealthy(registry, "db");

        endpoint = new InMemoryBrokerEndpoint("entities-broker");
        pool = mock(WorkerPool.class);
        when(pool.getQueueNames()).thenReturn(List.of("default", "car_parsing_queue"));
        when(pool.getStatus()).thenReturn(new WorkerPoolStatus("entities", "entities-broker", true, 1,
                Map.of("default", 4L), Map.of("SUCCEEDED", 3L)));
        runner = mock(StackRunner.class);
        handler = new StackStatusHandler(registry, manager(endpoint), new Topology("dev", List.of(), Map.of()), runner);
    }

    private TierManager manager(BrokerEndpoint brokerEndpoint) {
        Tier tier = Tier.builder()
                .id("entities")
                .brokerEndpoint(brokerEndpoint)
                .workerPool(pool)
                .requirements(List.of("db"))
                .build();
        return new TierManager(registry, List.of(tier));
    }

    private Task deadLetter(String queue) throws BrokerException {
        Task task = Task.create("tasks.task.update_car_bids", queue, Map.of("car_id", 7), 3);
        endpoint.enqueue(task);
        ClaimedTask claimed = endpoint.claim(queue, Duration.ofSeconds(30)).orElseThrow();
        endpoint.deadLetter(claimed, DeadLetterRecord.builder()
                .brokerEndpointId(endpoint.getId())
                .task(claimed.task())
                .error("upstream returned 500")
                .deadLetteredAt(Instant.now())
                .build());
        return task;
    }

    @Test
    void testGetNodes_ReportsStatesAndHaltFlag() {
        when(runner.isHalted()).thenReturn(true);

        ResponseEntity<Object> response = handler.getNodes();

        NodeStatusResponse body = (NodeStatusResponse) response.getBody();
        assertThat(body.getProfile()).isEqualTo("dev");
        assertThat(body.isHalted()).isTrue();
        assertThat(body.getNodes()).extracting(NodeStatusResponse.NodeEntry::getName).contains("db", "entities");
        assertThat(body.getNodes()).filteredOn(node -> node.getName().equals("db"))
                .extracting(NodeStatusResponse.NodeEntry::getState).containsExactly("HEALTHY");
    }

    @Test
    void testGetTiers_ReportsQueueDepthsAndPoolStatus() throws Exception {
        // Given
        endpoint.enqueue(Task.create("tasks.task.update_fees", "car_parsing_queue", Map.of(), 3));

        // When
        ResponseEntity<Object> response = handler.getTiers();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        TierStatusResponse.TierEntry entry = ((TierStatusResponse) response.getBody()).getTiers().get(0);
        assertThat(entry.getId()).isEqualTo("entities");
        assertThat(entry.getBrokerEndpointId()).isEqualTo("entities-broker");
        assertThat(entry.getQueueDepths()).containsEntry("car_parsing_queue", 1L).containsEntry("default", 0L);
        assertThat(entry.isWorkersRunning()).isTrue();
        assertThat(entry.getInFlight()).isEqualTo(1);
        assertThat(entry.getSchedulerLeader()).isNull();
    }

    @Test
    void testGetTiers_BrokerUnreachableIsServiceUnavailable() throws Exception {
        BrokerEndpoint broken = mock(BrokerEndpoint.class);
        when(broken.getId()).thenReturn("entities-broker");
        when(broken.depth(any())).thenThrow(new BrokerException("connection refused"));
        handler = new StackStatusHandler(registry, manager(broken), new Topology("dev", List.of(), Map.of()), runner);

        ResponseEntity<Object> response = handler.getTiers();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void testGetDeadLetters_ListsAcrossBoundQueues() throws Exception {
        // Given
        deadLetter("default");
        deadLetter("car_parsing_queue");

        // When
        ResponseEntity<Object> all = handler.getDeadLetters("entities", null);
        ResponseEntity<Object> one = handler.getDeadLetters("entities", "default");

        // Then
        assertThat(((DeadLetterResponse) all.getBody()).getCount()).isEqualTo(2);
        assertThat(((DeadLetterResponse) one.getBody()).getDeadLetters())
                .extracting(record -> record.getTask().getQueueName()).containsExactly("default");
    }

    @Test
    void testGetDeadLetters_UnknownTierOrQueue() {
        assertThat(handler.getDeadLetters("parsers", null).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(handler.getDeadLetters("entities", "parser_queue").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void testReplayDeadLetter_RequeuesTask() throws Exception {
        // Given
        Task task = deadLetter("car_parsing_queue");

        // When
        ResponseEntity<Object> response = handler.replayDeadLetter("entities", task.getId(), "car_parsing_queue");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((ReplayResponse) response.getBody()).getTaskId()).isEqualTo(task.getId());
        assertThat(endpoint.depth("car_parsing_queue")).isEqualTo(1);
        assertThat(endpoint.listDeadLetters("car_parsing_queue")).isEmpty();
    }

    @Test
    void testReplayDeadLetter_MissingTaskIsNotFound() {
        ResponseEntity<Object> response = handler.replayDeadLetter("entities", "missing", "default");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void testReplayDeadLetter_QueueOfAnotherTierIsBadRequest() {
        ResponseEntity<Object> response = handler.replayDeadLetter("entities", "task-1", "parser_queue");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(((ErrorResponse) response.getBody()).getReason()).contains("not bound");
    }
}
