package io.stackcontroller.api.handlers;

import io.stackcontroller.StackRunner;
import io.stackcontroller.api.models.responses.DeadLetterResponse;
import io.stackcontroller.api.models.responses.ErrorResponse;
import io.stackcontroller.api.models.responses.NodeStatusResponse;
import io.stackcontroller.api.models.responses.ReplayResponse;
import io.stackcontroller.api.models.responses.TierStatusResponse;
import io.stackcontroller.broker.BrokerEndpoint;
import io.stackcontroller.broker.BrokerException;
import io.stackcontroller.config.Topology;
import io.stackcontroller.models.DeadLetterRecord;
import io.stackcontroller.models.Task;
import io.stackcontroller.orchestration.NodeStateRegistry;
import io.stackcontroller.scheduler.PeriodicScheduler;
import io.stackcontroller.tier.Tier;
import io.stackcontroller.tier.TierManager;
import io.stackcontroller.worker.WorkerPoolStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API handler for inspecting the running stack.
 *
 * Supported operations:
 * - GET /_stack/nodes - node states as seen by the orchestrator
 * - GET /_stack/tiers - worker, scheduler and queue status per tier
 * - GET /_stack/tiers/{tier}/dead-letters[?queue=name] - dead-lettered tasks of a tier
 * - POST /_stack/tiers/{tier}/dead-letters/{taskId}/replay?queue=name - re-enqueue one
 */
@Slf4j
@RestController
@RequestMapping("/_stack")
public class StackStatusHandler {

    private final NodeStateRegistry registry;
    private final TierManager tierManager;
    private final Topology topology;
    private final StackRunner runner;

    public StackStatusHandler(NodeStateRegistry registry, TierManager tierManager, Topology topology, StackRunner runner) {
        this.registry = registry;
        this.tierManager = tierManager;
        this.topology = topology;
        this.runner = runner;
    }

    @GetMapping("/nodes")
    public ResponseEntity<Object> getNodes() {
        return ResponseEntity.ok(NodeStatusResponse.from(topology.profile(), runner.isHalted(), registry.snapshot()));
    }

    @GetMapping("/tiers")
    public ResponseEntity<Object> getTiers() {
        try {
            List<TierStatusResponse.TierEntry> entries = new ArrayList<>();
            for (Tier tier : tierManager.getTiers()) {
                entries.add(describe(tier));
            }
            return ResponseEntity.ok(TierStatusResponse.builder().tiers(entries).build());
        } catch (BrokerException e) {
            log.error("Error reading tier status: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.upstreamUnreachable("broker", e.getMessage()));
        }
    }

    @GetMapping("/tiers/{tierId}/dead-letters")
    public ResponseEntity<Object> getDeadLetters(@PathVariable String tierId,
                                                 @RequestParam(required = false) String queue) {
        Optional<Tier> tier = tierManager.getTier(tierId);
        if (tier.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Tier " + tierId));
        }
        List<String> queues = tier.get().getWorkerPool().getQueueNames();
        if (queue != null && !queues.contains(queue)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Queue " + queue + " of tier " + tierId));
        }
        try {
            List<DeadLetterRecord> records = new ArrayList<>();
            for (String name : queue != null ? List.of(queue) : queues) {
                records.addAll(tier.get().getBrokerEndpoint().listDeadLetters(name));
            }
            return ResponseEntity.ok(DeadLetterResponse.of(tierId, records));
        } catch (BrokerException e) {
            log.error("[Tier: {}] Error listing dead letters: {}", tierId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ErrorResponse.upstreamUnreachable(tier.get().getBrokerEndpoint().getId(), e.getMessage()));
        }
    }

    @PostMapping("/tiers/{tierId}/dead-letters/{taskId}/replay")
    public ResponseEntity<Object> replayDeadLetter(@PathVariable String tierId,
                                                   @PathVariable String taskId,
                                                   @RequestParam String queue) {
        Optional<Tier> tier = tierManager.getTier(tierId);
        if (tier.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Tier " + tierId));
        }
        if (!tier.get().getWorkerPool().getQueueNames().contains(queue)) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ErrorResponse.badRequest("Queue " + queue + " is not bound to tier " + tierId));
        }
        BrokerEndpoint endpoint = tier.get().getBrokerEndpoint();
        try {
            Optional<Task> replayed = endpoint.replayDeadLetter(queue, taskId);
            if (replayed.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorResponse.notFound("Dead letter " + taskId + " in " + queue));
            }
            log.info("[Tier: {}] Replayed dead letter {} into {}", tierId, taskId, queue);
            return ResponseEntity.ok(ReplayResponse.success(taskId, queue));
        } catch (BrokerException e) {
            log.error("[Tier: {}] Error replaying {}: {}", tierId, taskId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ErrorResponse.upstreamUnreachable(endpoint.getId(), e.getMessage()));
        }
    }

    private TierStatusResponse.TierEntry describe(Tier tier) throws BrokerException {
        WorkerPoolStatus pool = tier.getWorkerPool().getStatus();
        Map<String, Long> depths = new LinkedHashMap<>();
        for (String queue : tier.getWorkerPool().getQueueNames()) {
            depths.put(queue, tier.getBrokerEndpoint().depth(queue));
        }
        TierStatusResponse.TierEntry.TierEntryBuilder entry = TierStatusResponse.TierEntry.builder()
                .id(tier.getId())
                .brokerEndpointId(pool.brokerEndpointId())
                .requirements(tier.getRequirements())
                .started(tier.isStarted())
                .workersRunning(pool.running())
                .inFlight(pool.inFlight())
                .queueDepths(depths)
                .claimedPerQueue(pool.claimedPerQueue())
                .outcomes(pool.outcomes());
        PeriodicScheduler scheduler = tier.getScheduler();
        if (scheduler != null) {
            Map<String, String> nextFire = new LinkedHashMap<>();
            scheduler.getNextFireTimes().forEach((name, at) -> nextFire.put(name, at.toString()));
            entry.schedulerLeader(scheduler.isLeader()).nextFireTimes(nextFire);
        }
        return entry.build();
    }
}
