package io.stackcontroller.tier;

import io.stackcontroller.broker.BrokerEndpoint;
import io.stackcontroller.broker.EtcdBrokerEndpoint;
import io.stackcontroller.broker.InMemoryBrokerEndpoint;
import io.stackcontroller.config.TierDefinition;
import io.stackcontroller.lease.LeaseStore;
import io.stackcontroller.lease.SingleFlightLock;
import io.stackcontroller.metrics.MetricsProvider;
import io.stackcontroller.models.QueueBinding;
import io.stackcontroller.scheduler.PeriodicScheduler;
import io.stackcontroller.worker.TaskContext;
import io.stackcontroller.worker.TaskHandlerRegistry;
import io.stackcontroller.worker.TaskPublisher;
import io.stackcontroller.worker.TaskRoutes;
import io.stackcontroller.worker.WorkerPool;
import io.stackcontroller.worker.handlers.BuiltinTaskHandlers;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static io.stackcontroller.config.Constants.*;

/**
 * Wires a {@link Tier} from its definition. Every tier gets a broker endpoint of its own;
 * etcd-backed endpoints open their own client connection.
 */
@Slf4j
public class TierAssembler {

    private final String instanceId;
    private final LeaseStore leaseStore;
    private final MetricsProvider metricsProvider;
    private final Clock clock;

    public TierAssembler(String instanceId, LeaseStore leaseStore, MetricsProvider metricsProvider, Clock clock) {
        this.instanceId = instanceId;
        this.leaseStore = leaseStore;
        this.metricsProvider = metricsProvider;
        this.clock = clock;
    }

    public BrokerEndpoint createEndpoint(TierDefinition definition) {
        String type = definition.getBrokerType();
        if (BACKEND_ETCD.equalsIgnoreCase(type)) {
            log.info("[Tier: {}] Connecting broker {} to etcd {} under {}", definition.getId(), definition.getBrokerId(),
                    definition.getBrokerEndpoints(), definition.getBrokerNamespace());
            return EtcdBrokerEndpoint.connect(definition.getBrokerId(),
                    definition.getBrokerEndpoints().toArray(new String[0]), definition.getBrokerNamespace());
        }
        if (BACKEND_MEMORY.equalsIgnoreCase(type)) {
            return new InMemoryBrokerEndpoint(definition.getBrokerId(), clock);
        }
        throw new IllegalArgumentException("[Tier: " + definition.getId() + "] unknown broker type: " + type);
    }

    public Tier assemble(TierDefinition definition, BrokerEndpoint endpoint, List<String> requirements,
                         TaskHandlerRegistry handlers) {
        TaskRoutes routes = new TaskRoutes(definition.getDefaultQueue(), definition.getRoutes());
        for (String queue : routes.getRoutes().values()) {
            if (!definition.getQueues().contains(queue)) {
                log.warn("[Tier: {}] Route target {} has no worker binding, its tasks will wait", definition.getId(), queue);
            }
        }
        TaskPublisher publisher = new TaskPublisher(endpoint, routes, definition.getMaxAttempts(), clock);
        TaskContext context = new TaskContext(definition.getId(), endpoint.getId(), publisher, new SingleFlightLock(leaseStore));

        List<QueueBinding> bindings = new ArrayList<>();
        for (String queue : definition.getQueues()) {
            bindings.add(QueueBinding.of(endpoint.getId(), queue));
        }
        WorkerPool pool = new WorkerPool(definition.getId(), endpoint, bindings,
                BuiltinTaskHandlers.registerDefaults(handlers), context, definition.getWorkerSettings(),
                metricsProvider, clock);

        PeriodicScheduler scheduler = null;
        if (definition.isSchedulerEnabled() && !definition.getSchedule().isEmpty()) {
            scheduler = new PeriodicScheduler(definition.getId(), instanceId, definition.getSchedule(), publisher,
                    leaseStore, definition.getSchedulerSettings(), metricsProvider, clock);
        }

        return Tier.builder()
                .id(definition.getId())
                .brokerEndpoint(endpoint)
                .publisher(publisher)
                .workerPool(pool)
                .scheduler(scheduler)
                .requirements(List.copyOf(requirements))
                .build();
    }
}
