package io.stackcontroller;

import io.stackcontroller.broker.BrokerEndpoints;
import io.stackcontroller.config.StackControllerConfig;
import io.stackcontroller.config.Topology;
import io.stackcontroller.health.HealthProbeFactory;
import io.stackcontroller.launcher.ServiceLauncher;
import io.stackcontroller.orchestration.DependencyCycleException;
import io.stackcontroller.orchestration.DependencyGraph;
import io.stackcontroller.orchestration.NodeStateRegistry;
import io.stackcontroller.orchestration.ServiceOrchestrator;
import io.stackcontroller.orchestration.UnsatisfiableDependencyException;
import io.stackcontroller.tier.TierManager;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.function.IntConsumer;

import static io.stackcontroller.config.Constants.*;

/**
 * Brings the stack up once the web context is ready: validates the dependency graph, starts
 * the orchestrator and lets the tier manager start workers and beats as their requirements
 * turn healthy. Fatal startup outcomes are turned into process exit codes.
 */
@Slf4j
public class StackRunner implements ApplicationRunner, ExitCodeGenerator {

    private final StackControllerConfig config;
    private final Topology topology;
    private final NodeStateRegistry registry;
    private final ServiceLauncher launcher;
    private final HealthProbeFactory probeFactory;
    private final TierManager tierManager;
    private final BrokerEndpoints brokerEndpoints;
    private final IntConsumer terminator;

    private volatile ServiceOrchestrator orchestrator;
    private volatile int exitCode = EXIT_OK;
    private volatile boolean shuttingDown;

    public StackRunner(StackControllerConfig config,
                       Topology topology,
                       NodeStateRegistry registry,
                       ServiceLauncher launcher,
                       HealthProbeFactory probeFactory,
                       TierManager tierManager,
                       BrokerEndpoints brokerEndpoints,
                       IntConsumer terminator) {
        this.config = config;
        this.topology = topology;
        this.registry = registry;
        this.launcher = launcher;
        this.probeFactory = probeFactory;
        this.tierManager = tierManager;
        this.brokerEndpoints = brokerEndpoints;
        this.terminator = terminator;
    }

    @Override
    public void run(ApplicationArguments args) {
        DependencyGraph graph;
        try {
            graph = DependencyGraph.build(topology.nodes());
        } catch (DependencyCycleException e) {
            log.error("Refusing to start profile {}: {}", topology.profile(), e.getMessage());
            fail(EXIT_DEPENDENCY_CYCLE);
            return;
        } catch (IllegalArgumentException e) {
            log.error("Invalid topology for profile {}: {}", topology.profile(), e.getMessage());
            fail(EXIT_STARTUP_FAILURE);
            return;
        }

        log.info("Starting profile {} with {} nodes and {} tiers", topology.profile(), graph.getNodeNames().size(),
                tierManager.getTiers().size());
        orchestrator = new ServiceOrchestrator(graph, registry, launcher, probeFactory, config.getOrchestratorSettings());
        tierManager.attach();
        orchestrator.start().whenComplete((ignored, error) -> {
            if (error == null) {
                log.info("Profile {} is up", topology.profile());
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (shuttingDown || cause instanceof CancellationException) {
                // An interrupted startup is a clean stop, not a startup failure.
                log.info("Startup of profile {} interrupted by shutdown", topology.profile());
                return;
            }
            if (cause instanceof UnsatisfiableDependencyException unsatisfiable) {
                log.error("Startup halted on node {}: {}", unsatisfiable.getNodeName(), unsatisfiable.getMessage());
                fail(EXIT_UNSATISFIABLE_DEPENDENCY);
            } else {
                log.error("Startup failed: {}", cause.getMessage(), cause);
                fail(EXIT_STARTUP_FAILURE);
            }
        });
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public boolean isHalted() {
        ServiceOrchestrator current = orchestrator;
        return current != null && current.isHalted();
    }

    public ServiceOrchestrator getOrchestrator() {
        return orchestrator;
    }

    /**
     * Stop tiers first so no worker touches a backing service that is going away, then the nodes.
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        log.info("Shutting down stack");
        tierManager.stopAll();
        ServiceOrchestrator current = orchestrator;
        if (current != null && !current.shutdown(config.getOrchestratorSettings().getShutdownGrace())) {
            log.warn("Some nodes had to be force-stopped");
        }
        brokerEndpoints.close();
    }

    private void fail(int code) {
        exitCode = code;
        terminator.accept(code);
    }
}
