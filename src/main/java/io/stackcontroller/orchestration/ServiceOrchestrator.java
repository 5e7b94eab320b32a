package io.stackcontroller.orchestration;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.stackcontroller.enums.NodeState;
import io.stackcontroller.enums.RestartPolicy;
import io.stackcontroller.health.HealthMonitor;
import io.stackcontroller.health.HealthProbeFactory;
import io.stackcontroller.launcher.ServiceHandle;
import io.stackcontroller.launcher.ServiceLauncher;
import io.stackcontroller.models.Dependency;
import io.stackcontroller.models.ServiceNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Executes the start plan for a dependency graph.
 *
 * All decisions (gating, state transitions, restart policy) run on one event-loop thread, so
 * the registry only ever sees one writer. Launches, probes and timers run on a shared I/O
 * scheduler and post their results back to the loop, which lets independent branches of the
 * graph start and probe concurrently.
 *
 * The returned plan future completes once every node has been ready at least once (healthy,
 * or exited cleanly under restart policy {@code none}), and fails with
 * {@link UnsatisfiableDependencyException} when a node fails without a restart policy or the
 * startup budget expires.
 */
@Slf4j
public class ServiceOrchestrator {

    private final DependencyGraph graph;
    private final NodeStateRegistry registry;
    private final ServiceLauncher launcher;
    private final HealthProbeFactory probeFactory;
    private final OrchestratorSettings settings;
    private final Clock clock;

    private final ExecutorService eventLoop;
    private final ScheduledExecutorService ioScheduler;

    // Only touched on the event loop
    private final Map<String, NodeRuntime> runtimes = new HashMap<>();

    private final CompletableFuture<Void> plan = new CompletableFuture<>();
    private volatile boolean started;
    private volatile boolean halted;
    private volatile boolean shuttingDown;
    private ScheduledFuture<?> budgetTimer;

    public ServiceOrchestrator(DependencyGraph graph,
                               NodeStateRegistry registry,
                               ServiceLauncher launcher,
                               HealthProbeFactory probeFactory,
                               OrchestratorSettings settings) {
        this(graph, registry, launcher, probeFactory, settings, Clock.systemUTC());
    }

    public ServiceOrchestrator(DependencyGraph graph,
                               NodeStateRegistry registry,
                               ServiceLauncher launcher,
                               HealthProbeFactory probeFactory,
                               OrchestratorSettings settings,
                               Clock clock) {
        this.graph = graph;
        this.registry = registry;
        this.launcher = launcher;
        this.probeFactory = probeFactory;
        this.settings = settings;
        this.clock = clock;
        this.eventLoop = Executors.newSingleThreadExecutor(namedThreads("orchestrator-loop"));
        this.ioScheduler = Executors.newScheduledThreadPool(settings.getIoThreads(), namedThreads("orchestrator-io"));
        for (ServiceNode node : graph.getNodes()) {
            runtimes.put(node.getName(), new NodeRuntime(node));
        }
    }

    /**
     * Register every node as PENDING and begin starting nodes whose dependencies are met.
     *
     * @return future completing when the whole plan is ready
     */
    public synchronized CompletableFuture<Void> start() {
        if (started) {
            return plan;
        }
        started = true;
        log.info("Starting plan for {} nodes, order: {}", graph.getNodeNames().size(), graph.getLayers());
        registry.register(graph.getNodeNames());
        budgetTimer = ioScheduler.schedule(() -> post(this::onBudgetExpired),
                settings.getStartupBudget().toMillis(), TimeUnit.MILLISECONDS);
        post(this::evaluate);
        return plan;
    }

    public CompletableFuture<Void> getPlan() {
        return plan;
    }

    public boolean isHalted() {
        return halted;
    }

    /**
     * Cooperative shutdown in reverse start order: each layer of the graph is asked to stop and
     * waited for before the layer it depends on, so a dependent never outlives its dependency.
     * Stragglers are force-terminated once the shared {@code grace} deadline has passed. All
     * nodes end in STOPPED.
     *
     * @return true if every node stopped within the grace period
     */
    public boolean shutdown(Duration grace) {
        if (shuttingDown) {
            return true;
        }
        shuttingDown = true;
        log.info("Shutting down orchestrator, grace period {}ms", grace.toMillis());

        Map<String, ServiceHandle> handles = callOnLoop(() -> {
            Map<String, ServiceHandle> result = new HashMap<>();
            for (NodeRuntime runtime : runtimes.values()) {
                runtime.generation++;
                cancelProbe(runtime);
                if (runtime.handle != null) {
                    result.put(runtime.node.getName(), runtime.handle);
                }
            }
            return result;
        });

        long deadline = System.nanoTime() + grace.toNanos();
        boolean graceful = true;
        List<List<String>> layers = new ArrayList<>(graph.getLayers());
        Collections.reverse(layers);
        for (List<String> layer : layers) {
            Map<String, ServiceHandle> layerHandles = new LinkedHashMap<>();
            for (String name : layer) {
                ServiceHandle handle = handles.get(name);
                if (handle != null) {
                    layerHandles.put(name, handle);
                }
            }
            if (!layerHandles.isEmpty()) {
                log.debug("Stopping layer {}", layerHandles.keySet());
                layerHandles.values().forEach(ServiceHandle::requestStop);
                Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
                if (!awaitExit(layerHandles, remaining)) {
                    graceful = false;
                }
            }
            markStopped(layer);
        }

        if (budgetTimer != null) {
            budgetTimer.cancel(false);
        }
        if (!plan.isDone()) {
            plan.cancel(false);
        }
        ioScheduler.shutdownNow();
        eventLoop.shutdown();
        try {
            if (!eventLoop.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                eventLoop.shutdownNow();
            }
        } catch (InterruptedException e) {
            eventLoop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Orchestrator stopped ({})", graceful ? "graceful" : "forced");
        return graceful;
    }

    private void markStopped(List<String> layer) {
        callOnLoop(() -> {
            for (String name : layer) {
                NodeState state = registry.getState(name);
                if (state != null && state != NodeState.STOPPED) {
                    registry.transition(name, NodeState.STOPPED);
                }
            }
            return null;
        });
    }

    private boolean awaitExit(Map<String, ServiceHandle> handles, Duration grace) {
        CompletableFuture<?>[] exits = handles.values().stream()
                .map(ServiceHandle::onExit)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(exits).get(grace.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException | ExecutionException e) {
            List<String> stragglers = handles.entrySet().stream()
                    .filter(entry -> entry.getValue().isAlive())
                    .map(Map.Entry::getKey)
                    .sorted()
                    .collect(Collectors.toList());
            log.warn("Force-terminating nodes that did not stop within {}ms: {}", grace.toMillis(), stragglers);
            handles.values().stream().filter(ServiceHandle::isAlive).forEach(ServiceHandle::forceStop);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handles.values().forEach(ServiceHandle::forceStop);
            return false;
        }
    }

    // ---- event loop ----

    private void evaluate() {
        if (halted || shuttingDown) {
            return;
        }
        Instant now = clock.instant();
        for (String name : graph.getStartOrder()) {
            NodeRuntime runtime = runtimes.get(name);
            if (registry.getState(name) != NodeState.PENDING) {
                continue;
            }
            if (runtime.notBefore != null && now.isBefore(runtime.notBefore)) {
                continue;
            }
            if (dependenciesSatisfied(runtime.node)) {
                startNode(runtime);
            }
        }
        checkPlanComplete();
    }

    private boolean dependenciesSatisfied(ServiceNode node) {
        for (Dependency dependency : node.getDependencies()) {
            NodeState state = registry.getState(dependency.nodeName());
            if (state == null || !dependency.condition().isSatisfiedBy(state)) {
                return false;
            }
        }
        return true;
    }

    private void startNode(NodeRuntime runtime) {
        String name = runtime.node.getName();
        registry.transition(name, NodeState.STARTING);
        int generation = ++runtime.generation;
        runtime.notBefore = null;
        submitIo(() -> {
            try {
                ServiceHandle handle = launcher.start(runtime.node);
                post(() -> onLaunched(runtime, generation, handle));
            } catch (Exception e) {
                post(() -> onLaunchFailed(runtime, generation, e));
            }
        });
    }

    private void onLaunched(NodeRuntime runtime, int generation, ServiceHandle handle) {
        if (generation != runtime.generation || shuttingDown) {
            handle.stop(settings.getShutdownGrace());
            return;
        }
        String name = runtime.node.getName();
        runtime.handle = handle;
        handle.onExit().thenAccept(code -> post(() -> onExit(runtime, generation, code)));

        if (!runtime.node.hasHealthCheck()) {
            registry.transition(name, NodeState.HEALTHY);
            markReady(runtime);
        } else {
            registry.transition(name, NodeState.PROBING);
            runtime.monitor = new HealthMonitor(name, runtime.node.getHealthCheck(),
                    probeFactory.create(runtime.node.getHealthCheck()));
            scheduleProbe(runtime, generation, runtime.node.getHealthCheck().getStartPeriod());
        }
        evaluate();
    }

    private void onLaunchFailed(NodeRuntime runtime, int generation, Exception error) {
        if (generation != runtime.generation || shuttingDown) {
            return;
        }
        String message = "start command failed: " + error.getMessage();
        log.error("[Node: {}] {}", runtime.node.getName(), message);
        registry.recordProbeError(runtime.node.getName(), message);
        onFailed(runtime, message);
        evaluate();
    }

    private void scheduleProbe(NodeRuntime runtime, int generation, Duration delay) {
        HealthMonitor monitor = runtime.monitor;
        runtime.probe = scheduleIo(() -> {
            HealthMonitor.Verdict verdict = monitor.probeOnce();
            String error = monitor.getLastError();
            post(() -> onProbeResult(runtime, generation, verdict, error));
        }, delay);
    }

    private void onProbeResult(NodeRuntime runtime, int generation, HealthMonitor.Verdict verdict, String error) {
        if (generation != runtime.generation || shuttingDown) {
            return;
        }
        String name = runtime.node.getName();
        if (verdict != HealthMonitor.Verdict.HEALTHY && error != null) {
            registry.recordProbeError(name, error);
        }
        NodeState state = registry.getState(name);
        switch (state) {
            case PROBING:
                if (verdict == HealthMonitor.Verdict.HEALTHY) {
                    registry.transition(name, NodeState.HEALTHY);
                    markReady(runtime);
                } else if (verdict == HealthMonitor.Verdict.UNHEALTHY) {
                    onFailed(runtime, "health check failed " + runtime.node.getHealthCheck().getRetries()
                            + " consecutive times: " + error);
                }
                break;
            case HEALTHY:
                if (verdict == HealthMonitor.Verdict.UNHEALTHY) {
                    onFailed(runtime, "health check failed " + runtime.node.getHealthCheck().getRetries()
                            + " consecutive times after being healthy: " + error);
                }
                break;
            case FAILED:
                if (verdict == HealthMonitor.Verdict.HEALTHY) {
                    log.info("[Node: {}] Recovered, health check passing again", name);
                    registry.transition(name, NodeState.HEALTHY);
                }
                break;
            default:
                return;
        }
        NodeState after = registry.getState(name);
        if (generation == runtime.generation
                && (after == NodeState.PROBING || after == NodeState.HEALTHY || after == NodeState.FAILED)) {
            scheduleProbe(runtime, generation, runtime.node.getHealthCheck().getInterval());
        }
        evaluate();
    }

    private void onExit(NodeRuntime runtime, int generation, int exitCode) {
        if (generation != runtime.generation || shuttingDown) {
            return;
        }
        String name = runtime.node.getName();
        NodeState state = registry.getState(name);
        if (state == NodeState.STOPPED || state == NodeState.PENDING) {
            return;
        }
        RestartPolicy policy = runtime.node.getRestartPolicy();
        if (policy == RestartPolicy.NONE && exitCode == 0) {
            log.info("[Node: {}] Process completed with exit code 0", name);
            runtime.generation++;
            cancelProbe(runtime);
            registry.transition(name, NodeState.STOPPED);
            markReady(runtime);
            evaluate();
            return;
        }
        String message = "process exited with code " + exitCode;
        registry.recordProbeError(name, message);
        if (policy == RestartPolicy.NONE && runtime.everHealthy()) {
            log.error("[Node: {}] {}, restart policy none, node stays down", name, message);
            runtime.generation++;
            cancelProbe(runtime);
            if (state != NodeState.FAILED) {
                registry.transition(name, NodeState.FAILED);
            }
            registry.transition(name, NodeState.STOPPED);
            evaluate();
            return;
        }
        if (state != NodeState.FAILED) {
            onFailed(runtime, message);
        } else {
            applyRestartPolicy(runtime, message);
        }
        evaluate();
    }

    private void onFailed(NodeRuntime runtime, String reason) {
        String name = runtime.node.getName();
        registry.transition(name, NodeState.FAILED);
        applyRestartPolicy(runtime, reason);
    }

    private void applyRestartPolicy(NodeRuntime runtime, String reason) {
        String name = runtime.node.getName();
        if (runtime.node.getRestartPolicy() == RestartPolicy.ALWAYS) {
            int restart = registry.getStatus(name).map(NodeStatus::restarts).orElse(0) + 1;
            Duration backoff = settings.restartBackoff(restart);
            log.warn("[Node: {}] Failed ({}), restart #{} in {}ms", name, reason, restart, backoff.toMillis());
            invalidateAndStop(runtime);
            registry.transition(name, NodeState.PENDING);
            runtime.notBefore = clock.instant().plus(backoff);
            scheduleIo(() -> post(this::evaluate), backoff);
        } else if (!runtime.everHealthy()) {
            invalidateAndStop(runtime);
            registry.transition(name, NodeState.STOPPED);
            String lastError = registry.getStatus(name).map(NodeStatus::lastProbeError).orElse(null);
            halt(new UnsatisfiableDependencyException(name, lastError,
                    "Node '" + name + "' failed before becoming healthy and has restart policy none: " + reason));
        } else {
            log.error("[Node: {}] Failed ({}), restart policy none, withholding traffic until it recovers", name, reason);
        }
    }

    private void invalidateAndStop(NodeRuntime runtime) {
        runtime.generation++;
        cancelProbe(runtime);
        ServiceHandle handle = runtime.handle;
        runtime.handle = null;
        if (handle != null) {
            submitIo(() -> handle.stop(settings.getShutdownGrace()));
        }
    }

    private void markReady(NodeRuntime runtime) {
        runtime.ready = true;
        checkPlanComplete();
    }

    private void checkPlanComplete() {
        if (plan.isDone()) {
            return;
        }
        boolean allReady = runtimes.values().stream().allMatch(runtime -> runtime.ready);
        if (allReady) {
            log.info("Start plan complete, all {} nodes ready", runtimes.size());
            if (budgetTimer != null) {
                budgetTimer.cancel(false);
            }
            plan.complete(null);
        }
    }

    private void onBudgetExpired() {
        if (plan.isDone() || shuttingDown) {
            return;
        }
        String blocking = findBlockingNode();
        NodeStatus status = registry.getStatus(blocking).orElse(null);
        String lastError = status != null ? status.lastProbeError() : null;
        List<String> waiting = graph.getStartOrder().stream()
                .filter(name -> registry.getState(name) == NodeState.PENDING && !name.equals(blocking))
                .collect(Collectors.toList());
        halt(new UnsatisfiableDependencyException(blocking, lastError, String.format(
                "Start plan did not complete within %dms: node '%s' is %s (last probe error: %s), still pending: %s",
                settings.getStartupBudget().toMillis(), blocking,
                status != null ? status.state() : "UNKNOWN", lastError, waiting)));
    }

    /**
     * First node in start order that is not ready although everything it depends on is.
     */
    private String findBlockingNode() {
        List<String> notReady = new ArrayList<>();
        for (String name : graph.getStartOrder()) {
            NodeRuntime runtime = runtimes.get(name);
            if (runtime.ready) {
                continue;
            }
            notReady.add(name);
            boolean dependenciesReady = runtime.node.getDependencies().stream()
                    .allMatch(dependency -> runtimes.get(dependency.nodeName()).ready);
            if (dependenciesReady) {
                return name;
            }
        }
        return notReady.isEmpty() ? null : notReady.get(0);
    }

    private void halt(UnsatisfiableDependencyException error) {
        halted = true;
        log.error("Start plan halted: {}", error.getMessage());
        plan.completeExceptionally(error);
    }

    private void cancelProbe(NodeRuntime runtime) {
        if (runtime.probe != null) {
            runtime.probe.cancel(false);
            runtime.probe = null;
        }
    }

    // ---- plumbing ----

    private void post(Runnable action) {
        try {
            eventLoop.execute(() -> {
                try {
                    action.run();
                } catch (Exception e) {
                    log.error("Orchestrator event failed: {}", e.getMessage(), e);
                    if (!plan.isDone()) {
                        plan.completeExceptionally(e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Orchestrator event dropped after shutdown");
        }
    }

    private <T> T callOnLoop(Callable<T> action) {
        try {
            return eventLoop.submit(action).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for orchestrator loop", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Orchestrator loop action failed", e.getCause());
        }
    }

    private void submitIo(Runnable action) {
        try {
            ioScheduler.execute(action);
        } catch (RejectedExecutionException e) {
            log.debug("I/O task dropped after shutdown");
        }
    }

    private ScheduledFuture<?> scheduleIo(Runnable action, Duration delay) {
        try {
            return ioScheduler.schedule(action, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Timer dropped after shutdown");
            return null;
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        return new ThreadFactoryBuilder().setNameFormat(prefix + "-%d").setDaemon(true).build();
    }

    private final class NodeRuntime {
        private final ServiceNode node;
        private ServiceHandle handle;
        private HealthMonitor monitor;
        private ScheduledFuture<?> probe;
        private int generation;
        private Instant notBefore;
        private boolean ready;

        private NodeRuntime(ServiceNode node) {
            this.node = node;
        }

        private boolean everHealthy() {
            return registry.getStatus(node.getName()).map(NodeStatus::everHealthy).orElse(false);
        }
    }
}
