package io.stackcontroller.config;

import io.stackcontroller.models.ScheduledTask;
import io.stackcontroller.orchestration.OrchestratorSettings;
import io.stackcontroller.proxy.ProxyTimeouts;
import io.stackcontroller.proxy.Route;
import io.stackcontroller.scheduler.SchedulerSettings;
import io.stackcontroller.util.EnvironmentUtils;
import io.stackcontroller.worker.WorkerPoolSettings;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static io.stackcontroller.config.Constants.*;

/**
 * Configuration for the stack controller.
 * Loads {@code stack-controller.yml} with fallbacks to constants. The file path can be
 * overridden with {@code STACK_CONFIG_FILE}; {@code ${NAME:-default}} references in string
 * values are expanded from the environment.
 */
@Slf4j
@Getter
public class StackControllerConfig {

    private final String profile;
    private final String topologyDir;
    private final String instanceId;
    private final OrchestratorSettings orchestratorSettings;
    private final String leaseType;
    private final String[] leaseEndpoints;
    private final String leaseNamespace;
    private final List<TierDefinition> tiers;
    private final List<Route> proxyRoutes;
    private final List<String> protectedPrefixes;
    private final String proxyUsername;
    private final String proxyPasswordSha256;
    private final ProxyTimeouts proxyTimeouts;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "stack-controller.yml";

    public StackControllerConfig() {
        this(loadYamlConfig(), System.getenv());
    }

    StackControllerConfig(ConfigModel config, Map<String, String> environment) {
        Stack stack = config.getStack() != null ? config.getStack() : new Stack();
        this.profile = EnvironmentUtils.getEnv(environment, ENV_PROFILE,
                nonBlank(expand(stack.getProfile(), environment), DEFAULT_PROFILE));
        this.topologyDir = expand(stack.getTopologyDir(), environment);
        this.instanceId = EnvironmentUtils.getEnv(environment, ENV_INSTANCE_ID,
                nonBlank(expand(stack.getInstanceId(), environment), defaultInstanceId()));
        this.orchestratorSettings = parseOrchestrator(config.getOrchestrator());

        Lease lease = config.getLease() != null ? config.getLease() : new Lease();
        this.leaseType = nonBlank(lease.getType(), BACKEND_MEMORY);
        this.leaseEndpoints = parseEndpoints(lease.getEndpoints(), environment);
        this.leaseNamespace = nonBlank(lease.getNamespace(), "/stack-controller");

        this.tiers = parseTiers(config.getTiers(), environment);

        Proxy proxy = config.getProxy() != null ? config.getProxy() : new Proxy();
        this.proxyRoutes = parseRoutes(proxy.getRoutes(), environment);
        this.protectedPrefixes = proxy.getProtectedPrefixes() != null ? List.copyOf(proxy.getProtectedPrefixes()) : List.of();
        this.proxyUsername = expand(proxy.getUsername(), environment);
        this.proxyPasswordSha256 = expand(proxy.getPasswordSha256(), environment);
        this.proxyTimeouts = parseTimeouts(proxy.getTimeouts());

        log.info("Loaded stack controller config - profile: {}, instance: {}, tiers: {}, lease store: {}",
                profile, instanceId, tiers.stream().map(TierDefinition::getId).toList(), leaseType);
    }

    /**
     * Parse configuration from a YAML stream; used for tests and tooling.
     */
    public static StackControllerConfig load(InputStream in, Map<String, String> environment) {
        ConfigModel model = newYaml().load(in);
        return new StackControllerConfig(model != null ? model : new ConfigModel(), environment);
    }

    private static Yaml newYaml() {
        return new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
    }

    private static ConfigModel loadYamlConfig() {
        Yaml yaml = newYaml();
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(ENV_CONFIG_FILE);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", ENV_CONFIG_FILE, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            }
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            inputStream = StackControllerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream; a broken file is fatal
        try (InputStream in = inputStream) {
            ConfigModel config = yaml.load(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration from " + loadedFrom, e);
        }
    }

    private OrchestratorSettings parseOrchestrator(Orchestrator orchestrator) {
        OrchestratorSettings.OrchestratorSettingsBuilder builder = OrchestratorSettings.builder()
                .startupBudget(Duration.ofSeconds(DEFAULT_STARTUP_BUDGET_SECONDS))
                .shutdownGrace(Duration.ofSeconds(DEFAULT_SHUTDOWN_GRACE_SECONDS))
                .restartInitialBackoff(Duration.ofMillis(DEFAULT_RESTART_INITIAL_BACKOFF_MILLIS))
                .restartMaxBackoff(Duration.ofMillis(DEFAULT_RESTART_MAX_BACKOFF_MILLIS));
        if (orchestrator == null) {
            return builder.build();
        }
        if (orchestrator.getStartupBudget() != null) {
            builder.startupBudget(TopologyLoader.duration(orchestrator.getStartupBudget()));
        }
        if (orchestrator.getShutdownGrace() != null) {
            builder.shutdownGrace(TopologyLoader.duration(orchestrator.getShutdownGrace()));
        }
        if (orchestrator.getRestartInitialBackoff() != null) {
            builder.restartInitialBackoff(TopologyLoader.duration(orchestrator.getRestartInitialBackoff()));
        }
        if (orchestrator.getRestartMaxBackoff() != null) {
            builder.restartMaxBackoff(TopologyLoader.duration(orchestrator.getRestartMaxBackoff()));
        }
        if (orchestrator.getIoThreads() != null) {
            builder.ioThreads(orchestrator.getIoThreads());
        }
        return builder.build();
    }

    private List<TierDefinition> parseTiers(List<Tier> tierModels, Map<String, String> environment) {
        List<TierDefinition> parsed = new ArrayList<>();
        if (tierModels == null) {
            return parsed;
        }
        for (Tier tier : tierModels) {
            if (tier.getId() == null || tier.getId().isBlank()) {
                throw new IllegalArgumentException("Every tier needs an id");
            }
            Broker broker = tier.getBroker() != null ? tier.getBroker() : new Broker();
            String defaultQueue = nonBlank(tier.getDefaultQueue(), DEFAULT_QUEUE);
            List<String> queues = tier.getQueues() != null && !tier.getQueues().isEmpty()
                    ? List.copyOf(tier.getQueues()) : List.of(defaultQueue);
            int maxAttempts = tier.getWorkers() != null && tier.getWorkers().getMaxAttempts() != null
                    ? tier.getWorkers().getMaxAttempts() : DEFAULT_MAX_ATTEMPTS;

            parsed.add(TierDefinition.builder()
                    .id(tier.getId())
                    .brokerId(nonBlank(broker.getId(), tier.getId() + "-broker"))
                    .brokerType(nonBlank(broker.getType(), BACKEND_MEMORY))
                    .brokerEndpoints(List.of(parseEndpoints(broker.getEndpoints(), environment)))
                    .brokerNamespace(nonBlank(broker.getNamespace(), "/" + tier.getId()))
                    .defaultQueue(defaultQueue)
                    .queues(queues)
                    .routes(tier.getRoutes() != null ? new LinkedHashMap<>(tier.getRoutes()) : new LinkedHashMap<>())
                    .workerSettings(parseWorkers(tier.getWorkers()))
                    .maxAttempts(maxAttempts)
                    .schedulerEnabled(tier.getScheduler() == null || tier.getScheduler().getEnabled() == null
                            || tier.getScheduler().getEnabled())
                    .schedulerSettings(parseScheduler(tier.getScheduler()))
                    .schedule(parseSchedule(tier, maxAttempts))
                    .build());
        }
        return parsed;
    }

    private WorkerPoolSettings parseWorkers(Workers workers) {
        WorkerPoolSettings.WorkerPoolSettingsBuilder builder = WorkerPoolSettings.builder();
        if (workers == null) {
            return builder.build();
        }
        if (workers.getConcurrency() != null) {
            builder.concurrency(workers.getConcurrency());
        }
        if (workers.getQueueConcurrency() != null) {
            builder.queueConcurrency(new LinkedHashMap<>(workers.getQueueConcurrency()));
        }
        if (workers.getVisibilityTimeout() != null) {
            builder.visibilityTimeout(TopologyLoader.duration(workers.getVisibilityTimeout()));
        }
        if (workers.getPollInterval() != null) {
            builder.pollInterval(TopologyLoader.duration(workers.getPollInterval()));
        }
        if (workers.getShutdownGrace() != null) {
            builder.shutdownGrace(TopologyLoader.duration(workers.getShutdownGrace()));
        }
        return builder.build();
    }

    private SchedulerSettings parseScheduler(Scheduler scheduler) {
        SchedulerSettings.SchedulerSettingsBuilder builder = SchedulerSettings.builder();
        if (scheduler == null) {
            return builder.build();
        }
        if (scheduler.getLeaseTtl() != null) {
            builder.leaseTtl(TopologyLoader.duration(scheduler.getLeaseTtl()));
        }
        if (scheduler.getTickInterval() != null) {
            builder.tickInterval(TopologyLoader.duration(scheduler.getTickInterval()));
        }
        if (scheduler.getFireClaimTtl() != null) {
            builder.fireClaimTtl(TopologyLoader.duration(scheduler.getFireClaimTtl()));
        }
        return builder.build();
    }

    private List<ScheduledTask> parseSchedule(Tier tier, int maxAttempts) {
        List<ScheduledTask> schedule = new ArrayList<>();
        if (tier.getScheduler() == null || tier.getScheduler().getTasks() == null) {
            return schedule;
        }
        for (Entry entry : tier.getScheduler().getTasks()) {
            ScheduledTask task = ScheduledTask.builder()
                    .name(entry.getName())
                    .taskName(nonBlank(entry.getTask(), entry.getName()))
                    .cronExpression(entry.getCron())
                    .interval(entry.getInterval() != null ? TopologyLoader.duration(entry.getInterval()) : null)
                    .targetQueue(entry.getQueue())
                    .payloadTemplate(entry.getPayload() != null ? new LinkedHashMap<>(entry.getPayload()) : new LinkedHashMap<>())
                    .maxAttempts(entry.getMaxAttempts() != null ? entry.getMaxAttempts() : maxAttempts)
                    .build();
            task.validate();
            schedule.add(task);
        }
        return schedule;
    }

    private List<Route> parseRoutes(List<ProxyRoute> routes, Map<String, String> environment) {
        List<Route> parsed = new ArrayList<>();
        if (routes == null) {
            return parsed;
        }
        for (ProxyRoute route : routes) {
            parsed.add(new Route(route.getPrefix(), route.getNode(), expand(route.getUrl(), environment)));
        }
        return parsed;
    }

    private ProxyTimeouts parseTimeouts(Timeouts timeouts) {
        ProxyTimeouts defaults = ProxyTimeouts.defaults();
        if (timeouts == null) {
            return defaults;
        }
        return new ProxyTimeouts(
                timeouts.getConnect() != null ? TopologyLoader.duration(timeouts.getConnect()) : defaults.connect(),
                timeouts.getSend() != null ? TopologyLoader.duration(timeouts.getSend()) : defaults.send(),
                timeouts.getRead() != null ? TopologyLoader.duration(timeouts.getRead()) : defaults.read());
    }

    private static String[] parseEndpoints(List<String> endpoints, Map<String, String> environment) {
        if (endpoints != null && !endpoints.isEmpty()) {
            return endpoints.stream().map(endpoint -> expand(endpoint, environment)).toArray(String[]::new);
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private static String expand(String value, Map<String, String> environment) {
        return EnvironmentUtils.expand(value, environment);
    }

    private static String nonBlank(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static String defaultInstanceId() {
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        } catch (UnknownHostException e) {
            return "stack-controller-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }

    /**
     * Configuration model for the stack-controller.yml file.
     */
    @Data
    public static class ConfigModel {
        private Stack stack;
        private Orchestrator orchestrator;
        private Lease lease;
        private List<Tier> tiers;
        private Proxy proxy;
    }

    @Data
    public static class Stack {
        private String profile;
        private String topologyDir;
        private String instanceId;
    }

    @Data
    public static class Orchestrator {
        private String startupBudget;
        private String shutdownGrace;
        private String restartInitialBackoff;
        private String restartMaxBackoff;
        private Integer ioThreads;
    }

    @Data
    public static class Lease {
        private String type;
        private List<String> endpoints;
        private String namespace;
    }

    @Data
    public static class Tier {
        private String id;
        private Broker broker;
        private String defaultQueue;
        private List<String> queues;
        private Map<String, String> routes;
        private Workers workers;
        private Scheduler scheduler;
    }

    @Data
    public static class Broker {
        private String id;
        private String type;
        private List<String> endpoints;
        private String namespace;
    }

    @Data
    public static class Workers {
        private Integer concurrency;
        private Map<String, Integer> queueConcurrency;
        private String visibilityTimeout;
        private String pollInterval;
        private String shutdownGrace;
        private Integer maxAttempts;
    }

    @Data
    public static class Scheduler {
        private Boolean enabled;
        private String leaseTtl;
        private String tickInterval;
        private String fireClaimTtl;
        private List<Entry> tasks;
    }

    @Data
    public static class Entry {
        private String name;
        private String task;
        private String cron;
        private String interval;
        private String queue;
        private Map<String, Object> payload;
        private Integer maxAttempts;
    }

    @Data
    public static class Proxy {
        private List<ProxyRoute> routes;
        private List<String> protectedPrefixes;
        private String username;
        private String passwordSha256;
        private Timeouts timeouts;
    }

    @Data
    public static class ProxyRoute {
        private String prefix;
        private String node;
        private String url;
    }

    @Data
    public static class Timeouts {
        private String connect;
        private String send;
        private String read;
    }
}
