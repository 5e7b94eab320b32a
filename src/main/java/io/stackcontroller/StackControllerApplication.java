package io.stackcontroller;

import io.micrometer.core.instrument.MeterRegistry;
import io.stackcontroller.broker.BrokerEndpoint;
import io.stackcontroller.broker.BrokerEndpoints;
import io.stackcontroller.config.StackControllerConfig;
import io.stackcontroller.config.TierDefinition;
import io.stackcontroller.config.Topology;
import io.stackcontroller.config.TopologyLoader;
import io.stackcontroller.health.HealthProbeFactory;
import io.stackcontroller.launcher.ProcessServiceLauncher;
import io.stackcontroller.launcher.ServiceLauncher;
import io.stackcontroller.lease.EtcdLeaseStore;
import io.stackcontroller.lease.InMemoryLeaseStore;
import io.stackcontroller.lease.LeaseStore;
import io.stackcontroller.metrics.MetricsProvider;
import io.stackcontroller.orchestration.NodeStateMetrics;
import io.stackcontroller.orchestration.NodeStateRegistry;
import io.stackcontroller.proxy.AuthGate;
import io.stackcontroller.proxy.HttpForwarder;
import io.stackcontroller.proxy.ReverseProxyRouter;
import io.stackcontroller.proxy.RouteTable;
import io.stackcontroller.tier.Tier;
import io.stackcontroller.tier.TierAssembler;
import io.stackcontroller.tier.TierManager;
import io.stackcontroller.worker.TaskHandlerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static io.stackcontroller.config.Constants.*;

/**
 * Main Spring Boot application class for the stack controller.
 *
 * Starts the backing services of one profile in dependency order, runs each tier's workers and
 * beat against that tier's own broker endpoint, and serves the reverse proxy in front of the
 * two application tiers.
 */
@Slf4j
@SpringBootApplication
public class StackControllerApplication {

    public static void main(String[] args) {
        log.info("Starting Stack Controller");

        try {
            SpringApplication.run(StackControllerApplication.class, args);
            log.info("Stack Controller started");
        } catch (Exception e) {
            log.error("Failed to start Stack Controller: {}", e.getMessage(), e);
            System.exit(EXIT_STARTUP_FAILURE);
        }
    }

    @Bean
    @Primary
    public StackControllerConfig config() {
        StackControllerConfig config = new StackControllerConfig();
        log.info("Loaded configuration for profile {}", config.getProfile());
        return config;
    }

    @Bean
    public Topology topology(StackControllerConfig config) {
        return new TopologyLoader(config.getTopologyDir()).load(config.getProfile());
    }

    @Bean
    public NodeStateRegistry nodeStateRegistry(MetricsProvider metricsProvider) {
        NodeStateRegistry registry = new NodeStateRegistry();
        registry.addListener(new NodeStateMetrics(metricsProvider));
        return registry;
    }

    /**
     * Lease store shared by scheduler leadership, fire claims and single-flight task locks.
     */
    @Bean
    public LeaseStore leaseStore(StackControllerConfig config) {
        if (BACKEND_ETCD.equalsIgnoreCase(config.getLeaseType())) {
            log.info("Initializing etcd lease store at {}", String.join(", ", config.getLeaseEndpoints()));
            return EtcdLeaseStore.connect(config.getLeaseEndpoints(), config.getLeaseNamespace());
        }
        log.info("Initializing in-process lease store, scheduler singleton holds within this instance only");
        return new InMemoryLeaseStore();
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry meterRegistry, StackControllerConfig config) {
        return new MetricsProvider(meterRegistry, config.getInstanceId());
    }

    @Bean
    public BrokerEndpoints brokerEndpoints() {
        return new BrokerEndpoints();
    }

    @Bean
    public TierManager tierManager(StackControllerConfig config,
                                   Topology topology,
                                   NodeStateRegistry registry,
                                   LeaseStore leaseStore,
                                   MetricsProvider metricsProvider,
                                   BrokerEndpoints brokerEndpoints) {
        TierAssembler assembler = new TierAssembler(config.getInstanceId(), leaseStore, metricsProvider, Clock.systemUTC());
        List<Tier> tiers = new ArrayList<>();
        for (TierDefinition definition : config.getTiers()) {
            BrokerEndpoint endpoint = assembler.createEndpoint(definition);
            brokerEndpoints.register(endpoint);
            tiers.add(assembler.assemble(definition, endpoint, topology.requirementsOf(definition.getId()),
                    new TaskHandlerRegistry()));
            log.info("[Tier: {}] Assembled on broker {}, queues {}", definition.getId(), endpoint.getId(),
                    definition.getQueues());
        }
        return new TierManager(registry, tiers);
    }

    @Bean
    public ServiceLauncher serviceLauncher() {
        return new ProcessServiceLauncher();
    }

    @Bean
    public StackRunner stackRunner(StackControllerConfig config,
                                   Topology topology,
                                   NodeStateRegistry registry,
                                   ServiceLauncher launcher,
                                   TierManager tierManager,
                                   BrokerEndpoints brokerEndpoints,
                                   ConfigurableApplicationContext context) {
        return new StackRunner(config, topology, registry, launcher, new HealthProbeFactory(), tierManager,
                brokerEndpoints, code -> {
                    // Exit off the calling thread; closing the context waits for orchestrator threads
                    Thread exiter = new Thread(() -> System.exit(SpringApplication.exit(context)), "stack-exit");
                    exiter.start();
                });
    }

    @Bean
    public ReverseProxyRouter reverseProxyRouter(StackControllerConfig config,
                                                 NodeStateRegistry registry,
                                                 MetricsProvider metricsProvider) {
        AuthGate authGate = new AuthGate(config.getProtectedPrefixes(), config.getProxyUsername(),
                config.getProxyPasswordSha256());
        log.info("Initializing reverse proxy with {} routes, protected prefixes {}", config.getProxyRoutes().size(),
                config.getProtectedPrefixes());
        return new ReverseProxyRouter(new RouteTable(config.getProxyRoutes()), authGate, registry,
                new HttpForwarder(config.getProxyTimeouts()), metricsProvider);
    }
}
