package io.stackcontroller.config;

import io.stackcontroller.enums.DependencyCondition;
import io.stackcontroller.enums.ProbeType;
import io.stackcontroller.enums.RestartPolicy;
import io.stackcontroller.models.Dependency;
import io.stackcontroller.models.HealthCheckSpec;
import io.stackcontroller.models.ServiceNode;
import io.stackcontroller.util.EnvironmentUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.convert.DurationStyle;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a topology profile from {@code topology/<profile>.yml}, first from the configured
 * external directory, then from the classpath. Each profile is a complete service set; nothing
 * is merged between profiles.
 */
@Slf4j
public class TopologyLoader {

    private static final String CLASSPATH_DIR = "topology/";

    private final String externalDir;
    private final Map<String, String> environment;

    public TopologyLoader(String externalDir) {
        this(externalDir, System.getenv());
    }

    public TopologyLoader(String externalDir, Map<String, String> environment) {
        this.externalDir = externalDir;
        this.environment = environment;
    }

    public Topology load(String profile) {
        if (profile == null || profile.isBlank()) {
            throw new IllegalArgumentException("Topology profile cannot be null or empty");
        }
        String fileName = profile + ".yml";
        if (externalDir != null && !externalDir.isBlank()) {
            Path path = Paths.get(externalDir, fileName);
            if (Files.exists(path)) {
                try (InputStream in = Files.newInputStream(path)) {
                    log.info("Loading topology profile {} from {}", profile, path);
                    return parse(profile, in);
                } catch (IOException e) {
                    throw new IllegalStateException("Cannot read topology file " + path, e);
                }
            }
            log.warn("Topology file {} not found, falling back to classpath", path);
        }
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(CLASSPATH_DIR + fileName)) {
            if (in == null) {
                throw new IllegalArgumentException("Unknown topology profile: " + profile);
            }
            log.info("Loading topology profile {} from classpath", profile);
            return parse(profile, in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read topology profile " + profile, e);
        }
    }

    @SuppressWarnings("unchecked")
    Topology parse(String profile, InputStream in) {
        Map<String, Object> root = new Yaml().load(in);
        if (root == null) {
            throw new IllegalArgumentException("Topology profile " + profile + " is empty");
        }
        List<ServiceNode> nodes = new ArrayList<>();
        List<Map<String, Object>> nodeEntries = (List<Map<String, Object>>) root.getOrDefault("nodes", List.of());
        for (Map<String, Object> entry : nodeEntries) {
            nodes.add(parseNode(entry));
        }

        Map<String, List<String>> requirements = new LinkedHashMap<>();
        Map<String, Object> tiers = (Map<String, Object>) root.getOrDefault("tiers", Map.of());
        tiers.forEach((tierId, value) -> {
            Map<String, Object> tier = (Map<String, Object>) value;
            requirements.put(tierId, List.copyOf((List<String>) tier.getOrDefault("requires", List.of())));
        });
        log.info("Topology profile {} has {} nodes", profile, nodes.size());
        return new Topology(profile, nodes, requirements);
    }

    @SuppressWarnings("unchecked")
    private ServiceNode parseNode(Map<String, Object> entry) {
        String name = requireString(entry, "name", "node");
        List<Dependency> dependencies = new ArrayList<>();
        Object dependsOn = entry.get("dependsOn");
        if (dependsOn instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String dependencyName) {
                    dependencies.add(Dependency.started(dependencyName));
                } else {
                    Map<String, Object> dependency = (Map<String, Object>) item;
                    dependencies.add(new Dependency(requireString(dependency, "node", name + ".dependsOn"),
                            DependencyCondition.fromString((String) dependency.get("condition"))));
                }
            }
        } else if (dependsOn instanceof Map<?, ?> map) {
            // compose style: {db: {condition: service_healthy}}
            for (Map.Entry<?, ?> dependency : map.entrySet()) {
                Map<String, Object> options = dependency.getValue() instanceof Map
                        ? (Map<String, Object>) dependency.getValue() : Map.of();
                dependencies.add(new Dependency(String.valueOf(dependency.getKey()),
                        DependencyCondition.fromString((String) options.get("condition"))));
            }
        }

        Map<String, String> env = new LinkedHashMap<>();
        Map<String, Object> rawEnv = (Map<String, Object>) entry.getOrDefault("environment", Map.of());
        rawEnv.forEach((key, value) -> env.put(key, expand(String.valueOf(value))));

        return ServiceNode.builder()
                .name(name)
                .command(expandAll((List<Object>) entry.getOrDefault("command", List.of())))
                .workingDirectory(expand((String) entry.get("workingDirectory")))
                .environment(env)
                .dependencies(dependencies)
                .healthCheck(parseHealthCheck(name, (Map<String, Object>) entry.get("healthCheck")))
                .restartPolicy(RestartPolicy.fromString((String) entry.get("restartPolicy")))
                .build();
    }

    @SuppressWarnings("unchecked")
    private HealthCheckSpec parseHealthCheck(String nodeName, Map<String, Object> entry) {
        if (entry == null) {
            return null;
        }
        HealthCheckSpec.HealthCheckSpecBuilder builder = HealthCheckSpec.builder()
                .type(ProbeType.fromString((String) entry.get("type")));
        if (entry.containsKey("command")) {
            builder.command(expandAll((List<Object>) entry.get("command")));
        }
        if (entry.containsKey("target")) {
            builder.target(expand(String.valueOf(entry.get("target"))));
        }
        if (entry.containsKey("interval")) {
            builder.interval(duration(entry.get("interval")));
        }
        if (entry.containsKey("timeout")) {
            builder.timeout(duration(entry.get("timeout")));
        }
        if (entry.containsKey("startPeriod")) {
            builder.startPeriod(duration(entry.get("startPeriod")));
        }
        if (entry.containsKey("retries")) {
            builder.retries(((Number) entry.get("retries")).intValue());
        }
        if (entry.containsKey("successThreshold")) {
            builder.successThreshold(((Number) entry.get("successThreshold")).intValue());
        }
        HealthCheckSpec spec = builder.build();
        spec.validate(nodeName);
        return spec;
    }

    private List<String> expandAll(List<Object> values) {
        List<String> expanded = new ArrayList<>();
        for (Object value : values) {
            expanded.add(expand(String.valueOf(value)));
        }
        return expanded;
    }

    private String expand(String value) {
        return EnvironmentUtils.expand(value, environment);
    }

    static Duration duration(Object value) {
        if (value instanceof Number number) {
            return Duration.ofSeconds(number.longValue());
        }
        return DurationStyle.detectAndParse(String.valueOf(value).trim());
    }

    private static String requireString(Map<String, Object> entry, String key, String where) {
        Object value = entry.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            throw new IllegalArgumentException("Missing '" + key + "' in " + where);
        }
        return String.valueOf(value);
    }
}
