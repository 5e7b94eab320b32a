package io.stackcontroller.models;

import io.stackcontroller.enums.RestartPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A unit of deployment: how to start it, what it waits for, and how its health is judged.
 * Identity is the {@code name}; declaration order carries no meaning.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceNode {

    private String name;

    /**
     * Start command. Empty means the node is managed elsewhere and counts as started once gated.
     */
    @Builder.Default
    private List<String> command = new ArrayList<>();

    private String workingDirectory;

    @Builder.Default
    private Map<String, String> environment = new LinkedHashMap<>();

    @Builder.Default
    private List<Dependency> dependencies = new ArrayList<>();

    private HealthCheckSpec healthCheck;

    @Builder.Default
    private RestartPolicy restartPolicy = RestartPolicy.NONE;

    public boolean hasHealthCheck() {
        return healthCheck != null;
    }

    public boolean isExternal() {
        return command == null || command.isEmpty();
    }
}
