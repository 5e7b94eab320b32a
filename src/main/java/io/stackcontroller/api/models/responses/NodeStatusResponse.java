package io.stackcontroller.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.stackcontroller.orchestration.NodeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Response model for the node status listing.
 *
 * Example response:
 * <pre>
 * {
 *   "profile": "dev",
 *   "halted": false,
 *   "nodes": [
 *     {"name": "db", "state": "HEALTHY", "restarts": 0, "ever_healthy": true, "since": "2024-01-01T00:00:00Z"}
 *   ]
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NodeStatusResponse {

    private String profile;

    private boolean halted;

    private List<NodeEntry> nodes;

    public static NodeStatusResponse from(String profile, boolean halted, Map<String, NodeStatus> snapshot) {
        List<NodeEntry> entries = new ArrayList<>();
        for (NodeStatus status : snapshot.values()) {
            entries.add(NodeEntry.builder()
                    .name(status.name())
                    .state(status.state().name())
                    .lastProbeError(status.lastProbeError())
                    .restarts(status.restarts())
                    .everHealthy(status.everHealthy())
                    .since(status.since() != null ? status.since().toString() : null)
                    .build());
        }
        return NodeStatusResponse.builder().profile(profile).halted(halted).nodes(entries).build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class NodeEntry {
        private String name;
        private String state;
        private String lastProbeError;
        private int restarts;
        private boolean everHealthy;
        private String since;
    }
}
