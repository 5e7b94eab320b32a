package io.stackcontroller.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response model describing every tier's workers, scheduler and queue depths.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TierStatusResponse {

    private List<TierEntry> tiers;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TierEntry {
        private String id;
        private String brokerEndpointId;
        private List<String> requirements;
        private boolean started;
        private boolean workersRunning;
        private int inFlight;
        private Map<String, Long> queueDepths;
        private Map<String, Long> claimedPerQueue;
        private Map<String, Long> outcomes;
        private Boolean schedulerLeader;
        private Map<String, String> nextFireTimes;
    }
}
