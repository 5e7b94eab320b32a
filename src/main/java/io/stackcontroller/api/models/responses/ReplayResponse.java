package io.stackcontroller.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledges that a dead-lettered task went back to its queue.
 *
 * Example response:
 * <pre>
 * {
 *   "acknowledged": true,
 *   "task_id": "6f1c...",
 *   "queue": "car_parsing_queue"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReplayResponse {

    private boolean acknowledged;

    private String taskId;

    private String queue;

    public static ReplayResponse success(String taskId, String queue) {
        return new ReplayResponse(true, taskId, queue);
    }
}
