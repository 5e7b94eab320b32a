package io.stackcontroller.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.stackcontroller.models.DeadLetterRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Dead letters of one tier. Each record carries its task, whose queue name says where a replay goes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DeadLetterResponse {

    private String tier;

    private int count;

    private List<DeadLetterRecord> deadLetters;

    public static DeadLetterResponse of(String tier, List<DeadLetterRecord> records) {
        return new DeadLetterResponse(tier, records.size(), records);
    }
}
