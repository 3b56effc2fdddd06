package com.querytuner.model.explain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Output of one EXPLAIN run.
 *
 * <p>Exactly one of {@code output} (text kinds), {@code estimate} (ESTIMATE) or
 * {@code error} carries the payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExplainResult {

    private ExplainType type;

    private String output;

    private List<EstimateRow> estimate;

    private String error;

    public static ExplainResult text(ExplainType type, String output) {
        return ExplainResult.builder()
                .type(type)
                .output(output)
                .build();
    }

    public static ExplainResult estimate(ExplainType type, List<EstimateRow> rows) {
        return ExplainResult.builder()
                .type(type)
                .estimate(rows)
                .build();
    }

    public static ExplainResult failure(ExplainType type, String error) {
        return ExplainResult.builder()
                .type(type)
                .error(error)
                .build();
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null && !error.isEmpty();
    }
}
