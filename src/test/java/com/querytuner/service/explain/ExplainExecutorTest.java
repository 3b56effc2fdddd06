package com.querytuner.service.explain;

import com.querytuner.client.ExplainEngine;
import com.querytuner.exception.ExplainEngineException;
import com.querytuner.model.explain.EstimateRow;
import com.querytuner.model.explain.ExplainConfig;
import com.querytuner.model.explain.ExplainResult;
import com.querytuner.model.explain.ExplainType;
import com.querytuner.service.explain.ExplainExecutor.ExplainOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EXPLAIN executor")
class ExplainExecutorTest {

    private static final ExplainOptions NO_OPTIONS = new ExplainOptions("", false, 0);

    @Mock
    private ExplainEngine engine;

    @InjectMocks
    private ExplainExecutor executor;

    private static ExplainConfig config(ExplainType type, boolean enabled) {
        return ExplainConfig.builder().type(type).enabled(enabled).build();
    }

    @Test
    @DisplayName("Disabled configs are skipped")
    void skipsDisabled() {
        when(engine.queryLines("EXPLAIN AST SELECT 1")).thenReturn(List.of("SelectQuery"));

        List<ExplainResult> results = executor.executeAll(
                List.of(config(ExplainType.PLAN, false), config(ExplainType.AST, true)), "SELECT 1", NO_OPTIONS);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).getOutput()).isEqualTo("SelectQuery");
        verify(engine, never()).queryLines("EXPLAIN PLAN SELECT 1");
    }

    @Test
    @DisplayName("ESTIMATE returns structured rows")
    void estimate() {
        EstimateRow row = new EstimateRow("default", "hits", 1, 100, 2);
        when(engine.queryEstimate("EXPLAIN ESTIMATE SELECT 1")).thenReturn(List.of(row));

        ExplainResult result = executor.execute(config(ExplainType.ESTIMATE, true), "SELECT 1", NO_OPTIONS);

        assertThat(result.getEstimate()).containsExactly(row);
        assertThat(result.getOutput()).isNull();
        verify(engine, never()).queryLines(anyString());
    }

    @Test
    @DisplayName("Engine failure becomes the result error and the batch goes on")
    void failureCaptured() {
        when(engine.queryLines("EXPLAIN SYNTAX SELECT 1")).thenThrow(new ExplainEngineException("Code: 47", 404, null));
        when(engine.queryLines("EXPLAIN PIPELINE SELECT 1")).thenReturn(List.of("(Expression)"));

        List<ExplainResult> results = executor.executeAll(
                List.of(config(ExplainType.SYNTAX, true), config(ExplainType.PIPELINE, true)), "SELECT 1", NO_OPTIONS);

        assertThat(results.get(0).getError()).isEqualTo("Query error: Code: 47");
        assertThat(results.get(0).getType()).isEqualTo(ExplainType.SYNTAX);
        assertThat(results.get(1).hasError()).isFalse();
    }

    @Test
    @DisplayName("Empty engine output is an empty string, not an error")
    void emptyOutput() {
        when(engine.queryLines(anyString())).thenReturn(List.of());

        ExplainResult result = executor.execute(config(ExplainType.DEFAULT, true), "SELECT 1", NO_OPTIONS);

        assertThat(result.getOutput()).isEmpty();
        assertThat(result.hasError()).isFalse();
    }
}
