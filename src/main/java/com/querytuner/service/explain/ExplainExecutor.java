package com.querytuner.service.explain;

import com.querytuner.client.ExplainEngine;
import com.querytuner.model.explain.EstimateRow;
import com.querytuner.model.explain.ExplainConfig;
import com.querytuner.model.explain.ExplainResult;
import com.querytuner.model.explain.ExplainType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs EXPLAIN diagnostics against the engine, one statement per enabled config.
 *
 * A failing diagnostic does not stop the batch: its error text is stored in its result
 * and the next config runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExplainExecutor {

    private final ExplainEngine engine;

    public List<ExplainResult> executeAll(List<ExplainConfig> configs, String query, ExplainOptions options) {
        List<ExplainResult> results = new ArrayList<>();
        for (ExplainConfig config : configs) {
            if (!config.isEnabled()) {
                continue;
            }
            results.add(execute(config, query, options));
        }
        return results;
    }

    public ExplainResult execute(ExplainConfig config, String query, ExplainOptions options) {
        ExplainType type = config.getType() == null ? ExplainType.DEFAULT : config.getType();
        String sql = ExplainQueryBuilder.build(config, query, options.logComment(),
                options.forceAnalyzer(), options.maxExecutionTimeMs());
        log.debug("Running EXPLAIN {}: {}", type, sql);

        try {
            if (type == ExplainType.ESTIMATE) {
                List<EstimateRow> rows = engine.queryEstimate(sql);
                return ExplainResult.estimate(type, rows);
            }
            List<String> lines = engine.queryLines(sql);
            return ExplainResult.text(type, String.join("\n", lines));
        } catch (RuntimeException e) {
            log.warn("EXPLAIN {} failed: {}", type, e.getMessage());
            return ExplainResult.failure(type, "Query error: " + e.getMessage());
        }
    }

    /**
     * Per-run values rendered into the trailing SETTINGS clause.
     */
    public record ExplainOptions(String logComment, boolean forceAnalyzer, int maxExecutionTimeMs) {
    }
}
