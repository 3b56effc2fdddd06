package com.querytuner.client;

import com.querytuner.model.explain.EstimateRow;

import java.util.List;
import java.util.Optional;

/**
 * Analytical engine that executes EXPLAIN text.
 *
 * <p>Implementations throw {@link com.querytuner.exception.ExplainEngineException} on any
 * engine or transport failure.
 */
public interface ExplainEngine {

    /**
     * Run a statement that returns a single text column, one line per row.
     */
    List<String> queryLines(String sql);

    /**
     * Run {@code EXPLAIN ESTIMATE} and read its five-column rows.
     */
    List<EstimateRow> queryEstimate(String sql);

    /**
     * Current value of a server setting, empty if the server does not know it.
     */
    Optional<String> fetchSetting(String name);

    void ping();
}
