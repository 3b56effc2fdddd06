package com.querytuner.service;

import com.querytuner.api.ExplainRequest;
import com.querytuner.api.ExplainResponse;
import com.querytuner.api.PingResponse;
import com.querytuner.model.explain.ExplainConfig;

import java.util.List;
import java.util.Map;

/**
 * Runs EXPLAIN diagnostics for a query edit and records the outcome as a new version.
 */
public interface ExplainService {

    /**
     * Reuse the parent's results when nothing changed, otherwise run the diagnostics,
     * fork history when the parent is not the branch head, and save a new version.
     *
     * @throws IllegalArgumentException when a non-empty parent version does not exist
     */
    ExplainResponse explain(ExplainRequest request);

    List<ExplainConfig> getDefaultConfigs();

    /**
     * {@code enable_analyzer}, {@code host} and {@code database} of the engine.
     * {@code enable_analyzer} reads as {@code "0"} when the engine cannot be asked.
     */
    Map<String, String> getServerSettings();

    PingResponse ping();
}
