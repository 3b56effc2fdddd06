package com.querytuner.api;

import com.querytuner.model.explain.ExplainConfig;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request for the run-diagnostics endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExplainRequest {

    @NotBlank
    private String branchId;

    /**
     * Query text, stored and sent to the engine verbatim.
     */
    @NotNull
    private String query;

    /**
     * Version the query was edited from. Empty for the first version of a branch.
     */
    private String parentVersionId;

    /**
     * Diagnostics to run. Empty means the default set.
     */
    private List<ExplainConfig> explainConfigs;

    private boolean forceAnalyzer;

    /**
     * Server settings as last read by the client, e.g. {@code enable_analyzer}.
     */
    private Map<String, String> serverSettings;

    /**
     * Engine-side time budget. Zero or negative means the configured default.
     */
    private int maxExecutionTimeMs;
}
