package com.querytuner.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults for the run-diagnostics flow and the version graph.
 *
 * <p>Properties are loaded from the {@code app.explain} namespace in application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.explain")
public class ExplainProperties {

    /**
     * Budget passed as {@code max_execution_time} when a request does not set one.
     */
    @Positive
    private int defaultMaxExecutionTimeMs = 1345;

    /**
     * Product name written into the {@code log_comment} of every EXPLAIN. The comment is a
     * single-quoted literal, so a quote here would end it early.
     */
    @NotBlank
    @Pattern(regexp = "[^']*", message = "must not contain a single quote")
    private String product = "query-tuner";

    /**
     * Root branch created at startup when missing.
     */
    @NotBlank
    private String mainBranchName = "main";

    /**
     * Prefix for branches created by the auto-branch policy.
     */
    @NotBlank
    private String autoBranchPrefix = "branch-";

    /**
     * Query text used when a branch is created with an initial version but no content.
     */
    private String initialQuery = "-- New query branch\n-- Start writing your ClickHouse query here\n\nSELECT 1";
}
