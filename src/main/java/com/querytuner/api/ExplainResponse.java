package com.querytuner.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.querytuner.model.branch.Branch;
import com.querytuner.model.branch.QueryVersion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a diagnostics run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExplainResponse {

    /**
     * The saved version, or the reused parent when {@code resultsReused} is set.
     */
    private QueryVersion version;

    private boolean autoBranched;

    /**
     * Present only when {@code autoBranched}.
     */
    private Branch newBranch;

    private boolean resultsReused;

    /**
     * Set when a fork was needed but could not be created.
     */
    private String warning;
}
