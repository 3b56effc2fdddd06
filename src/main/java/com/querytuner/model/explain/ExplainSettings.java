package com.querytuner.model.explain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional per-kind EXPLAIN settings. A null field means "not set" and is never rendered.
 *
 * <p>Which fields apply to which {@link ExplainType} is decided by {@link ExplainSetting},
 * not here: a field set for the wrong kind is simply ignored when the query is built.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExplainSettings {

    // Any kind
    private Integer header;

    // PLAN
    private Integer description;
    private Integer indexes;
    private Integer projections;
    private Integer actions;
    @JsonProperty("json")
    private Integer jsonFormat;

    // PIPELINE
    private Integer graph;
    private Integer compact;

    // SYNTAX
    @JsonProperty("oneline")
    private Integer oneLine;
    @JsonProperty("run_query_tree_passes")
    private Integer runQueryTreePasses;
    @JsonProperty("query_tree_passes")
    private Integer queryTreePasses;

    // QUERY TREE
    @JsonProperty("run_passes")
    private Integer runPasses;
    @JsonProperty("dump_passes")
    private Integer dumpPasses;
    private Integer passes;
    @JsonProperty("dump_tree")
    private Integer dumpTree;
    @JsonProperty("dump_ast")
    private Integer dumpAst;

    public static ExplainSettings none() {
        return new ExplainSettings();
    }
}
