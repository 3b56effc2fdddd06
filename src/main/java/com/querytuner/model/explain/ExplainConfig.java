package com.querytuner.model.explain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One diagnostic to run: the EXPLAIN kind, its settings, and whether it is switched on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExplainConfig {

    @Builder.Default
    private ExplainType type = ExplainType.DEFAULT;

    @Builder.Default
    private ExplainSettings settings = new ExplainSettings();

    private boolean enabled;

    /**
     * Diagnostics run when a request does not name any.
     */
    public static List<ExplainConfig> defaults() {
        return List.of(
                ExplainConfig.builder()
                        .type(ExplainType.PLAN)
                        .settings(ExplainSettings.builder().indexes(1).description(1).jsonFormat(1).build())
                        .enabled(true)
                        .build(),
                ExplainConfig.builder()
                        .type(ExplainType.PIPELINE)
                        .settings(ExplainSettings.builder().compact(1).build())
                        .enabled(true)
                        .build(),
                ExplainConfig.builder()
                        .type(ExplainType.ESTIMATE)
                        .enabled(true)
                        .build(),
                ExplainConfig.builder()
                        .type(ExplainType.AST)
                        .enabled(true)
                        .build(),
                ExplainConfig.builder()
                        .type(ExplainType.SYNTAX)
                        .settings(ExplainSettings.builder().oneLine(0).build())
                        .enabled(true)
                        .build(),
                ExplainConfig.builder()
                        .type(ExplainType.QUERY_TREE)
                        .settings(ExplainSettings.builder().runPasses(1).dumpTree(1).build())
                        .enabled(true)
                        .build()
        );
    }
}
