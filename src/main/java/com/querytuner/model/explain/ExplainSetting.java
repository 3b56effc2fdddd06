package com.querytuner.model.explain;

import java.util.function.Function;

/**
 * Every EXPLAIN setting the builder knows about, declared in rendering order.
 *
 * <p>The declaration order is part of the output contract: the builder walks
 * {@link #values()} and emits the applicable, present settings in exactly this order.
 */
public enum ExplainSetting {

    HEADER("header", null, ExplainSettings::getHeader),

    DESCRIPTION("description", ExplainType.PLAN, ExplainSettings::getDescription),
    INDEXES("indexes", ExplainType.PLAN, ExplainSettings::getIndexes),
    PROJECTIONS("projections", ExplainType.PLAN, ExplainSettings::getProjections),
    ACTIONS("actions", ExplainType.PLAN, ExplainSettings::getActions),
    JSON("json", ExplainType.PLAN, ExplainSettings::getJsonFormat),

    GRAPH("graph", ExplainType.PIPELINE, ExplainSettings::getGraph),
    COMPACT("compact", ExplainType.PIPELINE, ExplainSettings::getCompact),

    ONELINE("oneline", ExplainType.SYNTAX, ExplainSettings::getOneLine),
    RUN_QUERY_TREE_PASSES("run_query_tree_passes", ExplainType.SYNTAX, ExplainSettings::getRunQueryTreePasses),
    QUERY_TREE_PASSES("query_tree_passes", ExplainType.SYNTAX, ExplainSettings::getQueryTreePasses),

    RUN_PASSES("run_passes", ExplainType.QUERY_TREE, ExplainSettings::getRunPasses),
    DUMP_PASSES("dump_passes", ExplainType.QUERY_TREE, ExplainSettings::getDumpPasses),
    PASSES("passes", ExplainType.QUERY_TREE, ExplainSettings::getPasses),
    DUMP_TREE("dump_tree", ExplainType.QUERY_TREE, ExplainSettings::getDumpTree),
    DUMP_AST("dump_ast", ExplainType.QUERY_TREE, ExplainSettings::getDumpAst);

    private final String settingName;
    private final ExplainType scope;
    private final Function<ExplainSettings, Integer> accessor;

    ExplainSetting(String settingName, ExplainType scope, Function<ExplainSettings, Integer> accessor) {
        this.settingName = settingName;
        this.scope = scope;
        this.accessor = accessor;
    }

    public String getSettingName() {
        return settingName;
    }

    /** Null scope means the setting applies to every kind. */
    public boolean appliesTo(ExplainType type) {
        return scope == null || scope == type;
    }

    public Integer valueIn(ExplainSettings settings) {
        return settings == null ? null : accessor.apply(settings);
    }
}
