package com.querytuner.model.explain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of EXPLAIN statement sent to the analytical engine.
 *
 * <p>The keyword is what follows {@code EXPLAIN} in the generated text and is also the
 * JSON representation, so {@code "QUERY TREE"} round-trips as-is.
 */
public enum ExplainType {

    /** Plain {@code EXPLAIN}, the engine's own default kind. */
    DEFAULT(""),

    /** Abstract syntax tree as parsed. */
    AST("AST"),

    /** Query text after syntax normalization. */
    SYNTAX("SYNTAX"),

    /** Optimized query tree; needs the analyzer on newer engine versions. */
    QUERY_TREE("QUERY TREE"),

    /** Execution plan with steps, indexes and actions. */
    PLAN("PLAN"),

    /** Processor pipeline. */
    PIPELINE("PIPELINE"),

    /** Parts/rows/marks the query is expected to read. Returns structured rows. */
    ESTIMATE("ESTIMATE"),

    TABLE_OVERRIDE("TABLE OVERRIDE");

    private final String keyword;

    ExplainType(String keyword) {
        this.keyword = keyword;
    }

    @JsonValue
    public String getKeyword() {
        return keyword;
    }

    public boolean isDefault() {
        return this == DEFAULT;
    }

    /**
     * Resolve a keyword ("QUERY TREE") or enum name ("QUERY_TREE"). Null and blank map to
     * {@link #DEFAULT}.
     */
    @JsonCreator
    public static ExplainType fromKeyword(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String normalized = value.trim();
        for (ExplainType type : values()) {
            if (type.keyword.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown EXPLAIN type: " + value);
    }

    @Override
    public String toString() {
        return keyword;
    }
}
