package com.querytuner.model.explain;

/**
 * One row of {@code EXPLAIN ESTIMATE} output.
 */
public record EstimateRow(
        String database,
        String table,
        long parts,
        long rows,
        long marks
) {
}
