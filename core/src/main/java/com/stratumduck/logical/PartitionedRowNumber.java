package com.stratumduck.logical;

import com.stratumduck.generator.SQLGenerator;
import com.stratumduck.generator.SQLQuoting;

import java.util.List;
import java.util.Objects;

/**
 * Logical plan node numbering the rows of each stratum 1, 2, ..., n.
 *
 * <p>Numbering restarts at 1 for every stratum. When {@code stable} is set the
 * rows are numbered in {@code rowid} order, so the same base table always
 * receives the same numbering; otherwise the order is whatever the backend
 * produces.
 *
 * <p>SQL generation:
 * <pre>
 *   SELECT *, ROW_NUMBER() OVER (PARTITION BY "region") AS "rank" FROM "main"."sales"
 *   SELECT *, ROW_NUMBER() OVER (PARTITION BY "region" ORDER BY rowid) AS "rank"
 *     FROM "main"."sales"                                        -- stable
 * </pre>
 */
public final class PartitionedRowNumber extends LogicalPlan {

    private final List<String> keys;
    private final String rankColumn;
    private final boolean stable;

    /**
     * Creates a numbering node.
     *
     * @param child the rows to number
     * @param keys stratification key columns, empty for a single global stratum
     * @param rankColumn name of the new column
     * @param stable whether to number in rowid order (child must be a table scan)
     */
    public PartitionedRowNumber(LogicalPlan child, List<String> keys, String rankColumn, boolean stable) {
        super(child);
        this.keys = List.copyOf(keys);
        this.rankColumn = Objects.requireNonNull(rankColumn, "rankColumn must not be null");
        this.stable = stable;
        if (stable && !(child instanceof TableScan)) {
            throw new IllegalArgumentException("Stable numbering requires a table scan child");
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");

        String window = generator.partitionBy(keys);
        if (stable) {
            window = window.isEmpty() ? "ORDER BY rowid" : window + " ORDER BY rowid";
        }
        return "SELECT *, ROW_NUMBER() OVER (" + window + ") AS "
            + SQLQuoting.quoteIdentifier(rankColumn)
            + " FROM " + generator.fromClause(child());
    }

    @Override
    public String toString() {
        return String.format("PartitionedRowNumber(keys=%s, column=%s, stable=%s)",
            keys, rankColumn, stable);
    }
}
