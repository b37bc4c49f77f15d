package com.stratumduck.logical;

import com.stratumduck.generator.SQLGenerator;
import com.stratumduck.generator.SQLQuoting;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Logical plan node that attaches an independent uniform value in [0, 1) to
 * every row of its child.
 *
 * <p>SQL generation:
 * <pre>
 *   SELECT *, random() AS "label" FROM "main"."sales"
 *   SELECT *, (CAST(hash(rowid, CAST(42 AS BIGINT)) % ... AS DOUBLE) / ...) AS "label"
 *     FROM "main"."sales"                              -- seeded
 * </pre>
 *
 * <p>The seeded form identifies rows by {@code rowid}, so its child must be a
 * {@link TableScan} of a base table.
 */
public final class RandomLabel extends LogicalPlan {

    private final String labelColumn;
    private final OptionalLong seed;

    /**
     * Creates a labeling node.
     *
     * @param child the rows to label
     * @param labelColumn name of the new column
     * @param seed optional seed for reproducible labels
     */
    public RandomLabel(LogicalPlan child, String labelColumn, OptionalLong seed) {
        super(child);
        this.labelColumn = Objects.requireNonNull(labelColumn, "labelColumn must not be null");
        this.seed = Objects.requireNonNull(seed, "seed must not be null (use OptionalLong.empty())");
        if (seed.isPresent() && !(child instanceof TableScan)) {
            throw new IllegalArgumentException("Seeded labeling requires a table scan child");
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");
        return "SELECT *, " + generator.uniformValue(seed, List.of("rowid"))
            + " AS " + SQLQuoting.quoteIdentifier(labelColumn)
            + " FROM " + generator.fromClause(child());
    }

    @Override
    public String toString() {
        return String.format("RandomLabel(column=%s, seeded=%s)", labelColumn, seed.isPresent());
    }
}
