package com.stratumduck.logical;

import com.stratumduck.generator.SQLGenerator;
import com.stratumduck.generator.SQLQuoting;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node joining per-row data to per-stratum data.
 *
 * <p>Left and right rows match when every stratification key is equal and the
 * extra comparison between a left column and a right column holds. Keys are
 * compared with {@code IS NOT DISTINCT FROM}, so rows whose key value is NULL
 * form their own stratum instead of silently dropping out.
 *
 * <p>Only left columns are projected. Each matching pair yields one output
 * row, so a right row that matches a left row twice (repeated draws) yields
 * that left row twice.
 *
 * <p>SQL generation:
 * <pre>
 *   SELECT l."id", l."region" FROM "main"."labeled" AS l
 *   JOIN "main"."thresholds" AS r
 *     ON l."region" IS NOT DISTINCT FROM r."region" AND l."label" &lt;= r."threshold"
 * </pre>
 */
public final class StratumJoin extends LogicalPlan {

    /**
     * Comparison applied between the left and right column.
     */
    public enum Comparison {
        EQUAL("="),
        LESS_OR_EQUAL("<=");

        private final String sql;

        Comparison(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }

    private final List<String> keys;
    private final String leftColumn;
    private final Comparison comparison;
    private final String rightColumn;
    private final List<String> outputColumns;

    /**
     * Creates a stratum join node.
     *
     * @param left per-row relation
     * @param right per-stratum relation
     * @param keys stratification keys present on both sides (may be empty)
     * @param leftColumn left operand of the extra comparison
     * @param comparison the comparison
     * @param rightColumn right operand of the extra comparison
     * @param outputColumns left columns to project, in order
     */
    public StratumJoin(LogicalPlan left, LogicalPlan right, List<String> keys,
                       String leftColumn, Comparison comparison, String rightColumn,
                       List<String> outputColumns) {
        super(List.of(left, right));
        this.keys = List.copyOf(keys);
        this.leftColumn = Objects.requireNonNull(leftColumn, "leftColumn must not be null");
        this.comparison = Objects.requireNonNull(comparison, "comparison must not be null");
        this.rightColumn = Objects.requireNonNull(rightColumn, "rightColumn must not be null");
        this.outputColumns = List.copyOf(outputColumns);
        if (this.outputColumns.isEmpty()) {
            throw new IllegalArgumentException("outputColumns must not be empty");
        }
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");

        String leftFrom = joinOperand(generator, left());
        String leftAlias = generator.generateSubqueryAlias();
        String rightFrom = joinOperand(generator, right());
        String rightAlias = generator.generateSubqueryAlias();

        List<String> conditions = new ArrayList<>();
        for (String key : keys) {
            String quoted = SQLQuoting.quoteIdentifier(key);
            conditions.add(leftAlias + "." + quoted + " IS NOT DISTINCT FROM " + rightAlias + "." + quoted);
        }
        conditions.add(leftAlias + "." + SQLQuoting.quoteIdentifier(leftColumn)
            + " " + comparison.sql() + " "
            + rightAlias + "." + SQLQuoting.quoteIdentifier(rightColumn));

        return "SELECT " + SQLQuoting.qualifyIdentifiers(leftAlias, outputColumns)
            + " FROM " + leftFrom + " AS " + leftAlias
            + " JOIN " + rightFrom + " AS " + rightAlias
            + " ON " + String.join(" AND ", conditions);
    }

    private static String joinOperand(SQLGenerator generator, LogicalPlan plan) {
        if (plan instanceof TableScan) {
            return ((TableScan) plan).relation().toSQL();
        }
        return "(" + generator.generate(plan) + ")";
    }

    @Override
    public String toString() {
        return String.format("StratumJoin(keys=%s, %s %s %s, columns=%s)",
            keys, leftColumn, comparison.sql(), rightColumn, outputColumns);
    }
}
