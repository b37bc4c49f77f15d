package com.stratumduck.logical;

import com.stratumduck.generator.SQLGenerator;
import com.stratumduck.generator.SQLQuoting;

import java.util.List;
import java.util.Objects;

/**
 * Logical plan node keeping the first {@code limit} rows of its child in
 * ascending order of one column, projecting the given columns.
 *
 * <p>SQL generation:
 * <pre>
 *   SELECT "id", "amount" FROM "main"."labeled" ORDER BY "label" LIMIT 25
 * </pre>
 */
public final class OrderedLimit extends LogicalPlan {

    private final String orderColumn;
    private final long limit;
    private final List<String> outputColumns;

    public OrderedLimit(LogicalPlan child, String orderColumn, long limit, List<String> outputColumns) {
        super(child);
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative");
        }
        this.orderColumn = Objects.requireNonNull(orderColumn, "orderColumn must not be null");
        this.limit = limit;
        this.outputColumns = List.copyOf(outputColumns);
        if (this.outputColumns.isEmpty()) {
            throw new IllegalArgumentException("outputColumns must not be empty");
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");
        return "SELECT " + SQLQuoting.quoteIdentifiers(outputColumns)
            + " FROM " + generator.fromClause(child())
            + " ORDER BY " + SQLQuoting.quoteIdentifier(orderColumn)
            + " LIMIT " + limit;
    }

    @Override
    public String toString() {
        return String.format("OrderedLimit(order=%s, limit=%d, columns=%s)",
            orderColumn, limit, outputColumns);
    }
}
