package com.stratumduck.logical;

import com.stratumduck.backend.RelationName;
import com.stratumduck.generator.SQLGenerator;

import java.util.Objects;

/**
 * Logical plan node reading every row of an existing relation.
 *
 * <p>Example SQL generation:
 * <pre>
 *   TableScan(main.sales) → SELECT * FROM "main"."sales"
 * </pre>
 *
 * <p>Parent nodes reference a scanned base table directly rather than through
 * a subquery, which keeps DuckDB's {@code rowid} pseudo-column available for
 * seeded labeling.
 */
public final class TableScan extends LogicalPlan {

    private final RelationName relation;

    public TableScan(RelationName relation) {
        super();
        this.relation = Objects.requireNonNull(relation, "relation must not be null");
    }

    public RelationName relation() {
        return relation;
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        return "SELECT * FROM " + relation.toSQL();
    }

    @Override
    public String toString() {
        return "TableScan(" + relation + ")";
    }
}
