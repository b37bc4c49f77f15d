package com.stratumduck.logical;

import com.stratumduck.generator.SQLGenerator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for the bulk operations the sampling engine asks the backend to
 * materialize.
 *
 * <p>Each node is one set-oriented operation (scan, labeling, threshold,
 * numbering, draw generation, join, ordered limit). A node never touches
 * individual rows; it is translated to a single DuckDB query by calling
 * {@link #toSQL(SQLGenerator)} and executed by the backend as
 * {@code CREATE TABLE ... AS}.
 *
 * @see SQLGenerator
 */
public abstract class LogicalPlan {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /**
     * Creates a logical plan node with no children.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a logical plan node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(child);
    }

    /**
     * Creates a logical plan node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = new ArrayList<>(children);
    }

    /**
     * Translates this logical plan node to DuckDB SQL.
     *
     * @param generator the SQL generator to use
     * @return the generated SQL string
     */
    public abstract String toSQL(SQLGenerator generator);

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public abstract String toString();
}
