package com.stratumduck.backend;

import com.stratumduck.logical.LogicalPlan;

import java.util.List;
import java.util.Map;

/**
 * The bulk-operation substrate the sampling engine runs on.
 *
 * <p>The engine never iterates over rows itself. It reads catalog metadata
 * and counts through this interface and asks the backend to materialize new
 * relations from {@link LogicalPlan} trees, each of which is a single
 * set-oriented operation the backend may execute in parallel.
 *
 * <p>All methods report backend failures as
 * {@link com.stratumduck.exception.BackendException}.
 *
 * @see DuckDBDataBackend
 */
public interface DataBackend {

    /**
     * Returns whether a table or view with this name exists.
     */
    boolean relationExists(RelationName name);

    /**
     * Returns whether the relation holds no rows.
     */
    boolean isEmpty(RelationName name);

    /**
     * Returns the relation's column names in ordinal order, spelled as the
     * catalog stores them.
     */
    List<String> columns(RelationName name);

    /**
     * Returns the number of rows in the relation.
     */
    long rowCount(RelationName name);

    /**
     * Returns the number of rows per distinct combination of the grouping
     * columns. Map keys hold the column values in {@code groupBy} order and
     * may contain nulls. With no grouping columns the map has a single entry
     * under the empty list.
     */
    Map<List<Object>, Long> rowCounts(RelationName name, List<String> groupBy);

    /**
     * Materializes the result of a plan as a new relation.
     *
     * @param name the relation to create; must not exist
     * @param plan the bulk operation producing its rows
     */
    void createRelation(RelationName name, LogicalPlan plan);

    /**
     * Drops a relation if it exists. Dropping a missing relation is a no-op.
     */
    void dropRelation(RelationName name);
}
