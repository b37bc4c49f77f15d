package com.stratumduck.backend;

import com.stratumduck.generator.SQLGenerator;
import com.stratumduck.generator.SQLQuoting;
import com.stratumduck.logical.LogicalPlan;
import com.stratumduck.runtime.DuckDBRuntime;
import com.stratumduck.runtime.QueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link DataBackend} backed by an embedded DuckDB database.
 *
 * <p>Catalog lookups go through {@code information_schema} with bound
 * parameters. Relations are materialized with {@code CREATE TABLE ... AS}
 * from SQL generated by the plan nodes; every identifier is quoted by
 * {@link SQLQuoting}. Name matching follows DuckDB's case-insensitive
 * identifier rules.
 *
 * <p>Example usage:
 * <pre>
 *   try (DuckDBRuntime runtime = DuckDBRuntime.create()) {
 *       DataBackend backend = new DuckDBDataBackend(runtime);
 *       long rows = backend.rowCount(RelationName.parse("sales"));
 *   }
 * </pre>
 */
public class DuckDBDataBackend implements DataBackend {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBDataBackend.class);

    private static final String RELATION_EXISTS_SQL =
        "SELECT COUNT(*) FROM information_schema.tables "
            + "WHERE lower(table_schema) = lower(?) AND lower(table_name) = lower(?)";

    private static final String COLUMNS_SQL =
        "SELECT column_name FROM information_schema.columns "
            + "WHERE lower(table_schema) = lower(?) AND lower(table_name) = lower(?) "
            + "ORDER BY ordinal_position";

    private final QueryExecutor executor;

    /**
     * Creates a backend on the given runtime. The runtime stays owned by the
     * caller.
     *
     * @param runtime the DuckDB runtime
     */
    public DuckDBDataBackend(DuckDBRuntime runtime) {
        this(new QueryExecutor(runtime));
    }

    /**
     * Creates a backend on an existing executor.
     *
     * @param executor the query executor
     */
    public DuckDBDataBackend(QueryExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public boolean relationExists(RelationName name) {
        Objects.requireNonNull(name, "name must not be null");
        return executor.queryForLong("relationExists", RELATION_EXISTS_SQL,
            name.schema(), name.table()) > 0;
    }

    @Override
    public boolean isEmpty(RelationName name) {
        Objects.requireNonNull(name, "name must not be null");
        String sql = "SELECT COUNT(*) FROM (SELECT 1 FROM " + name.toSQL() + " LIMIT 1)";
        return executor.queryForLong("isEmpty", sql) == 0;
    }

    @Override
    public List<String> columns(RelationName name) {
        Objects.requireNonNull(name, "name must not be null");
        List<String> columns = new ArrayList<>();
        for (List<Object> row : executor.queryForRows("columns", COLUMNS_SQL, name.schema(), name.table())) {
            columns.add((String) row.get(0));
        }
        return columns;
    }

    @Override
    public long rowCount(RelationName name) {
        Objects.requireNonNull(name, "name must not be null");
        return executor.queryForLong("rowCount", "SELECT COUNT(*) FROM " + name.toSQL());
    }

    @Override
    public Map<List<Object>, Long> rowCounts(RelationName name, List<String> groupBy) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(groupBy, "groupBy must not be null");

        Map<List<Object>, Long> counts = new LinkedHashMap<>();
        if (groupBy.isEmpty()) {
            counts.put(List.of(), rowCount(name));
            return counts;
        }

        String keys = SQLQuoting.quoteIdentifiers(groupBy);
        String sql = "SELECT " + keys + ", COUNT(*) FROM " + name.toSQL() + " GROUP BY " + keys;
        for (List<Object> row : executor.queryForRows("rowCounts", sql)) {
            List<Object> key = new ArrayList<>(row.subList(0, groupBy.size()));
            counts.put(key, ((Number) row.get(groupBy.size())).longValue());
        }
        return counts;
    }

    @Override
    public void createRelation(RelationName name, LogicalPlan plan) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(plan, "plan must not be null");

        String sql = "CREATE TABLE " + name.toSQL() + " AS " + new SQLGenerator().generate(plan);
        logger.debug("Materializing {} from {}", name, plan);
        executor.executeUpdate("createRelation", sql);
    }

    @Override
    public void dropRelation(RelationName name) {
        Objects.requireNonNull(name, "name must not be null");
        executor.executeUpdate("dropRelation", "DROP TABLE IF EXISTS " + name.toSQL());
    }
}
