package com.stratumduck.runtime;

import com.stratumduck.exception.BackendException;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes SQL statements against DuckDB on behalf of the data backend.
 *
 * <p>Each QueryExecutor is bound to a specific {@link DuckDBRuntime}. Every
 * call is tagged with an operation name ("createRelation", "rowCounts", ...)
 * which is carried into the {@link BackendException} raised on failure, so a
 * caller can tell which pass of a sampling invocation broke.
 *
 * <p>Features:
 * <ul>
 *   <li>DDL/DML execution (CREATE TABLE AS, DROP TABLE)</li>
 *   <li>Scalar and row-list queries with bound parameters</li>
 *   <li>Statement timing at DEBUG level</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   QueryExecutor executor = new QueryExecutor(runtime);
 *   executor.executeUpdate("dropRelation", "DROP TABLE IF EXISTS \"tmp\"");
 *   long n = executor.queryForLong("rowCount", "SELECT COUNT(*) FROM \"sales\"");
 * </pre>
 *
 * @see DuckDBRuntime
 */
public class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final DuckDBRuntime runtime;

    /**
     * Creates a query executor with the specified runtime.
     *
     * @param runtime the DuckDB runtime
     */
    public QueryExecutor(DuckDBRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
    }

    /**
     * Executes an update/DDL statement.
     *
     * @param operation the backend operation name, used in error reports
     * @param sql the SQL statement to execute
     * @return the number of rows affected (for DML), or 0 (for DDL)
     * @throws BackendException if statement execution fails
     */
    public int executeUpdate(String operation, String sql) {
        Objects.requireNonNull(sql, "sql must not be null");

        DuckDBConnection conn = runtime.getConnection();
        long start = System.nanoTime();

        try (Statement stmt = conn.createStatement()) {
            int affected = stmt.executeUpdate(sql);
            logTiming(operation, sql, start);
            return affected;
        } catch (SQLException e) {
            throw new BackendException(operation,
                "Failed to execute update: " + e.getMessage(), e, sql);
        }
    }

    /**
     * Executes a query returning a single numeric value.
     *
     * @param operation the backend operation name, used in error reports
     * @param sql the query, with {@code ?} placeholders for {@code params}
     * @param params values bound to the placeholders in order
     * @return the value of the first column of the first row, or 0 if the result is empty or NULL
     * @throws BackendException if query execution fails
     */
    public long queryForLong(String operation, String sql, Object... params) {
        List<List<Object>> rows = queryForRows(operation, sql, params);
        if (rows.isEmpty() || rows.get(0).get(0) == null) {
            return 0L;
        }
        return ((Number) rows.get(0).get(0)).longValue();
    }

    /**
     * Executes a query and collects every row as a list of column values.
     *
     * <p>Only intended for metadata and per-stratum summaries, never for the
     * rows of the relation being sampled.
     *
     * @param operation the backend operation name, used in error reports
     * @param sql the query, with {@code ?} placeholders for {@code params}
     * @param params values bound to the placeholders in order
     * @return the rows, in result order
     * @throws BackendException if query execution fails
     */
    public List<List<Object>> queryForRows(String operation, String sql, Object... params) {
        Objects.requireNonNull(sql, "sql must not be null");

        DuckDBConnection conn = runtime.getConnection();
        long start = System.nanoTime();

        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            List<List<Object>> rows = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                int columnCount = rs.getMetaData().getColumnCount();
                while (rs.next()) {
                    List<Object> row = new ArrayList<>(columnCount);
                    for (int col = 1; col <= columnCount; col++) {
                        row.add(rs.getObject(col));
                    }
                    rows.add(row);
                }
            }
            logTiming(operation, sql, start);
            return rows;
        } catch (SQLException e) {
            throw new BackendException(operation,
                "Failed to execute query: " + e.getMessage(), e, sql);
        }
    }

    private void logTiming(String operation, String sql, long startNanos) {
        if (logger.isDebugEnabled()) {
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            logger.debug("{} completed in {} ms: {}", operation, elapsedMs, sql);
        }
    }
}
