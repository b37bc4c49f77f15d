package com.stratumduck.runtime;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DuckDB runtime - owns a single DuckDB connection.
 *
 * <p>Each DuckDBRuntime instance manages one DuckDB connection. The runtime
 * is responsible for creating, configuring, and closing the connection.
 * A single connection executes statements sequentially, so one runtime
 * should serve one sampling invocation at a time.
 *
 * <p>Typical usage:
 * <pre>{@code
 * try (DuckDBRuntime runtime = DuckDBRuntime.createPersistent("/data/warehouse.duckdb")) {
 *     StratifiedSampler sampler = new StratifiedSampler(new DuckDBDataBackend(runtime));
 *     sampler.sample("sales", "sales_sample", 0.1);
 * }
 * }</pre>
 *
 * <p>Test usage:
 * <pre>{@code
 * @BeforeEach
 * void setup() {
 *     runtime = DuckDBRuntime.create("jdbc:duckdb::memory:test_" + System.nanoTime());
 * }
 *
 * @AfterEach
 * void teardown() {
 *     runtime.close();
 * }
 * }</pre>
 */
public class DuckDBRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBRuntime.class);

    /** Default JDBC URL for named in-memory database */
    public static final String DEFAULT_JDBC_URL = "jdbc:duckdb::memory:stratumduck";

    private final String jdbcUrl;
    private final DuckDBConnection connection;
    private final HardwareProfile hardware;
    private volatile boolean closed = false;

    /**
     * Private constructor - use create() factory method.
     *
     * @param jdbcUrl JDBC URL for DuckDB connection
     * @throws SQLException if connection fails
     */
    private DuckDBRuntime(String jdbcUrl) throws SQLException {
        this.jdbcUrl = jdbcUrl;
        this.hardware = HardwareProfile.detect();

        logger.info("Creating DuckDB runtime with URL: {}", jdbcUrl);

        Connection rawConn = DriverManager.getConnection(jdbcUrl);
        this.connection = rawConn.unwrap(DuckDBConnection.class);
        try {
            configureConnection();
        } catch (SQLException e) {
            connection.close();
            throw e;
        }

        logger.info("DuckDB runtime initialized: {}", hardware);
    }

    /**
     * Configure connection for bulk sampling workloads.
     *
     * <p>Configuration includes:
     * <ul>
     *   <li>Memory limit based on hardware profile</li>
     *   <li>Thread count based on available cores</li>
     *   <li>Insertion order not preserved, so scans and joins parallelize freely</li>
     * </ul>
     */
    private void configureConnection() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(String.format("SET memory_limit='%s'",
                hardware.recommendedMemoryLimit()));

            stmt.execute(String.format("SET threads=%d",
                hardware.recommendedThreadCount()));

            stmt.execute("SET enable_progress_bar=false");

            // Sampling output is an unordered multiset
            stmt.execute("SET preserve_insertion_order=false");

            logger.debug("DuckDB configured: memory={}, threads={}, cores={}",
                hardware.recommendedMemoryLimit(), hardware.recommendedThreadCount(),
                hardware.cpuCores());
        }
    }

    /**
     * Create a new DuckDBRuntime with the default JDBC URL.
     *
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if connection fails
     */
    public static DuckDBRuntime create() {
        return create(DEFAULT_JDBC_URL);
    }

    /**
     * Create a new DuckDBRuntime with custom JDBC URL.
     *
     * @param jdbcUrl JDBC URL (e.g., "jdbc:duckdb::memory:session123")
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if connection fails
     */
    public static DuckDBRuntime create(String jdbcUrl) {
        try {
            return new DuckDBRuntime(jdbcUrl);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create DuckDB runtime: " + jdbcUrl, e);
        }
    }

    /**
     * Create a new DuckDBRuntime with a persistent on-disk database.
     *
     * <p>The database file will be created if it doesn't exist.
     *
     * @param dbPath path to the DuckDB database file (e.g., "/path/to/database.duckdb")
     * @return new DuckDBRuntime instance
     * @throws IllegalStateException if connection fails
     */
    public static DuckDBRuntime createPersistent(String dbPath) {
        String jdbcUrl = "jdbc:duckdb:" + dbPath;
        logger.info("Creating persistent DuckDB runtime at: {}", dbPath);
        return create(jdbcUrl);
    }

    /**
     * Get the underlying DuckDB connection.
     *
     * <p>The connection is managed by the runtime - callers should NOT close it.
     *
     * @return the DuckDB connection
     * @throws IllegalStateException if runtime is closed
     */
    public DuckDBConnection getConnection() {
        if (closed) {
            throw new IllegalStateException("DuckDB runtime is closed");
        }
        return connection;
    }

    public HardwareProfile getHardwareProfile() {
        return hardware;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Close the runtime and release resources.
     *
     * <p>After closing, the runtime cannot be used.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        logger.info("Closing DuckDB runtime: {}", jdbcUrl);
        try {
            connection.close();
        } catch (SQLException e) {
            logger.error("Error closing DuckDB connection", e);
        }
    }
}
