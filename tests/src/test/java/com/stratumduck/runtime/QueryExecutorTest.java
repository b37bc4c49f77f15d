package com.stratumduck.runtime;

import com.stratumduck.exception.BackendException;
import com.stratumduck.test.DuckDBTestBase;
import com.stratumduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Query Executor Tests")
public class QueryExecutorTest extends DuckDBTestBase {

    @Test
    void testQueryForLongBindsParameters() {
        sql("CREATE TABLE t AS SELECT i AS x FROM range(10) t(i)");

        assertThat(executor.queryForLong("test", "SELECT COUNT(*) FROM t WHERE x >= ?", 4)).isEqualTo(6);
        assertThat(executor.queryForLong("test", "SELECT MAX(x) FROM t WHERE x < 0")).isZero();
    }

    @Test
    void testQueryForRows() {
        List<List<Object>> rows = executor.queryForRows("test",
            "SELECT * FROM (VALUES (1, 'a'), (2, NULL)) v(n, s) ORDER BY n");

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).containsExactly(1, "a");
        assertThat(rows.get(1)).containsExactly(2, null);
    }

    @Test
    void testFailureCarriesOperationAndSQL() {
        assertThatThrownBy(() -> executor.executeUpdate("dropRelation", "DROP TABLE missing_table"))
            .isInstanceOf(BackendException.class)
            .satisfies(e -> {
                BackendException be = (BackendException) e;
                assertThat(be.getOperation()).isEqualTo("dropRelation");
                assertThat(be.getFailedSQL()).isEqualTo("DROP TABLE missing_table");
                assertThat(be.getCause()).isInstanceOf(java.sql.SQLException.class);
                assertThat(be.getUserMessage()).contains("dropRelation");
            });
    }

    @Test
    void testClosedRuntime() {
        runtime.close();
        assertThatThrownBy(() -> executor.queryForLong("test", "SELECT 1"))
            .isInstanceOf(IllegalStateException.class);
    }
}
