package com.stratumduck.sampling;

import com.stratumduck.backend.DataBackend;
import com.stratumduck.backend.RelationName;
import com.stratumduck.exception.BackendException;
import com.stratumduck.exception.ConsistencyException;
import com.stratumduck.logical.LogicalPlan;
import com.stratumduck.logical.OrderedLimit;
import com.stratumduck.logical.TableScan;
import com.stratumduck.test.DuckDBTestBase;
import com.stratumduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests cleanup guarantees: whatever fails, no staging or output relation
 * survives and the original error reaches the caller unchanged.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Sampling Executor Cleanup Tests")
public class SamplingExecutorTest extends DuckDBTestBase {

    @Override
    protected void setUpData() {
        createStratifiedTable("src", 12, 6);
    }

    /**
     * Delegates to the real backend but fails selected operations.
     */
    private static class FailingBackend implements DataBackend {
        private final DataBackend delegate;
        private final Predicate<RelationName> failCreate;
        private boolean failDrops;
        private Predicate<RelationName> failRowCount = name -> false;
        private Consumer<RelationName> beforeCreate = name -> { };

        FailingBackend(DataBackend delegate, Predicate<RelationName> failCreate) {
            this.delegate = delegate;
            this.failCreate = failCreate;
        }

        private BackendException failure(String operation) {
            return new BackendException(operation, "IO Error: injected failure",
                new SQLException("injected"), null);
        }

        @Override
        public boolean relationExists(RelationName name) {
            return delegate.relationExists(name);
        }

        @Override
        public boolean isEmpty(RelationName name) {
            return delegate.isEmpty(name);
        }

        @Override
        public List<String> columns(RelationName name) {
            return delegate.columns(name);
        }

        @Override
        public long rowCount(RelationName name) {
            if (failRowCount.test(name)) {
                throw failure("rowCount");
            }
            return delegate.rowCount(name);
        }

        @Override
        public Map<List<Object>, Long> rowCounts(RelationName name, List<String> groupBy) {
            return delegate.rowCounts(name, groupBy);
        }

        @Override
        public void createRelation(RelationName name, LogicalPlan plan) {
            beforeCreate.accept(name);
            if (failCreate.test(name)) {
                throw failure("createRelation");
            }
            delegate.createRelation(name, plan);
        }

        @Override
        public void dropRelation(RelationName name) {
            if (failDrops) {
                throw failure("dropRelation");
            }
            delegate.dropRelation(name);
        }
    }

    private SamplingPlan plan(boolean withReplacement) {
        return new StratifiedSampler(backend, SamplerConfig.defaults()).plan(
            SamplingRequest.builder("src", "out", 0.5)
                .groupingKeys(List.of("stratum"))
                .withReplacement(withReplacement)
                .build());
    }

    @Test
    @DisplayName("Failure in a middle pass drops earlier staging relations")
    void testFailureMidPipeline() {
        logStep("Given: a backend failing to create the thresholds relation");
        FailingBackend failing = new FailingBackend(backend, name -> name.table().endsWith("_thresholds"));
        SamplingExecutor executor = new SamplingExecutor(failing, SamplerConfig.defaults());

        logStep("When: executing without replacement");
        assertThatThrownBy(() -> executor.execute(plan(false), new WithoutReplacementSelector()))
            .isInstanceOf(BackendException.class)
            .hasMessageContaining("injected");

        logStep("Then: nothing but the source remains");
        assertThat(stagingRelations()).isEmpty();
        assertThat(exists("out")).isFalse();
        assertThat(count("src")).isEqualTo(18);
    }

    @Test
    @DisplayName("Output created before a later failure is dropped")
    void testCreatedOutputDropped() {
        FailingBackend failing = new FailingBackend(backend, name -> false);
        failing.failRowCount = name -> name.table().equals("out");
        SamplingExecutor executor = new SamplingExecutor(failing, SamplerConfig.defaults());

        assertThatThrownBy(() -> executor.execute(plan(true), new WithReplacementSampler(false)))
            .isInstanceOf(BackendException.class)
            .satisfies(e -> assertThat(((BackendException) e).getOperation()).isEqualTo("rowCount"));

        assertThat(exists("out")).isFalse();
        assertThat(stagingRelations()).isEmpty();
    }

    @Test
    @DisplayName("Output created concurrently by another writer is left alone")
    void testForeignOutputKept() {
        logStep("Given: another writer creates the output after validation");
        FailingBackend failing = new FailingBackend(backend, name -> false);
        failing.beforeCreate = name -> {
            if (name.table().endsWith("_labeled")) {
                sql("CREATE TABLE out AS SELECT 42 AS marker");
            }
        };
        SamplingExecutor executor = new SamplingExecutor(failing, SamplerConfig.defaults());

        logStep("When: the final create collides with it");
        assertThatThrownBy(() -> executor.execute(plan(false), new WithoutReplacementSelector()))
            .isInstanceOf(BackendException.class)
            .hasMessageContaining("already exists");

        logStep("Then: the other writer's relation survives intact");
        assertThat(rows("SELECT marker FROM out")).containsExactly(List.of(42));
        assertThat(stagingRelations()).isEmpty();
    }

    @Test
    @DisplayName("Cleanup failures are attached to the original error")
    void testCleanupFailureSuppressed() {
        FailingBackend failing = new FailingBackend(backend, name -> name.table().endsWith("_draws"));
        failing.failDrops = true;
        SamplingExecutor executor = new SamplingExecutor(failing, SamplerConfig.defaults());

        Throwable thrown = catchThrowable(() -> executor.execute(plan(true), new WithReplacementSampler(true)));

        assertThat(thrown).isInstanceOf(BackendException.class);
        assertThat(((BackendException) thrown).getOperation()).isEqualTo("createRelation");
        assertThat(thrown.getSuppressed()).isNotEmpty();
        assertThat(((BackendException) thrown.getSuppressed()[0]).getOperation()).isEqualTo("dropRelation");
    }

    @Test
    @DisplayName("Consistency failure drops the output and staging relations")
    void testConsistencyFailureCleansUp() {
        logStep("Given: a strategy whose draws cannot all be resolved");
        SamplingStrategy broken = new SamplingStrategy() {
            @Override
            public void sample(SamplingPlan plan, StagingArea staging) {
                staging.materialize("draws", new TableScan(plan.source()));
                // ids 1..12 are exactly stratum s1
                staging.materializeOutput("join", plan.output(),
                    new OrderedLimit(new TableScan(plan.source()), "id", 12, plan.outputColumns()));
                WithReplacementSampler.verify(staging.backend(), staging.relation("draws"),
                    plan.output(), plan.keys());
            }

            @Override
            public String name() {
                return "broken";
            }
        };

        SamplingExecutor executor = new SamplingExecutor(backend, SamplerConfig.defaults());
        assertThatThrownBy(() -> executor.execute(plan(true), broken))
            .isInstanceOf(ConsistencyException.class)
            .satisfies(e -> {
                ConsistencyException ce = (ConsistencyException) e;
                assertThat(ce.stratum()).containsExactly("s2");
                assertThat(ce.expected()).isEqualTo(6);
                assertThat(ce.actual()).isEqualTo(0);
            });

        assertThat(exists("out")).isFalse();
        assertThat(stagingRelations()).isEmpty();
    }

    @Test
    @DisplayName("Successful execution returns the output size and leaves no staging")
    void testSuccess() {
        SamplingExecutor executor = new SamplingExecutor(backend, SamplerConfig.defaults());

        long rows = executor.execute(plan(true), new WithReplacementSampler(true));

        assertThat(rows).isEqualTo(9);
        assertThat(count("out")).isEqualTo(9);
        assertThat(stagingRelations()).isEmpty();
    }
}
