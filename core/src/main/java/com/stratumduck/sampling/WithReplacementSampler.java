package com.stratumduck.sampling;

import com.stratumduck.backend.DataBackend;
import com.stratumduck.backend.RelationName;
import com.stratumduck.exception.ConsistencyException;
import com.stratumduck.logging.SamplingLogger;
import com.stratumduck.logical.PartitionedRowNumber;
import com.stratumduck.logical.StratumJoin;
import com.stratumduck.logical.TableScan;
import com.stratumduck.logical.UniformDraws;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Samples rows with replacement by drawing row numbers.
 *
 * <p>Rows are numbered 1..n within each stratum, then {@code floor(p * n)}
 * independent uniform indices in [1, n] are drawn per stratum and joined back
 * to the numbered rows. Each draw yields exactly one output row; a row appears
 * several times when its index is drawn several times.
 *
 * <p>After the join the number of output rows is compared with the number of
 * draws. A difference means stratum sizes and numbering disagreed, and is
 * reported as a {@link ConsistencyException} naming the stratum.
 */
public class WithReplacementSampler implements SamplingStrategy {

    private final boolean verifyDraws;

    public WithReplacementSampler(boolean verifyDraws) {
        this.verifyDraws = verifyDraws;
    }

    @Override
    public void sample(SamplingPlan plan, StagingArea staging) {
        String rank = staging.column("rank");
        RelationName ranked = staging.materialize("ranked",
            new PartitionedRowNumber(new TableScan(plan.source()), plan.keys(), rank,
                plan.seed().isPresent()));

        String count = staging.column("count");
        String draw = staging.column("draw");
        RelationName draws = staging.materialize("draws",
            new UniformDraws(new TableScan(ranked), plan.keys(), plan.proportion().value(),
                count, draw, plan.seed()));

        staging.materializeOutput("join", plan.output(),
            new StratumJoin(new TableScan(ranked), new TableScan(draws), plan.keys(),
                rank, StratumJoin.Comparison.EQUAL, draw, plan.outputColumns()));

        if (verifyDraws) {
            SamplingLogger.enterStage("verify");
            verify(staging.backend(), draws, plan.output(), plan.keys());
        }
    }

    /**
     * Checks that every draw resolved to exactly one row.
     *
     * @throws ConsistencyException if any stratum's output size differs from its draw count
     */
    static void verify(DataBackend backend, RelationName draws, RelationName output, List<String> keys) {
        long expected = backend.rowCount(draws);
        long actual = backend.rowCount(output);
        if (expected == actual) {
            return;
        }

        Map<List<Object>, Long> drawCounts = backend.rowCounts(draws, keys);
        Map<List<Object>, Long> outputCounts = backend.rowCounts(output, keys);
        Set<List<Object>> strata = new HashSet<>(drawCounts.keySet());
        strata.addAll(outputCounts.keySet());
        for (List<Object> stratum : strata) {
            long drawn = drawCounts.getOrDefault(stratum, 0L);
            long resolved = outputCounts.getOrDefault(stratum, 0L);
            if (!Objects.equals(drawn, resolved)) {
                throw new ConsistencyException(stratum, drawn, resolved);
            }
        }
        throw new ConsistencyException(String.format(
            "Draws resolved to %d rows, expected %d", actual, expected));
    }

    @Override
    public String name() {
        return "with-replacement";
    }
}
