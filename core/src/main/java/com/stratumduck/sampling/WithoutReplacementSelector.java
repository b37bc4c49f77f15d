package com.stratumduck.sampling;

import com.stratumduck.backend.RelationName;
import com.stratumduck.logical.NearestRankThreshold;
import com.stratumduck.logical.OrderedLimit;
import com.stratumduck.logical.RandomLabel;
import com.stratumduck.logical.StratumJoin;
import com.stratumduck.logical.TableScan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects rows without replacement by random labeling.
 *
 * <p>Every row gets an independent uniform label. For grouped input, the
 * label at nearest rank {@code ceil(p * n)} of each stratum becomes that
 * stratum's threshold and every row whose label is at most its threshold is
 * kept, so a stratum of size {@code n} contributes {@code ceil(p * n)} rows
 * (more only on exact label ties) and a singleton stratum is never lost.
 *
 * <p>Without grouping keys the rows are ordered by label and the first
 * {@code floor(p * total)} are kept.
 */
public class WithoutReplacementSelector implements SamplingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(WithoutReplacementSelector.class);

    @Override
    public void sample(SamplingPlan plan, StagingArea staging) {
        String label = staging.column("label");
        RelationName labeled = staging.materialize("labeled",
            new RandomLabel(new TableScan(plan.source()), label, plan.seed()));

        if (!plan.isGrouped()) {
            long total = staging.backend().rowCount(labeled);
            long desired = plan.proportion().floorCount(total);
            logger.debug("Ungrouped selection: keeping {} of {} rows", desired, total);
            staging.materializeOutput("select", plan.output(),
                new OrderedLimit(new TableScan(labeled), label, desired, plan.outputColumns()));
            return;
        }

        String threshold = staging.column("threshold");
        RelationName thresholds = staging.materialize("thresholds",
            new NearestRankThreshold(new TableScan(labeled), plan.keys(), label,
                plan.proportion().value(), threshold));

        staging.materializeOutput("select", plan.output(),
            new StratumJoin(new TableScan(labeled), new TableScan(thresholds), plan.keys(),
                label, StratumJoin.Comparison.LESS_OR_EQUAL, threshold, plan.outputColumns()));
    }

    @Override
    public String name() {
        return "without-replacement";
    }
}
