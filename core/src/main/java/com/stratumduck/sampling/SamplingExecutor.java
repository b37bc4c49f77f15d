package com.stratumduck.sampling;

import com.stratumduck.backend.DataBackend;
import com.stratumduck.exception.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs a sampling strategy against the backend and guarantees cleanup.
 *
 * <p>Staging relations are dropped whether the strategy succeeds or fails.
 * If anything fails, including staging cleanup, the output relation is
 * dropped as well before the original exception is rethrown, so a failed
 * invocation leaves the backend as it found it. Only an output this
 * invocation created is dropped; a relation that appeared under the output
 * name after validation belongs to someone else and is left alone. Cleanup failures never
 * replace the original exception; they are attached to it as suppressed.
 */
public class SamplingExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SamplingExecutor.class);

    private final DataBackend backend;
    private final SamplerConfig config;

    public SamplingExecutor(DataBackend backend, SamplerConfig config) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Executes a plan with a strategy.
     *
     * @param plan the validated plan
     * @param strategy the strategy to run
     * @return the number of rows in the output relation
     */
    public long execute(SamplingPlan plan, SamplingStrategy strategy) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");

        logger.debug("Executing {} with {}", plan, strategy.name());
        StagingArea staging = new StagingArea(backend, plan.source(), config.stagingPrefix());
        try {
            try (staging) {
                strategy.sample(plan, staging);
            }
            return backend.rowCount(plan.output());
        } catch (RuntimeException e) {
            if (staging.outputCreated()) {
                dropOutput(plan, e);
            }
            throw e;
        }
    }

    private void dropOutput(SamplingPlan plan, RuntimeException original) {
        try {
            backend.dropRelation(plan.output());
        } catch (BackendException dropFailure) {
            logger.error("Failed to drop partial output {}", plan.output(), dropFailure);
            original.addSuppressed(dropFailure);
        }
    }
}
