package com.stratumduck.sampling;

/**
 * One way of selecting rows per stratum.
 *
 * <p>An implementation issues a fixed number of bulk operations through the
 * staging area and leaves the result in {@link SamplingPlan#output()}. It does
 * not clean up; {@link SamplingExecutor} drops staging relations and, on
 * failure, the output.
 */
public interface SamplingStrategy {

    /**
     * Runs the strategy.
     *
     * @param plan the resolved invocation
     * @param staging the invocation's staging area
     */
    void sample(SamplingPlan plan, StagingArea staging);

    /**
     * Returns a short name for logs.
     */
    String name();
}
