package com.stratumduck.sampling;

import com.stratumduck.backend.DataBackend;
import com.stratumduck.logging.SamplingLogger;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point of the stratified sampling engine.
 *
 * <p>Selects a proportion of the rows of each stratum of a source relation
 * into a new output relation, with or without replacement. All row-level work
 * runs inside the backend; the sampler issues a fixed, small number of bulk
 * operations per call.
 *
 * <p>Example usage:
 * <pre>
 *   try (DuckDBRuntime runtime = DuckDBRuntime.create()) {
 *       StratifiedSampler sampler = new StratifiedSampler(new DuckDBDataBackend(runtime));
 *
 *       // 10% of each region, without replacement
 *       sampler.sample("sales", "sales_by_region", 0.1, List.of("region"), null, false);
 *
 *       // reproducible bootstrap sample
 *       sampler.sample(SamplingRequest.builder("sales", "sales_boot", 1.0)
 *           .withReplacement(true)
 *           .seed(7L)
 *           .build());
 *   }
 * </pre>
 *
 * <p>Failures are reported as subclasses of
 * {@link com.stratumduck.exception.SamplingException}; a failed call leaves no
 * output or staging relation behind.
 */
public class StratifiedSampler {

    private final SamplingValidator validator;
    private final SamplingExecutor executor;
    private final SamplerConfig config;

    /**
     * Creates a sampler configured from system properties.
     *
     * @param backend the data backend
     */
    public StratifiedSampler(DataBackend backend) {
        this(backend, SamplerConfig.fromSystemProperties());
    }

    public StratifiedSampler(DataBackend backend, SamplerConfig config) {
        Objects.requireNonNull(backend, "backend must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.validator = new SamplingValidator(backend);
        this.executor = new SamplingExecutor(backend, config);
    }

    /**
     * Samples without grouping, without replacement, projecting all columns.
     */
    public void sample(String source, String output, double proportion) {
        sample(SamplingRequest.builder(source, output, proportion).build());
    }

    /**
     * Samples a proportion of each stratum.
     *
     * @param source source relation name
     * @param output output relation name; must not exist
     * @param proportion fraction of each stratum, in (0, 1]
     * @param groupingKeys stratification keys; null or empty for no grouping
     * @param targetColumns columns to project; null, empty or {@code ["*"]} for all non-key columns
     * @param withReplacement whether rows may be selected more than once
     */
    public void sample(String source, String output, double proportion,
                       List<String> groupingKeys, List<String> targetColumns,
                       boolean withReplacement) {
        sample(SamplingRequest.builder(source, output, proportion)
            .groupingKeys(groupingKeys)
            .targetColumns(targetColumns)
            .withReplacement(withReplacement)
            .build());
    }

    /**
     * Runs a sampling request.
     *
     * @param request the request
     * @throws com.stratumduck.exception.SamplingException if validation or execution fails
     */
    public void sample(SamplingRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        String invocationId = "s_" + UUID.randomUUID().toString().substring(0, 8);
        SamplingLogger.startInvocation(invocationId, request.source(), request.output());
        long start = System.nanoTime();

        try {
            SamplingPlan plan = plan(request);
            SamplingStrategy strategy = plan.withReplacement()
                ? new WithReplacementSampler(config.verifyDraws())
                : new WithoutReplacementSelector();

            long rows = executor.execute(plan, strategy);
            SamplingLogger.completeInvocation(rows, (System.nanoTime() - start) / 1_000_000);
        } catch (RuntimeException e) {
            SamplingLogger.logError(e);
            throw e;
        } finally {
            SamplingLogger.clearContext();
        }
    }

    /**
     * Validates a request and resolves it into a plan without running it.
     *
     * @param request the request
     * @return the plan
     */
    public SamplingPlan plan(SamplingRequest request) {
        SamplingValidator.ValidatedRequest validated = validator.validate(request);
        List<String> keys = GroupResolver.resolve(request.groupingKeys(), validated.schema());
        List<String> columns = ColumnProjector.project(request.targetColumns(), keys, validated.schema());
        return new SamplingPlan(validated.source(), validated.output(), validated.proportion(),
            keys, columns, request.withReplacement(), request.seed());
    }
}
