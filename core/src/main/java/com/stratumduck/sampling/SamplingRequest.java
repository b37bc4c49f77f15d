package com.stratumduck.sampling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

/**
 * Arguments of one sampling invocation, as supplied by the caller.
 *
 * <p>Nothing is checked here; {@link SamplingValidator} decides whether the
 * request can run.
 *
 * <pre>
 *   SamplingRequest request = SamplingRequest.builder("sales", "sales_sample", 0.1)
 *       .groupingKeys(List.of("region", "year"))
 *       .targetColumns(List.of("id", "amount"))
 *       .withReplacement(true)
 *       .seed(42L)
 *       .build();
 * </pre>
 */
public final class SamplingRequest {

    private final String source;
    private final String output;
    private final double proportion;
    private final List<String> groupingKeys;
    private final List<String> targetColumns;
    private final boolean withReplacement;
    private final OptionalLong seed;

    private SamplingRequest(Builder builder) {
        this.source = builder.source;
        this.output = builder.output;
        this.proportion = builder.proportion;
        this.groupingKeys = Collections.unmodifiableList(new ArrayList<>(builder.groupingKeys));
        this.targetColumns = builder.targetColumns == null
            ? null
            : Collections.unmodifiableList(new ArrayList<>(builder.targetColumns));
        this.withReplacement = builder.withReplacement;
        this.seed = builder.seed;
    }

    public static Builder builder(String source, String output, double proportion) {
        return new Builder(source, output, proportion);
    }

    public String source() {
        return source;
    }

    public String output() {
        return output;
    }

    public double proportion() {
        return proportion;
    }

    /**
     * Returns the stratification keys; empty means one global stratum.
     */
    public List<String> groupingKeys() {
        return groupingKeys;
    }

    /**
     * Returns the explicit target columns, or null when all non-key columns
     * should be projected.
     */
    public List<String> targetColumns() {
        return targetColumns;
    }

    public boolean withReplacement() {
        return withReplacement;
    }

    public OptionalLong seed() {
        return seed;
    }

    @Override
    public String toString() {
        return String.format(
            "SamplingRequest(source=%s, output=%s, proportion=%s, keys=%s, targets=%s, withReplacement=%s, seed=%s)",
            source, output, proportion, groupingKeys, targetColumns, withReplacement,
            seed.isPresent() ? String.valueOf(seed.getAsLong()) : "none");
    }

    /**
     * Builder for {@link SamplingRequest}.
     */
    public static final class Builder {
        private final String source;
        private final String output;
        private final double proportion;
        private List<String> groupingKeys = List.of();
        private List<String> targetColumns;
        private boolean withReplacement;
        private OptionalLong seed = OptionalLong.empty();

        private Builder(String source, String output, double proportion) {
            this.source = source;
            this.output = output;
            this.proportion = proportion;
        }

        /**
         * Sets the stratification keys; null or empty means no grouping.
         */
        public Builder groupingKeys(List<String> keys) {
            this.groupingKeys = keys == null ? List.of() : keys;
            return this;
        }

        /**
         * Sets the target columns; null, empty or {@code ["*"]} selects all
         * non-key columns.
         */
        public Builder targetColumns(List<String> columns) {
            this.targetColumns = columns;
            return this;
        }

        public Builder withReplacement(boolean withReplacement) {
            this.withReplacement = withReplacement;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = OptionalLong.of(seed);
            return this;
        }

        public SamplingRequest build() {
            return new SamplingRequest(this);
        }
    }
}
