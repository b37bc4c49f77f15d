package com.stratumduck.sampling;

import com.stratumduck.backend.RelationName;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A validated, fully resolved sampling invocation.
 */
public final class SamplingPlan {

    private final RelationName source;
    private final RelationName output;
    private final Proportion proportion;
    private final List<String> keys;
    private final List<String> outputColumns;
    private final boolean withReplacement;
    private final OptionalLong seed;

    public SamplingPlan(RelationName source, RelationName output, Proportion proportion,
                        List<String> keys, List<String> outputColumns,
                        boolean withReplacement, OptionalLong seed) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.output = Objects.requireNonNull(output, "output must not be null");
        this.proportion = Objects.requireNonNull(proportion, "proportion must not be null");
        this.keys = List.copyOf(keys);
        this.outputColumns = List.copyOf(outputColumns);
        this.withReplacement = withReplacement;
        this.seed = Objects.requireNonNull(seed, "seed must not be null");
    }

    public RelationName source() {
        return source;
    }

    public RelationName output() {
        return output;
    }

    public Proportion proportion() {
        return proportion;
    }

    /**
     * Returns the stratification keys; empty for the implicit global stratum.
     */
    public List<String> keys() {
        return keys;
    }

    public boolean isGrouped() {
        return !keys.isEmpty();
    }

    public List<String> outputColumns() {
        return outputColumns;
    }

    public boolean withReplacement() {
        return withReplacement;
    }

    public OptionalLong seed() {
        return seed;
    }

    @Override
    public String toString() {
        return String.format("SamplingPlan(%s -> %s, proportion=%s, keys=%s, columns=%s, withReplacement=%s)",
            source, output, proportion, keys, outputColumns, withReplacement);
    }
}
