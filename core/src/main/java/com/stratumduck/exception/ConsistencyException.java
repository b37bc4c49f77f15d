package com.stratumduck.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when the draws generated for a stratum cannot all be resolved to a
 * ranked row, meaning the row count used for drawing and the ranking pass
 * disagree. Fatal to the invocation and never retried.
 */
public class ConsistencyException extends SamplingException {

    private final List<Object> stratum;
    private final long expected;
    private final long actual;

    /**
     * Creates a consistency exception for a single stratum.
     *
     * @param stratum the key values of the divergent stratum (empty for the global stratum)
     * @param expected number of draws generated for the stratum
     * @param actual number of rows the draws resolved to
     */
    public ConsistencyException(List<Object> stratum, long expected, long actual) {
        super(Kind.CONSISTENCY_ERROR, String.format(
            "Draws for stratum %s resolved to %d rows, expected %d",
            stratum, actual, expected));
        // key values may be NULL
        this.stratum = Collections.unmodifiableList(new ArrayList<>(stratum));
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * Creates a consistency exception when totals diverge but no single stratum
     * could be identified.
     */
    public ConsistencyException(String message) {
        super(Kind.CONSISTENCY_ERROR, message);
        this.stratum = List.of();
        this.expected = -1;
        this.actual = -1;
    }

    public List<Object> stratum() {
        return stratum;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}
