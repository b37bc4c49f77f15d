package com.stratumduck.exception;

import java.util.List;

/**
 * Thrown when grouping keys or target columns are not part of the source
 * relation's schema.
 *
 * <p>All unknown columns are reported at once, together with the columns the
 * source actually has:
 * <pre>
 *   Unknown columns [regoin] in relation "sales". Available columns: [id, region, amount]
 * </pre>
 */
public class SchemaMismatchException extends SamplingException {

    private final List<String> unknownColumns;
    private final List<String> availableColumns;

    /**
     * Creates a schema mismatch exception.
     *
     * @param relation the relation that was inspected
     * @param unknownColumns the requested columns that do not exist
     * @param availableColumns the columns the relation has
     */
    public SchemaMismatchException(String relation, List<String> unknownColumns,
                                   List<String> availableColumns) {
        super(Kind.SCHEMA_MISMATCH, String.format(
            "Unknown columns %s in relation %s. Available columns: %s",
            unknownColumns, relation, availableColumns));
        this.unknownColumns = List.copyOf(unknownColumns);
        this.availableColumns = List.copyOf(availableColumns);
    }

    public List<String> unknownColumns() {
        return unknownColumns;
    }

    public List<String> availableColumns() {
        return availableColumns;
    }
}
