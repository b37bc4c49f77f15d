package com.stratumduck.exception;

/**
 * Thrown when the source relation exists but holds no rows.
 */
public class EmptyInputException extends SamplingException {

    private final String relation;

    public EmptyInputException(String relation) {
        super(Kind.EMPTY_INPUT, "Source relation is empty: " + relation);
        this.relation = relation;
    }

    public String relation() {
        return relation;
    }
}
