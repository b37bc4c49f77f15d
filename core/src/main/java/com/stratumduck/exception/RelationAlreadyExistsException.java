package com.stratumduck.exception;

/**
 * Thrown when the requested output relation already exists.
 */
public class RelationAlreadyExistsException extends SamplingException {

    private final String relation;

    public RelationAlreadyExistsException(String relation) {
        super(Kind.ALREADY_EXISTS, "Output relation already exists: " + relation);
        this.relation = relation;
    }

    public String relation() {
        return relation;
    }
}
