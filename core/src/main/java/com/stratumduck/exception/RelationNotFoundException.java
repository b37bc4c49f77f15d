package com.stratumduck.exception;

/**
 * Thrown when the source relation does not exist.
 */
public class RelationNotFoundException extends SamplingException {

    private final String relation;

    public RelationNotFoundException(String relation) {
        super(Kind.NOT_FOUND, "Source relation does not exist: " + relation);
        this.relation = relation;
    }

    public String relation() {
        return relation;
    }
}
