package com.stratumduck.exception;

/**
 * Thrown when a request argument is malformed: an empty relation identifier,
 * or a proportion outside (0, 1].
 */
public class InvalidArgumentException extends SamplingException {

    public InvalidArgumentException(String message) {
        super(Kind.INVALID_ARGUMENT, message);
    }
}
