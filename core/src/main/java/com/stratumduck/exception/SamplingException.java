package com.stratumduck.exception;

import java.util.Objects;

/**
 * Base class for every failure reported by the sampling engine.
 *
 * <p>Each subclass corresponds to exactly one {@link Kind}, so callers can
 * either catch a specific subclass or switch on {@link #kind()}:
 * <pre>
 *   try {
 *       sampler.sample(request);
 *   } catch (SamplingException e) {
 *       if (e.kind() == SamplingException.Kind.ALREADY_EXISTS) {
 *           // choose another output name
 *       }
 *   }
 * </pre>
 */
public abstract class SamplingException extends RuntimeException {

    /**
     * Failure categories.
     */
    public enum Kind {
        INVALID_ARGUMENT,
        ALREADY_EXISTS,
        NOT_FOUND,
        EMPTY_INPUT,
        SCHEMA_MISMATCH,
        CONSISTENCY_ERROR,
        BACKEND_ERROR
    }

    private final Kind kind;

    protected SamplingException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    protected SamplingException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Returns the failure category.
     *
     * @return the kind, never null
     */
    public Kind kind() {
        return kind;
    }
}
