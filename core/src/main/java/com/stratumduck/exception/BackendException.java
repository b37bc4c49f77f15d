package com.stratumduck.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when the data backend fails to execute an operation.
 *
 * <p>This exception wraps SQLException with the name of the sampling
 * operation that was running and the SQL that failed, and provides
 * user-friendly messages for common DuckDB errors.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Column not found errors</li>
 *   <li>Memory limit exceeded</li>
 *   <li>Catalog errors (relation dropped concurrently)</li>
 *   <li>I/O errors during materialization</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       sampler.sample(request);
 *   } catch (BackendException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed during " + e.getOperation() + ": " + e.getFailedSQL());
 *   }
 * </pre>
 */
public class BackendException extends SamplingException {

    private final String operation;
    private final String failedSQL;

    /**
     * Creates a backend exception.
     *
     * @param operation the backend operation that failed (e.g. "createRelation")
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute, or null
     */
    public BackendException(String operation, String message, Throwable cause, String sql) {
        super(Kind.BACKEND_ERROR, message, cause);
        this.operation = operation;
        this.failedSQL = sql;
    }

    /**
     * Returns the backend operation that failed.
     *
     * @return the operation name
     */
    public String getOperation() {
        return operation;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Translates technical DuckDB error messages into actionable guidance.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String message = getMessage();

        if (message == null) {
            return "Backend operation '" + operation + "' failed.";
        }

        if (message.contains("Binder Error") && message.contains("not found")) {
            return translateColumnNotFound(message);
        }

        if (message.contains("Out of Memory Error")) {
            return "Sampling requires more memory than available. " +
                   "Try sampling a smaller relation or increasing the memory limit.";
        }

        if (message.contains("Catalog Error")) {
            if (message.contains("does not exist")) {
                return "Relation not found while running '" + operation + "'. " +
                       "It may have been dropped by another session.";
            }
            return "Catalog error during '" + operation + "': " + message;
        }

        if (message.contains("IO Error")) {
            return "I/O error while materializing a relation: " + message;
        }

        return "Backend operation '" + operation + "' failed: " + message;
    }

    private String translateColumnNotFound(String message) {
        Pattern pattern = Pattern.compile("column \"([^\"]+)\" not found", Pattern.CASE_INSENSITIVE);
        Matcher matcher = pattern.matcher(message);

        if (matcher.find()) {
            return "Column '" + matcher.group(1) + "' not found during '" + operation + "'. " +
                   "Check column name spelling.";
        }

        return "Column not found: " + message;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Backend Operation Failed: ").append(operation).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
