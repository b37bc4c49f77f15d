package com.stratumduck.generator;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Utilities for safely quoting SQL identifiers and literals.
 *
 * <p>Relation and column names reach the backend as structured parameters and
 * are always rendered through this class, never spliced into SQL as-is.
 *
 * <p>Example usage:
 * <pre>
 *   String column = SQLQuoting.quoteIdentifier("my \"odd\" column");
 *   // Result: "my ""odd"" column"
 *
 *   String literal = SQLQuoting.quoteLiteral("O'Reilly");
 *   // Result: 'O''Reilly'
 * </pre>
 *
 * @see SQLGenerator
 */
public final class SQLQuoting {

    private SQLQuoting() {}

    /**
     * Quotes an identifier (schema, table, column or alias name).
     *
     * <p>Uses double quotes and escapes internal quotes according to SQL standard.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        // Escape double quotes by doubling them (SQL standard)
        String escaped = identifier.replace("\"", "\"\"");
        return "\"" + escaped + "\"";
    }

    /**
     * Quotes each identifier and joins them with ", ".
     *
     * @param identifiers the identifiers to quote
     * @return comma-separated quoted identifiers, empty string for an empty list
     */
    public static String quoteIdentifiers(List<String> identifiers) {
        return identifiers.stream()
            .map(SQLQuoting::quoteIdentifier)
            .collect(Collectors.joining(", "));
    }

    /**
     * Quotes each identifier, qualifies it with a relation alias and joins them
     * with ", ".
     *
     * @param alias the relation alias (already a safe generated name)
     * @param identifiers the column names
     * @return comma-separated qualified column references
     */
    public static String qualifyIdentifiers(String alias, List<String> identifiers) {
        return identifiers.stream()
            .map(id -> alias + "." + quoteIdentifier(id))
            .collect(Collectors.joining(", "));
    }

    /**
     * Quotes a string literal value.
     *
     * <p>Uses single quotes and escapes internal quotes according to SQL standard.
     * Returns NULL (without quotes) if the value is null.
     *
     * @param value the string value to quote
     * @return quoted literal safe for SQL, or NULL if value is null
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }

        // Escape single quotes by doubling them (SQL standard)
        String escaped = value.replace("'", "''");
        return "'" + escaped + "'";
    }
}
