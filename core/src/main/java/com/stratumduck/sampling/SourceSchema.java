package com.stratumduck.sampling;

import com.stratumduck.backend.RelationName;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Column list of a validated source relation.
 *
 * <p>Lookups are case-insensitive, as DuckDB identifiers are, and return the
 * spelling stored in the catalog.
 */
public final class SourceSchema {

    private final RelationName relation;
    private final List<String> columns;

    public SourceSchema(RelationName relation, List<String> columns) {
        this.relation = relation;
        this.columns = List.copyOf(columns);
    }

    public RelationName relation() {
        return relation;
    }

    /**
     * Returns the columns in ordinal order.
     */
    public List<String> columns() {
        return columns;
    }

    /**
     * Resolves a column name to its catalog spelling.
     *
     * @param name the requested name
     * @return the catalog spelling, or empty if the relation has no such column
     */
    public Optional<String> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.toLowerCase(Locale.ROOT);
        for (String column : columns) {
            if (column.toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a column known to exist.
     *
     * @throws IllegalStateException if the column is unknown
     */
    String resolve(String name) {
        return find(name).orElseThrow(() ->
            new IllegalStateException("Column " + name + " was not validated against " + relation));
    }
}
