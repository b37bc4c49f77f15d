package com.stratumduck.backend;

import com.stratumduck.generator.SQLQuoting;

import java.util.Objects;

/**
 * Name of a relation in the backend catalog, optionally schema-qualified.
 *
 * <p>{@code "sales"} refers to {@code main.sales}; {@code "staging.sales"}
 * refers to table {@code sales} in schema {@code staging}. Names are kept as
 * structured parts and quoted separately when rendered to SQL.
 */
public final class RelationName {

    /** Schema used when a name is not qualified. */
    public static final String DEFAULT_SCHEMA = "main";

    private final String schema;
    private final String table;

    private RelationName(String schema, String table) {
        this.schema = schema;
        this.table = table;
    }

    /**
     * Creates a relation name in the given schema.
     *
     * @param schema the schema name
     * @param table the table name
     * @return the relation name
     * @throws IllegalArgumentException if either part is null or blank
     */
    public static RelationName of(String schema, String table) {
        if (schema == null || schema.isBlank()) {
            throw new IllegalArgumentException("Schema name cannot be null or empty");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        return new RelationName(schema, table);
    }

    /**
     * Parses {@code table} or {@code schema.table}.
     *
     * <p>Only the first dot separates schema from table; a table name may not
     * itself contain a dot when written unqualified.
     *
     * @param name the name to parse
     * @return the relation name
     * @throws IllegalArgumentException if the name or one of its parts is empty
     */
    public static RelationName parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Relation name cannot be null or empty");
        }
        String trimmed = name.trim();
        int dot = trimmed.indexOf('.');
        if (dot < 0) {
            return of(DEFAULT_SCHEMA, trimmed);
        }
        return of(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    }

    /**
     * Returns a relation with the same schema and a different table name.
     */
    public RelationName sibling(String otherTable) {
        return of(schema, otherTable);
    }

    public String schema() {
        return schema;
    }

    public String table() {
        return table;
    }

    /**
     * Renders the quoted, fully qualified name, e.g. {@code "main"."sales"}.
     */
    public String toSQL() {
        return SQLQuoting.quoteIdentifier(schema) + "." + SQLQuoting.quoteIdentifier(table);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RelationName)) return false;
        RelationName that = (RelationName) o;
        return schema.equals(that.schema) && table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, table);
    }

    @Override
    public String toString() {
        return schema + "." + table;
    }
}
