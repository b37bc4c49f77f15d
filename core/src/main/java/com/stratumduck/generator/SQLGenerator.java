package com.stratumduck.generator;

import com.stratumduck.logical.LogicalPlan;
import com.stratumduck.logical.TableScan;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * Translates logical plans into DuckDB SQL.
 *
 * <p>Each plan node renders itself through {@link LogicalPlan#toSQL(SQLGenerator)};
 * the generator supplies the shared pieces: subquery aliases, FROM clauses,
 * partition/group lists, exact decimal literals and the per-row random
 * expressions used for labels and draws.
 *
 * <p>A generator is not thread-safe. Create one per statement.
 */
public class SQLGenerator {

    /** 2^53: every integer below it is exactly representable as a double. */
    static final String DOUBLE_MANTISSA_RANGE = "9007199254740992";

    /** Precision used for proportion arithmetic in SQL. */
    public static final int PROPORTION_SCALE = 12;

    private int aliasCounter;

    /**
     * Creates a new SQL generator.
     */
    public SQLGenerator() {
        this.aliasCounter = 0;
    }

    /**
     * Generates SQL for a logical plan node.
     *
     * @param plan the plan to translate
     * @return the SQL query
     */
    public String generate(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        return plan.toSQL(this);
    }

    /**
     * Generates a unique alias for a subquery or joined relation.
     *
     * @return a fresh alias ("subquery_1", "subquery_2", ...)
     */
    public String generateSubqueryAlias() {
        return "subquery_" + (++aliasCounter);
    }

    /**
     * Renders the FROM target for a child plan.
     *
     * <p>A {@link TableScan} is referenced directly so its {@code rowid}
     * pseudo-column stays visible; anything else becomes an aliased subquery.
     *
     * @param child the child plan
     * @return the FROM target
     */
    public String fromClause(LogicalPlan child) {
        if (child instanceof TableScan) {
            return ((TableScan) child).relation().toSQL();
        }
        return "(" + generate(child) + ") AS " + generateSubqueryAlias();
    }

    /**
     * Renders {@code PARTITION BY k1, k2}, or an empty string for no keys.
     */
    public String partitionBy(List<String> keys) {
        if (keys.isEmpty()) {
            return "";
        }
        return "PARTITION BY " + SQLQuoting.quoteIdentifiers(keys);
    }

    /**
     * Renders {@code  GROUP BY k1, k2} (with a leading space), or an empty
     * string for no keys.
     */
    public String groupBy(List<String> keys) {
        if (keys.isEmpty()) {
            return "";
        }
        return " GROUP BY " + SQLQuoting.quoteIdentifiers(keys);
    }

    /**
     * Renders a select-list prefix for the keys ({@code "k1", "k2", }), or an
     * empty string for no keys.
     */
    public String keyPrefix(List<String> keys) {
        if (keys.isEmpty()) {
            return "";
        }
        return SQLQuoting.quoteIdentifiers(keys) + ", ";
    }

    /**
     * Renders a fraction as an exact decimal literal so that rank and draw
     * counts are computed without binary floating-point error.
     *
     * @param fraction the fraction, at most {@link #PROPORTION_SCALE} decimal places
     * @return e.g. {@code CAST('0.3' AS DECIMAL(18,12))}
     */
    public String decimalLiteral(BigDecimal fraction) {
        return "CAST(" + SQLQuoting.quoteLiteral(fraction.toPlainString())
            + " AS DECIMAL(18," + PROPORTION_SCALE + "))";
    }

    /**
     * Renders a uniform value in [0, 1).
     *
     * <p>Without a seed this is DuckDB's {@code random()}, evaluated
     * independently per row. With a seed the value is derived from the hash of
     * the identity expressions and the seed, so the same row always receives
     * the same label for the same seed, and no generator state is shared
     * between rows.
     *
     * @param seed optional seed
     * @param identity SQL expressions identifying the row or draw
     * @return SQL expression of type DOUBLE
     */
    public String uniformValue(OptionalLong seed, List<String> identity) {
        if (seed.isEmpty()) {
            return "random()";
        }
        return "(CAST(" + seededHash(seed.getAsLong(), identity)
            + " % CAST(" + DOUBLE_MANTISSA_RANGE + " AS UBIGINT) AS DOUBLE) / "
            + DOUBLE_MANTISSA_RANGE + ".0)";
    }

    /**
     * Renders a uniform integer in [1, n].
     *
     * @param seed optional seed
     * @param identity SQL expressions identifying the draw
     * @param n SQL expression for the (positive) upper bound
     * @return SQL expression of type BIGINT
     */
    public String uniformIndex(OptionalLong seed, List<String> identity, String n) {
        if (seed.isEmpty()) {
            // random() * n may round up to n for values just below 1
            return "LEAST(" + n + ", CAST(FLOOR(random() * " + n + ") AS BIGINT) + 1)";
        }
        return "(CAST(" + seededHash(seed.getAsLong(), identity)
            + " % CAST(" + n + " AS UBIGINT) AS BIGINT) + 1)";
    }

    private String seededHash(long seed, List<String> identity) {
        String args = identity.stream().collect(Collectors.joining(", "));
        return "hash(" + (args.isEmpty() ? "" : args + ", ") + "CAST(" + seed + " AS BIGINT))";
    }
}
