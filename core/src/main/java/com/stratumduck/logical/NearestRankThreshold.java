package com.stratumduck.logical;

import com.stratumduck.generator.SQLGenerator;
import com.stratumduck.generator.SQLQuoting;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node computing, per stratum, the nearest-rank quantile of a
 * value column.
 *
 * <p>Within each stratum of size {@code n} the values are ordered ascending and
 * the value at 1-indexed position {@code ceil(fraction * n)} is returned. The
 * result is always an observed value, never an interpolation, and a stratum of
 * size 1 always yields its single value.
 *
 * <p>SQL generation (keys {@code region}, value {@code label}):
 * <pre>
 *   SELECT "region", MAX("label") AS "threshold" FROM (
 *     SELECT "region", "label",
 *            ROW_NUMBER() OVER (PARTITION BY "region" ORDER BY "label") AS "label__rn",
 *            COUNT(*) OVER (PARTITION BY "region") AS "label__n"
 *     FROM "main"."labeled") AS subquery_1
 *   WHERE "label__rn" &lt;= CEIL(CAST('0.5' AS DECIMAL(18,12)) * "label__n")
 *   GROUP BY "region"
 * </pre>
 *
 * <p>With no keys the whole input is one stratum and a single row is produced.
 */
public final class NearestRankThreshold extends LogicalPlan {

    private final List<String> keys;
    private final String valueColumn;
    private final BigDecimal fraction;
    private final String thresholdColumn;

    /**
     * Creates a threshold node.
     *
     * @param child the rows carrying the value column
     * @param keys stratification key columns, empty for a single global stratum
     * @param valueColumn column whose order statistic is computed
     * @param fraction rank fraction in (0, 1]
     * @param thresholdColumn name of the output column holding the threshold
     */
    public NearestRankThreshold(LogicalPlan child, List<String> keys, String valueColumn,
                                BigDecimal fraction, String thresholdColumn) {
        super(child);
        this.keys = List.copyOf(keys);
        this.valueColumn = Objects.requireNonNull(valueColumn, "valueColumn must not be null");
        this.fraction = Objects.requireNonNull(fraction, "fraction must not be null");
        this.thresholdColumn = Objects.requireNonNull(thresholdColumn, "thresholdColumn must not be null");
        if (fraction.signum() <= 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("fraction must be in (0, 1], got: " + fraction);
        }
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public String toSQL(SQLGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");

        String value = SQLQuoting.quoteIdentifier(valueColumn);
        String rowNumber = SQLQuoting.quoteIdentifier(valueColumn + "__rn");
        String count = SQLQuoting.quoteIdentifier(valueColumn + "__n");
        String partition = generator.partitionBy(keys);
        String orderedWindow = partition.isEmpty()
            ? "(ORDER BY " + value + ")"
            : "(" + partition + " ORDER BY " + value + ")";

        String inner = "SELECT " + generator.keyPrefix(keys) + value
            + ", ROW_NUMBER() OVER " + orderedWindow + " AS " + rowNumber
            + ", COUNT(*) OVER (" + partition + ") AS " + count
            + " FROM " + generator.fromClause(child());

        return "SELECT " + generator.keyPrefix(keys)
            + "MAX(" + value + ") AS " + SQLQuoting.quoteIdentifier(thresholdColumn)
            + " FROM (" + inner + ") AS " + generator.generateSubqueryAlias()
            + " WHERE " + rowNumber + " <= CEIL(" + generator.decimalLiteral(fraction) + " * " + count + ")"
            + generator.groupBy(keys);
    }

    @Override
    public String toString() {
        return String.format("NearestRankThreshold(keys=%s, value=%s, fraction=%s)",
            keys, valueColumn, fraction.toPlainString());
    }
}
