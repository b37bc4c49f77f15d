package com.stratumduck.logical;

import com.stratumduck.generator.SQLGenerator;
import com.stratumduck.generator.SQLQuoting;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Logical plan node generating, for each stratum of size {@code n},
 * {@code floor(fraction * n)} draws of a uniform integer in {@code [1, n]}.
 *
 * <p>Draws are made with replacement on the index domain and are never
 * deduplicated. Each output row carries the stratum key, the stratum size and
 * the drawn index. A stratum whose draw count floors to zero produces no rows.
 *
 * <p>SQL generation (keys {@code region}):
 * <pre>
 *   SELECT "region", "n", LEAST("n", CAST(FLOOR(random() * "n") AS BIGINT) + 1) AS "draw"
 *   FROM (SELECT "region", "n", UNNEST(generate_series(1,
 *           CAST(FLOOR(CAST('0.5' AS DECIMAL(18,12)) * "n") AS BIGINT))) AS "draw__ord"
 *         FROM (SELECT "region", COUNT(*) AS "n" FROM "main"."ranked" GROUP BY "region")
 *           AS subquery_1) AS subquery_2
 * </pre>
 *
 * <p>With a seed, each draw's index is derived from the hash of the stratum
 * key values, the draw's ordinal within the stratum and the seed.
 */
public final class UniformDraws extends LogicalPlan {

    private final List<String> keys;
    private final BigDecimal fraction;
    private final String countColumn;
    private final String drawColumn;
    private final OptionalLong seed;

    /**
     * Creates a draw generation node.
     *
     * @param child the ranked rows; stratum sizes are counted from it
     * @param keys stratification key columns, empty for a single global stratum
     * @param fraction draw fraction in (0, 1]
     * @param countColumn name of the output column holding the stratum size
     * @param drawColumn name of the output column holding the drawn index
     * @param seed optional seed for reproducible draws
     */
    public UniformDraws(LogicalPlan child, List<String> keys, BigDecimal fraction,
                        String countColumn, String drawColumn, OptionalLong seed) {
        super(child);
        this.keys = List.copyOf(keys);
        this.fraction = Objects.requireNonNull(fraction, "fraction must not be null");
        this.countColumn = Objects.requireNonNull(countColumn, "countColumn must not be null");
        this.drawColumn = Objects.requireNonNull(drawColumn, "drawColumn must not be null");
        this.seed = Objects.requireNonNull(seed, "seed must not be null (use OptionalLong.empty())");
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

        String count = SQLQuoting.quoteIdentifier(countColumn);
        String ordinal = SQLQuoting.quoteIdentifier(drawColumn + "__ord");
        String keyPrefix = generator.keyPrefix(keys);

        String counts = "SELECT " + keyPrefix + "COUNT(*) AS " + count
            + " FROM " + generator.fromClause(child()) + generator.groupBy(keys);

        String expanded = "SELECT " + keyPrefix + count
            + ", UNNEST(generate_series(1, CAST(FLOOR(" + generator.decimalLiteral(fraction)
            + " * " + count + ") AS BIGINT))) AS " + ordinal
            + " FROM (" + counts + ") AS " + generator.generateSubqueryAlias();

        List<String> identity = new ArrayList<>();
        for (String key : keys) {
            identity.add(SQLQuoting.quoteIdentifier(key));
        }
        identity.add(ordinal);

        return "SELECT " + keyPrefix + count + ", "
            + generator.uniformIndex(seed, identity, count)
            + " AS " + SQLQuoting.quoteIdentifier(drawColumn)
            + " FROM (" + expanded + ") AS " + generator.generateSubqueryAlias();
    }

    @Override
    public String toString() {
        return String.format("UniformDraws(keys=%s, fraction=%s, seeded=%s)",
            keys, fraction.toPlainString(), seed.isPresent());
    }
}
