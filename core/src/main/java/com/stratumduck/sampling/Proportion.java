package com.stratumduck.sampling;

import com.stratumduck.exception.InvalidArgumentException;
import com.stratumduck.generator.SQLGenerator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Fraction of each stratum to select, in (0, 1].
 *
 * <p>The value is held as an exact decimal rounded to
 * {@link SQLGenerator#PROPORTION_SCALE} places, the same precision the
 * generated SQL uses, so counts computed in Java and in the backend agree and
 * {@code 0.3 * 10} is exactly 3.
 */
public final class Proportion {

    private final BigDecimal value;

    private Proportion(BigDecimal value) {
        this.value = value;
    }

    /**
     * Creates a proportion from a double.
     *
     * @param proportion the fraction
     * @return the proportion
     * @throws InvalidArgumentException if the value is NaN, infinite or not in (0, 1]
     */
    public static Proportion of(double proportion) {
        if (Double.isNaN(proportion) || Double.isInfinite(proportion)) {
            throw new InvalidArgumentException("Proportion must be a finite number in (0, 1], got: " + proportion);
        }
        return of(BigDecimal.valueOf(proportion));
    }

    /**
     * Creates a proportion from an exact decimal.
     *
     * @param proportion the fraction
     * @return the proportion
     * @throws InvalidArgumentException if the value is null or not in (0, 1]
     */
    public static Proportion of(BigDecimal proportion) {
        if (proportion == null) {
            throw new InvalidArgumentException("Proportion must not be null");
        }
        if (proportion.signum() <= 0 || proportion.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidArgumentException("Proportion must be in (0, 1], got: " + proportion.toPlainString());
        }
        BigDecimal scaled = proportion.setScale(SQLGenerator.PROPORTION_SCALE, RoundingMode.HALF_UP);
        if (scaled.signum() == 0) {
            throw new InvalidArgumentException("Proportion is below the supported precision of 1e-"
                + SQLGenerator.PROPORTION_SCALE + ": " + proportion.toPlainString());
        }
        return new Proportion(scaled.stripTrailingZeros());
    }

    public BigDecimal value() {
        return value;
    }

    /**
     * Returns {@code ceil(proportion * n)}, the 1-indexed nearest rank.
     */
    public long nearestRank(long n) {
        return value.multiply(BigDecimal.valueOf(n)).setScale(0, RoundingMode.CEILING).longValueExact();
    }

    /**
     * Returns {@code floor(proportion * n)}.
     */
    public long floorCount(long n) {
        return value.multiply(BigDecimal.valueOf(n)).setScale(0, RoundingMode.FLOOR).longValueExact();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Proportion)) return false;
        return value.compareTo(((Proportion) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}
