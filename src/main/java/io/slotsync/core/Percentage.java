package io.slotsync.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * A ratio in the range [0, 1].
 */
@Getter
@EqualsAndHashCode
public final class Percentage implements Comparable<Percentage> {

    public static final Percentage ZERO = new Percentage(BigDecimal.ZERO);
    public static final Percentage ONE = new Percentage(BigDecimal.ONE);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Held without trailing zeros so that equality is numeric.
     */
    private final BigDecimal value;

    private Percentage(BigDecimal value) {
        this.value = value.stripTrailingZeros();
    }

    /**
     * Safe constructor, takes an input in the range [0, 1].
     *
     * @throws PercentageOutOfBoundsException if the ratio is below 0 or above 1
     */
    public static Percentage of(BigDecimal ratio) {
        if (ratio.signum() < 0 || ratio.compareTo(BigDecimal.ONE) > 0) {
            throw new PercentageOutOfBoundsException("Percentage out of bounds: " + ratio.toPlainString());
        }
        return new Percentage(ratio);
    }

    public static Percentage of(double ratio) {
        return of(BigDecimal.valueOf(ratio));
    }

    /**
     * {@code numerator / denominator}, computed to {@link MathContext#DECIMAL64} precision.
     */
    public static Percentage ofRatio(long numerator, long denominator) {
        return of(BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), MathContext.DECIMAL64));
    }

    public static Optional<Percentage> tryOf(BigDecimal ratio) {
        if (ratio.signum() < 0 || ratio.compareTo(BigDecimal.ONE) > 0) {
            return Optional.empty();
        }
        return Optional.of(new Percentage(ratio));
    }

    /**
     * e.g. {@code 97.00%}
     */
    public String toPercentString() {
        return value.multiply(HUNDRED).setScale(2, RoundingMode.HALF_EVEN).toPlainString() + "%";
    }

    @Override
    public int compareTo(Percentage o) {
        return value.compareTo(o.value);
    }

    @Override
    public String toString() {
        return "Percentage " + value.toPlainString();
    }
}
