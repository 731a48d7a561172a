package io.rerankbench.core.metrics;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Nearest-rank percentiles over ascending-sorted samples. No interpolation: the result is always one
 * of the observed values.
 */
public final class Percentiles {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Percentiles() {}

    /**
     * @param sortedValues samples in ascending order
     * @param percentile   target percentile in [0, 100]; values outside are clamped to min / max
     * @return the nearest-rank value, or {@link Double#NaN} when there are no samples
     */
    public static double nearestRank(double[] sortedValues, double percentile) {
        if (Double.isNaN(percentile)) {
            throw new IllegalArgumentException("Percentile must be a number");
        }
        int n = sortedValues.length;
        if (n == 0) {
            return Double.NaN;
        }
        if (percentile <= 0) {
            return sortedValues[0];
        }
        if (percentile >= 100) {
            return sortedValues[n - 1];
        }
        int rank = Math.max(1, Math.min(rank(percentile, n), n));
        return sortedValues[rank - 1];
    }

    /**
     * 1-based nearest rank {@code ceil(p / 100 * n)}, computed in decimal arithmetic so that exact
     * products such as {@code 25 / 100 * 4} are not pushed up a rank by binary rounding.
     */
    static int rank(double percentile, int n) {
        return BigDecimal.valueOf(percentile)
                .multiply(BigDecimal.valueOf(n))
                .divide(HUNDRED, 0, RoundingMode.CEILING)
                .intValueExact();
    }
}
