package com.waterCompliance.complianceDemo.compliance.util;

import com.waterCompliance.complianceDemo.compliance.exception.RuleEvaluationException;
import com.waterCompliance.complianceDemo.compliance.model.PercentileMethod;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Summary statistics used by the violation classifier.
 */
public final class PercentileCalculator {

    private PercentileCalculator() {}

    /**
     * @param values sample results, any order
     * @param percentile fraction in (0, 1], e.g. 0.9
     */
    public static double percentile(List<Double> values, double percentile, PercentileMethod method) {
        requireValues(values, "percentile");
        if (percentile <= 0 || percentile > 1) {
            throw new RuleEvaluationException("Percentile must be in (0, 1]: " + percentile);
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int n = sorted.length;
        if (method == PercentileMethod.LINEAR_INTERPOLATION) {
            double position = percentile * (n - 1);
            int lower = (int) Math.floor(position);
            int upper = Math.min(lower + 1, n - 1);
            double fraction = position - lower;
            return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
        }
        return sorted[nearestRankIndex(n, percentile)];
    }

    /**
     * 0-based index {@code ceil(p * (n - 1))}, computed in decimal so that 0.9 * 10 lands on 9, not 10.
     */
    static int nearestRankIndex(int n, double percentile) {
        return BigDecimal.valueOf(percentile)
                .multiply(BigDecimal.valueOf(n - 1L))
                .setScale(0, RoundingMode.CEILING)
                .intValueExact();
    }

    public static double arithmeticMean(List<Double> values) {
        requireValues(values, "arithmetic mean");
        return values.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
    }

    /**
     * Zero results are replaced by {@code zeroSubstitute} before averaging logs; negative results are rejected.
     */
    public static double geometricMean(List<Double> values, double zeroSubstitute) {
        requireValues(values, "geometric mean");
        if (zeroSubstitute <= 0) {
            throw new RuleEvaluationException("Zero substitute must be positive, got " + zeroSubstitute);
        }
        double logSum = 0;
        for (Double value : values) {
            if (value < 0) {
                throw new RuleEvaluationException("Geometric mean requires non-negative results, got " + value);
            }
            logSum += Math.log(value == 0 ? zeroSubstitute : value);
        }
        return Math.exp(logSum / values.size());
    }

    public static double maximum(List<Double> values) {
        requireValues(values, "maximum");
        return values.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
    }

    private static void requireValues(List<Double> values, String statistic) {
        if (values == null || values.isEmpty()) {
            throw new RuleEvaluationException("Cannot compute " + statistic + " of an empty sample set");
        }
    }
}
