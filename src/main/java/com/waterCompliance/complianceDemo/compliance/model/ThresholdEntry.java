package com.waterCompliance.complianceDemo.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A single regulatory limit for one parameter, as loaded from the threshold table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdEntry {

    public static final double DEFAULT_PERCENTILE = 0.9;
    public static final double DEFAULT_ZERO_SUBSTITUTE = 1.0;

    private String parameter;
    private List<String> aliases;
    private double threshold;
    private String unit;
    private ThresholdKind kind;
    private StatisticMethod statistic;
    private Double percentile;
    private PercentileMethod percentileMethod;
    private ComparisonMode comparison;
    private NotificationTier tier;
    private String citation;
    private String healthEffects;
    private boolean monitoringRequired;
    private RiskLevel monitoringSeverity;
    /** Value a zero (non-detect) result counts as in a geometric mean. */
    private Double zeroSubstitute;

    /**
     * Fills optional attributes left out of the table file and rejects entries the
     * classifier cannot evaluate.
     */
    public ThresholdEntry applyDefaults() {
        if (parameter == null || parameter.isBlank()) {
            throw new IllegalStateException("Threshold entry without parameter name");
        }
        if (statistic == null || tier == null || unit == null) {
            throw new IllegalStateException("Threshold entry for " + parameter + " is missing statistic, tier or unit");
        }
        if (aliases == null) {
            aliases = new ArrayList<>();
        }
        if (kind == null) {
            kind = ThresholdKind.MCL;
        }
        if (percentile == null) {
            percentile = DEFAULT_PERCENTILE;
        }
        if (percentileMethod == null) {
            percentileMethod = PercentileMethod.NEAREST_RANK;
        }
        if (comparison == null) {
            comparison = ComparisonMode.GREATER_THAN;
        }
        if (monitoringSeverity == null) {
            monitoringSeverity = RiskLevel.LOW;
        }
        if (zeroSubstitute == null && statistic == StatisticMethod.GEOMETRIC_MEAN) {
            zeroSubstitute = DEFAULT_ZERO_SUBSTITUTE;
        }
        if (zeroSubstitute != null && zeroSubstitute <= 0) {
            throw new IllegalStateException("Zero substitute for " + parameter + " must be positive: " + zeroSubstitute);
        }
        return this;
    }

    public List<String> lookupKeys() {
        List<String> keys = new ArrayList<>();
        keys.add(normalizeKey(parameter));
        if (aliases != null) {
            aliases.forEach(alias -> keys.add(normalizeKey(alias)));
        }
        return keys;
    }

    public static String normalizeKey(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
