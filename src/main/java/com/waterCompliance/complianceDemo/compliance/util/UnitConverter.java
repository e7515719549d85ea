package com.waterCompliance.complianceDemo.compliance.util;

import com.waterCompliance.complianceDemo.compliance.exception.RuleEvaluationException;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts concentration results between the units used in lab reports and the unit
 * a threshold is stated in. Non-concentration units (CFU/mL, P/A, ...) only convert to themselves.
 */
public final class UnitConverter {

    // factor to micrograms per litre
    private static final Map<String, Double> CONCENTRATION_FACTORS = Map.of(
            "g/l", 1_000_000.0,
            "mg/l", 1_000.0,
            "ppm", 1_000.0,
            "ug/l", 1.0,
            "ppb", 1.0,
            "ng/l", 0.001,
            "ppt", 0.001
    );

    private static final Set<String> PRESENCE_UNITS = Set.of("p/a", "pa", "presence/absence", "present/absent");

    private UnitConverter() {}

    public static double convert(double value, String fromUnit, String toUnit) {
        String from = normalize(fromUnit);
        String to = normalize(toUnit);
        if (from.equals(to)) {
            return value;
        }
        Double fromFactor = CONCENTRATION_FACTORS.get(from);
        Double toFactor = CONCENTRATION_FACTORS.get(to);
        if (fromFactor == null || toFactor == null) {
            throw new RuleEvaluationException("Cannot convert " + fromUnit + " to " + toUnit);
        }
        return value * fromFactor / toFactor;
    }

    /**
     * True for presence/absence flags and organism counts (CFU/100mL, MPN/100mL, ...).
     */
    public static boolean isPresenceCompatible(String unit) {
        String normalized = normalize(unit);
        return PRESENCE_UNITS.contains(normalized)
                || normalized.startsWith("cfu/")
                || normalized.startsWith("mpn/");
    }

    static String normalize(String unit) {
        if (unit == null || unit.isBlank()) {
            throw new RuleEvaluationException("Missing unit");
        }
        return unit.trim()
                .replace('µ', 'u')
                .replace('μ', 'u')
                .replace(" ", "")
                .toLowerCase(Locale.ROOT);
    }
}
