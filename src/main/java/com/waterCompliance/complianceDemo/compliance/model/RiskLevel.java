package com.waterCompliance.complianceDemo.compliance.model;

import java.util.Locale;

/**
 * Ordered risk / severity scale shared by violations, stage results and the final report.
 * UNKNOWN ranks below everything and is never assigned to a violation.
 */
public enum RiskLevel {
    UNKNOWN(0),
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    RiskLevel(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public static RiskLevel max(RiskLevel a, RiskLevel b) {
        if (a == null) {
            return b == null ? UNKNOWN : b;
        }
        if (b == null) {
            return a;
        }
        return a.rank >= b.rank ? a : b;
    }

    /**
     * Lenient parse of a label coming back from a reasoning provider.
     * Unrecognised labels map to UNKNOWN.
     */
    public static RiskLevel fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        if ("MODERATE".equals(normalized)) {
            return MEDIUM;
        }
        for (RiskLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        return UNKNOWN;
    }
}
