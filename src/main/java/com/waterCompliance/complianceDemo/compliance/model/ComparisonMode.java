package com.waterCompliance.complianceDemo.compliance.model;

public enum ComparisonMode {
    GREATER_THAN,
    GREATER_OR_EQUAL;

    public boolean exceeds(double value, double threshold) {
        return this == GREATER_THAN ? value > threshold : value >= threshold;
    }
}
