package com.waterCompliance.complianceDemo.compliance.model;

public enum ValidationOutcome {
    PASS,
    CONDITIONAL,
    FAIL;

    public static ValidationOutcome worst(ValidationOutcome a, ValidationOutcome b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
