package com.waterCompliance.complianceDemo.compliance.model;

public enum ValidationCheck {
    IDENTIFIER_FORMAT,
    RECORD_COMPLETENESS,
    TIMING_PLAUSIBILITY
}
