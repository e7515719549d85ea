package com.waterCompliance.complianceDemo.compliance.model;

public enum ThresholdKind {
    MCL,
    ACTION_LEVEL,
    MONITORING_REQUIREMENT
}
