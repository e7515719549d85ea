package com.waterCompliance.complianceDemo.orchestrator.model;

public enum AnalysisIntent {
    SAFETY_CHECK,
    CONTAMINANT_INQUIRY,
    NOTIFICATION_INQUIRY,
    GENERAL_COMPLIANCE
}
