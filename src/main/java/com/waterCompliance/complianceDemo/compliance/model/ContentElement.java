package com.waterCompliance.complianceDemo.compliance.model;

import java.util.List;

/**
 * Mandatory public notice content elements (40 CFR 141.205).
 */
public enum ContentElement {
    VIOLATION_DESCRIPTION,
    HEALTH_EFFECTS,
    AT_RISK_POPULATION,
    CORRECTIVE_STEPS,
    RESOLUTION_ESTIMATE,
    CONTACT_INFORMATION,
    REDISTRIBUTION_ENCOURAGEMENT;

    public static final List<ContentElement> REQUIRED = List.of(values());
}
