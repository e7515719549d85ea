package com.waterCompliance.complianceDemo.compliance.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StageAssessment {
    String agent;
    String status;
    RiskLevel risk;
    double confidence;
    String topDecision;
}
