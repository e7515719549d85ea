package com.waterCompliance.complianceDemo.reasoning.model;

import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ReasoningDecision {
    String message;
    String reasoning;
    RiskLevel risk;
    double confidence;
    List<String> decisions;
    List<String> nextActions;
}
