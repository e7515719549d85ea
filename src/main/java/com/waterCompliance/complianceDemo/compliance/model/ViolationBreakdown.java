package com.waterCompliance.complianceDemo.compliance.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ViolationBreakdown {
    int total;
    Map<RiskLevel, Long> bySeverity;
    Map<Integer, Long> byTier;
}
