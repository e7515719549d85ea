package com.waterCompliance.complianceDemo.compliance.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Violation {
    String parameter;
    double measuredValue;
    StatisticMethod statistic;
    String unit;
    double threshold;
    ThresholdKind thresholdKind;
    NotificationTier tier;
    RiskLevel severity;
    String citation;
    String healthEffects;
    int sampleCount;
    /** measured / threshold; null for presence-based and monitoring violations. */
    Double exceedanceRatio;
}
