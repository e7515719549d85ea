package com.waterCompliance.complianceDemo.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raises violation severity once the measured value reaches {@code minRatio} times the threshold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthSignificanceBand {
    private String parameter;
    private double minRatio;
    private RiskLevel severity;
}
