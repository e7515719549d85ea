package com.waterCompliance.complianceDemo.registry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.waterCompliance.complianceDemo.compliance.model.NotificationTier;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A violation the registry already has on file for a system, as opposed to one found in
 * the submitted samples.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordedViolation {
    private String parameter;
    private String contaminantCode;
    private String violationCode;
    private String compliancePeriodBegin;
    private NotificationTier tier;
    private RiskLevel severity;
}
