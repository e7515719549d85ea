package com.waterCompliance.complianceDemo.compliance.model;

import com.waterCompliance.complianceDemo.guidance.model.GuidanceReference;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Final output of an analysis session. Built once by the synthesis stage.
 */
@Value
@Builder
public class ComplianceReport {
    SystemSummary system;
    RiskLevel overallRisk;
    ValidationOutcome validationOutcome;
    long populationAffected;
    double confidence;
    List<String> keyFindings;
    List<String> immediateActions;
    List<StageAssessment> stageAssessments;
    List<Violation> violations;
    List<NotificationRequirement> notificationRequirements;
    ViolationBreakdown violationBreakdown;
    List<GuidanceReference> guidanceReferences;
    Instant generatedAt;
}
