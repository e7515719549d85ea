package com.waterCompliance.complianceDemo.orchestrator.model;

import com.waterCompliance.complianceDemo.compliance.model.ComplianceReport;
import com.waterCompliance.complianceDemo.compliance.model.NotificationRequirement;
import com.waterCompliance.complianceDemo.compliance.model.SampleRecord;
import com.waterCompliance.complianceDemo.compliance.model.ValidationReport;
import com.waterCompliance.complianceDemo.compliance.model.Violation;
import com.waterCompliance.complianceDemo.guidance.model.GuidanceReference;
import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline state - carries intermediate results from one stage to the next.
 * Owned by a single analysis worker; never shared between sessions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PipelineContext {

    private String sessionId;

    private AnalysisCommand command;

    /**
     * Resolved intent of the question (system, contaminant focus).
     */
    private QueryIntent intent;

    private String pwsid;

    private List<SampleRecord> samples;

    /**
     * Registry record; null when the lookup failed or the system is unknown.
     */
    private WaterSystemInfo systemInfo;

    private ValidationReport validationReport;

    private List<Violation> violations;

    private List<NotificationRequirement> notificationRequirements;

    private List<GuidanceReference> guidanceReferences;

    /**
     * Stage results recorded so far, in execution order.
     */
    @Builder.Default
    private List<StageResult> stageResults = new ArrayList<>();

    private ComplianceReport report;

    private String naturalResponse;

    public boolean isClassificationBlocked() {
        return validationReport == null || validationReport.isBlocking();
    }

    /**
     * Explicit fraction from the request wins over the registry value.
     */
    public Double resolveNonEnglishFraction() {
        if (command != null && command.getNonEnglishFraction() != null) {
            return command.getNonEnglishFraction();
        }
        return systemInfo != null ? systemInfo.getNonEnglishSpeakingFraction() : null;
    }
}
