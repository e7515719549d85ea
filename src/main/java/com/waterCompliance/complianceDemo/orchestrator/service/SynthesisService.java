package com.waterCompliance.complianceDemo.orchestrator.service;

import com.waterCompliance.complianceDemo.compliance.model.ComplianceReport;
import com.waterCompliance.complianceDemo.compliance.service.NarrativeComposer;
import com.waterCompliance.complianceDemo.compliance.service.ReportSynthesizer;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineContext;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineStage;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResult;
import com.waterCompliance.complianceDemo.orchestrator.model.StageStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Stage 4: build the final report and the plain-language answer. No external calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SynthesisService implements StageService {

    private final ReportSynthesizer reportSynthesizer;
    private final NarrativeComposer narrativeComposer;

    @Override
    public PipelineStage stage() {
        return PipelineStage.SYNTHESIZING;
    }

    @Override
    public StageResult execute(PipelineContext context) {
        ComplianceReport report = reportSynthesizer.synthesize(
                context.getStageResults(),
                context.getValidationReport(),
                context.getViolations(),
                context.getNotificationRequirements(),
                context.getSystemInfo(),
                context.getGuidanceReferences());
        String naturalResponse = narrativeComposer.compose(report, context.getIntent());
        context.setReport(report);
        context.setNaturalResponse(naturalResponse);
        log.info("Report synthesized - sessionId: {}, overallRisk: {}, violations: {}, confidence: {}",
                context.getSessionId(), report.getOverallRisk(), report.getViolations().size(), report.getConfidence());

        return StageResult.builder()
                .stage(stage())
                .status(StageStatus.COMPLETE)
                .message("Compliance report ready: " + report.getViolations().size()
                        + " violation(s), overall risk " + report.getOverallRisk())
                .confidence(StageResult.clampConfidence(report.getConfidence()))
                .risk(report.getOverallRisk())
                .reasoningTrace(naturalResponse)
                .decisions(report.getKeyFindings())
                .nextActions(report.getImmediateActions())
                .build();
    }
}
