package com.waterCompliance.complianceDemo.orchestrator.service;

import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.compliance.model.Violation;
import com.waterCompliance.complianceDemo.compliance.service.ViolationClassifier;
import com.waterCompliance.complianceDemo.external.exception.ExternalCallException;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineContext;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineStage;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResult;
import com.waterCompliance.complianceDemo.orchestrator.model.StageStatus;
import com.waterCompliance.complianceDemo.reasoning.model.ReasoningDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Stage 2: classify violations. Skipped entirely when validation failed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ViolationDetectionService implements StageService {

    private final ViolationClassifier violationClassifier;
    private final StageReasoner stageReasoner;

    @Override
    public PipelineStage stage() {
        return PipelineStage.DETECTING_VIOLATIONS;
    }

    @Override
    public StageResult execute(PipelineContext context) {
        if (context.isClassificationBlocked()) {
            log.info("Skipping violation detection, validation failed - sessionId: {}", context.getSessionId());
            context.setViolations(List.of());
            return StageResult.builder()
                    .stage(stage())
                    .status(StageStatus.COMPLETE)
                    .message("Violation detection skipped: sample data failed validation")
                    .confidence(0.0)
                    .risk(RiskLevel.UNKNOWN)
                    .decisions(List.of("classification_not_run"))
                    .nextActions(List.of("Correct and resubmit sample data"))
                    .build();
        }

        // Step 1: deterministic classification
        List<Violation> violations = violationClassifier.classifyAll(context.getSamples());
        context.setViolations(violations);
        RiskLevel highest = violations.stream().map(Violation::getSeverity).reduce(RiskLevel.LOW, RiskLevel::max);
        List<String> violationLines = violations.stream()
                .map(violation -> violation.getParameter() + ": tier " + violation.getTier().getNumber()
                        + ", " + violation.getSeverity())
                .toList();
        log.info("Violation detection finished - sessionId: {}, violations: {}, highestSeverity: {}",
                context.getSessionId(), violations.size(), highest);

        // Step 2: reasoning
        try {
            ReasoningDecision decision = stageReasoner.reason(stage(), context);
            List<String> decisions = new ArrayList<>(violationLines);
            decisions.addAll(decision.getDecisions());
            return StageResult.builder()
                    .stage(stage())
                    .status(StageStatus.COMPLETE)
                    .message(violations.size() + " violation(s) found. " + decision.getMessage())
                    .confidence(decision.getConfidence())
                    .risk(highest)
                    .reasoningTrace(decision.getReasoning())
                    .decisions(decisions)
                    .nextActions(decision.getNextActions())
                    .build();
        } catch (ExternalCallException e) {
            log.warn("Violation detection degraded - sessionId: {}, error: {}", context.getSessionId(), e.getMessage());
            return StageResult.degraded(stage(), "Violation detection degraded: " + e.getMessage()).toBuilder()
                    .risk(highest)
                    .decisions(violationLines)
                    .build();
        }
    }
}
