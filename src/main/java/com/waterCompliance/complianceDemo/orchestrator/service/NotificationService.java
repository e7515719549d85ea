package com.waterCompliance.complianceDemo.orchestrator.service;

import com.waterCompliance.complianceDemo.compliance.model.NotificationRequirement;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.compliance.model.ThresholdKind;
import com.waterCompliance.complianceDemo.compliance.model.Violation;
import com.waterCompliance.complianceDemo.compliance.service.NotificationRequirementGenerator;
import com.waterCompliance.complianceDemo.external.exception.ExternalCallException;
import com.waterCompliance.complianceDemo.external.service.ExternalCallExecutor;
import com.waterCompliance.complianceDemo.guidance.client.GuidanceSearchClient;
import com.waterCompliance.complianceDemo.guidance.model.GuidanceReference;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineContext;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineStage;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResult;
import com.waterCompliance.complianceDemo.orchestrator.model.StageStatus;
import com.waterCompliance.complianceDemo.reasoning.model.ReasoningDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Stage 3: derive public notification obligations and collect corrective action guidance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService implements StageService {

    private static final int GUIDANCE_ACTIONS = 3;

    private final NotificationRequirementGenerator notificationRequirementGenerator;
    private final GuidanceSearchClient guidanceSearchClient;
    private final ExternalCallExecutor externalCallExecutor;
    private final StageReasoner stageReasoner;

    @Override
    public PipelineStage stage() {
        return PipelineStage.GENERATING_NOTIFICATIONS;
    }

    @Override
    public StageResult execute(PipelineContext context) {
        List<Violation> violations = context.getViolations() != null ? context.getViolations() : List.of();

        // Step 1: deterministic requirements
        List<NotificationRequirement> requirements =
                notificationRequirementGenerator.generateAll(violations, context.resolveNonEnglishFraction(),
                        context.getSystemInfo());
        context.setNotificationRequirements(requirements);
        context.setGuidanceReferences(List.of());
        RiskLevel highest = violations.stream().map(Violation::getSeverity).reduce(RiskLevel.LOW, RiskLevel::max);
        if (violations.isEmpty() && context.isClassificationBlocked()) {
            highest = RiskLevel.UNKNOWN;
        }
        List<String> requirementLines = requirements.stream()
                .map(requirement -> "Tier " + requirement.getTier().getNumber() + " notice for "
                        + requirement.getParameter() + " within " + requirement.getDeadline()
                        + (requirement.isMultiLanguageRequired() ? " (multi-language)" : ""))
                .toList();
        log.info("Notification requirements generated - sessionId: {}, requirements: {}",
                context.getSessionId(), requirements.size());

        try {
            // Step 2: guidance for the most severe violation
            Optional<Violation> primary = violations.stream()
                    .max(Comparator.comparingInt((Violation violation) -> violation.getSeverity().getRank())
                            .thenComparingInt(violation -> -violation.getTier().getNumber()));
            if (primary.isPresent()) {
                Violation violation = primary.get();
                List<GuidanceReference> guidance = externalCallExecutor.execute("guidance-search",
                        () -> guidanceSearchClient.search(violation.getParameter(), describeKind(violation.getThresholdKind())));
                context.setGuidanceReferences(guidance);
            }

            // Step 3: reasoning
            ReasoningDecision decision = stageReasoner.reason(stage(), context);
            List<String> nextActions = new ArrayList<>(requirementLines);
            nextActions.addAll(decision.getNextActions());
            context.getGuidanceReferences().stream()
                    .limit(GUIDANCE_ACTIONS)
                    .map(reference -> "Review guidance: " + reference.getTitle() + " (" + reference.getLink() + ")")
                    .forEach(nextActions::add);

            return StageResult.builder()
                    .stage(stage())
                    .status(StageStatus.COMPLETE)
                    .message(requirements.size() + " public notice(s) required. " + decision.getMessage())
                    .confidence(decision.getConfidence())
                    .risk(highest)
                    .reasoningTrace(decision.getReasoning())
                    .decisions(decision.getDecisions())
                    .nextActions(nextActions)
                    .build();
        } catch (ExternalCallException e) {
            log.warn("Notification stage degraded - sessionId: {}, error: {}", context.getSessionId(), e.getMessage());
            return StageResult.degraded(stage(), "Notification planning degraded: " + e.getMessage()).toBuilder()
                    .risk(highest)
                    .nextActions(requirementLines)
                    .build();
        }
    }

    private static String describeKind(ThresholdKind kind) {
        return switch (kind) {
            case MCL -> "maximum contaminant level violation";
            case ACTION_LEVEL -> "action level exceedance";
            case MONITORING_REQUIREMENT -> "monitoring violation";
        };
    }
}
