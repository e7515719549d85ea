package com.waterCompliance.complianceDemo.orchestrator.service;

import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.external.service.ExternalCallExecutor;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineContext;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineStage;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResult;
import com.waterCompliance.complianceDemo.orchestrator.prompt.StagePrompts;
import com.waterCompliance.complianceDemo.reasoning.client.ReasoningClient;
import com.waterCompliance.complianceDemo.reasoning.model.ReasoningDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the reasoning call for a stage through the retrying executor and normalizes the answer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageReasoner {

    private final ReasoningClient reasoningClient;
    private final ExternalCallExecutor externalCallExecutor;

    public ReasoningDecision reason(PipelineStage stage, PipelineContext context) {
        String systemPrompt = StagePrompts.getSystemPrompt(stage);
        String stagePrompt = StagePrompts.buildStagePrompt(stage, context);
        log.debug("Requesting stage reasoning - sessionId: {}, stage: {}", context.getSessionId(), stage);

        ReasoningDecision decision = externalCallExecutor.execute("reasoning",
                () -> reasoningClient.reason(systemPrompt, stagePrompt));

        return ReasoningDecision.builder()
                .message(decision.getMessage() != null ? decision.getMessage() : stage.getDisplayName() + " finished")
                .reasoning(decision.getReasoning())
                .risk(decision.getRisk() != null ? decision.getRisk() : RiskLevel.UNKNOWN)
                .confidence(StageResult.clampConfidence(decision.getConfidence()))
                .decisions(decision.getDecisions() != null ? decision.getDecisions() : List.of())
                .nextActions(decision.getNextActions() != null ? decision.getNextActions() : List.of())
                .build();
    }
}
