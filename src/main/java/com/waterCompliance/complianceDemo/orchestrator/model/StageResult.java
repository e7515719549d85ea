package com.waterCompliance.complianceDemo.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.compliance.model.ValidationOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one pipeline stage. Recorded once per stage per session and never changed afterwards.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StageResult {
    PipelineStage stage;
    StageStatus status;
    String message;
    double confidence;
    RiskLevel risk;
    String reasoningTrace;
    List<String> decisions;
    List<String> nextActions;
    /** Only set by the validation stage. */
    ValidationOutcome outcome;

    public String getAgent() {
        return stage.getAgentId();
    }

    /**
     * Result for a stage whose external dependency failed after retries.
     */
    public static StageResult degraded(PipelineStage stage, String message) {
        return StageResult.builder()
                .stage(stage)
                .status(StageStatus.ERROR)
                .message(message)
                .confidence(0.0)
                .risk(RiskLevel.UNKNOWN)
                .decisions(List.of())
                .nextActions(List.of())
                .build();
    }

    public static StageResult idle(PipelineStage stage) {
        return StageResult.builder()
                .stage(stage)
                .status(StageStatus.IDLE)
                .confidence(0.0)
                .risk(RiskLevel.UNKNOWN)
                .decisions(List.of())
                .nextActions(List.of())
                .build();
    }

    public static double clampConfidence(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
