package com.waterCompliance.complianceDemo.orchestrator.model;

import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Partial stage update as broadcast to subscribers. Absent (null) fields leave the
 * receiver's previous value for that stage untouched.
 */
@Value
@Builder(toBuilder = true)
public class StageResultPatch {

    static final int PREVIEW_LENGTH = 400;

    PipelineStage stage;
    StageStatus status;
    String message;
    Double confidence;
    RiskLevel risk;
    String thinkingStream;
    String thinkingPreview;
    String fullThinking;
    List<String> decisions;
    List<String> nextActions;

    public static StageResultPatch running(PipelineStage stage) {
        return StageResultPatch.builder()
                .stage(stage)
                .status(StageStatus.RUNNING)
                .message(stage.getDisplayName() + " analyzing...")
                .thinkingStream("Starting " + stage.getDisplayName().toLowerCase() + " analysis")
                .build();
    }

    public static StageResultPatch from(StageResult result) {
        String trace = result.getReasoningTrace();
        return StageResultPatch.builder()
                .stage(result.getStage())
                .status(result.getStatus())
                .message(result.getMessage())
                .confidence(result.getConfidence())
                .risk(result.getRisk())
                .fullThinking(trace)
                .thinkingPreview(trace == null || trace.length() <= PREVIEW_LENGTH
                        ? trace : trace.substring(0, PREVIEW_LENGTH) + "...")
                .decisions(result.getDecisions())
                .nextActions(result.getNextActions())
                .build();
    }

    /**
     * Overlays {@code newer} on this patch; non-null fields of {@code newer} win.
     */
    public StageResultPatch merge(StageResultPatch newer) {
        if (newer.stage != stage) {
            throw new IllegalArgumentException("Cannot merge patch for " + newer.stage + " into " + stage);
        }
        return StageResultPatch.builder()
                .stage(stage)
                .status(pick(newer.status, status))
                .message(pick(newer.message, message))
                .confidence(pick(newer.confidence, confidence))
                .risk(pick(newer.risk, risk))
                .thinkingStream(pick(newer.thinkingStream, thinkingStream))
                .thinkingPreview(pick(newer.thinkingPreview, thinkingPreview))
                .fullThinking(pick(newer.fullThinking, fullThinking))
                .decisions(pick(newer.decisions, decisions))
                .nextActions(pick(newer.nextActions, nextActions))
                .build();
    }

    /**
     * Applies this patch to a stage result; a null {@code previous} starts from the idle result.
     */
    public StageResult applyTo(StageResult previous) {
        StageResult base = previous != null ? previous : StageResult.idle(stage);
        if (base.getStage() != stage) {
            throw new IllegalArgumentException("Cannot apply patch for " + stage + " to result of " + base.getStage());
        }
        return base.toBuilder()
                .status(pick(status, base.getStatus()))
                .message(pick(message, base.getMessage()))
                .confidence(confidence != null ? StageResult.clampConfidence(confidence) : base.getConfidence())
                .risk(pick(risk, base.getRisk()))
                .reasoningTrace(pick(fullThinking, base.getReasoningTrace()))
                .decisions(pick(decisions, base.getDecisions()))
                .nextActions(pick(nextActions, base.getNextActions()))
                .build();
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
