package com.waterCompliance.complianceDemo.broadcast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.waterCompliance.complianceDemo.compliance.model.ComplianceReport;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResultPatch;
import com.waterCompliance.complianceDemo.orchestrator.model.StageStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Message pushed to live subscribers of a session. Fields not relevant to the
 * event type are left null and omitted from the wire form.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisEvent {

    EventType type;

    @JsonProperty("session_id")
    String sessionId;

    Instant timestamp;

    String question;

    String agent;

    StageStatus status;

    String message;

    Double confidence;

    @JsonProperty("risk_assessment")
    RiskLevel riskAssessment;

    @JsonProperty("thinking_stream")
    String thinkingStream;

    @JsonProperty("thinking_preview")
    String thinkingPreview;

    @JsonProperty("full_thinking")
    String fullThinking;

    List<String> decisions;

    @JsonProperty("next_actions")
    List<String> nextActions;

    ComplianceReport results;

    @JsonProperty("natural_response")
    String naturalResponse;

    // stage update this event was built from, kept for snapshot merging
    @JsonIgnore
    StageResultPatch patch;

    /**
     * Advisory status messages are delivered but never replayed to late subscribers.
     */
    public boolean isSnapshotCandidate() {
        return type != EventType.STATUS;
    }

    public boolean isTerminal() {
        return type == EventType.ANALYSIS_COMPLETE || type == EventType.ERROR;
    }

    public static AnalysisEvent analysisStart(String sessionId, String question, Instant at) {
        return AnalysisEvent.builder()
                .type(EventType.ANALYSIS_START)
                .sessionId(sessionId)
                .timestamp(at)
                .question(question)
                .message("Analysis started")
                .build();
    }

    public static AnalysisEvent agentUpdate(String sessionId, StageResultPatch patch, Instant at) {
        return AnalysisEvent.builder()
                .type(EventType.AGENT_UPDATE)
                .sessionId(sessionId)
                .timestamp(at)
                .agent(patch.getStage().getAgentId())
                .status(patch.getStatus())
                .message(patch.getMessage())
                .confidence(patch.getConfidence())
                .riskAssessment(patch.getRisk())
                .thinkingStream(patch.getThinkingStream())
                .thinkingPreview(patch.getThinkingPreview())
                .fullThinking(patch.getFullThinking())
                .decisions(patch.getDecisions())
                .nextActions(patch.getNextActions())
                .patch(patch)
                .build();
    }

    public static AnalysisEvent analysisComplete(String sessionId, ComplianceReport report,
                                                 String naturalResponse, Instant at) {
        return AnalysisEvent.builder()
                .type(EventType.ANALYSIS_COMPLETE)
                .sessionId(sessionId)
                .timestamp(at)
                .message("Analysis complete")
                .results(report)
                .naturalResponse(naturalResponse)
                .build();
    }

    public static AnalysisEvent error(String sessionId, String message, Instant at) {
        return AnalysisEvent.builder()
                .type(EventType.ERROR)
                .sessionId(sessionId)
                .timestamp(at)
                .message(message)
                .build();
    }

    public static AnalysisEvent status(String sessionId, String message, Instant at) {
        return AnalysisEvent.builder()
                .type(EventType.STATUS)
                .sessionId(sessionId)
                .timestamp(at)
                .message(message)
                .build();
    }
}
