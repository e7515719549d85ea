package com.waterCompliance.complianceDemo.orchestrator.model;

import com.waterCompliance.complianceDemo.compliance.model.ComplianceReport;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One analysis run. Stage moves strictly forward; once terminal nothing changes.
 * Mutators are synchronized because the pipeline worker writes while API requests read.
 */
public class AnalysisSession {

    @Getter
    private final String sessionId;
    @Getter
    private final String query;
    @Getter
    private final Instant createdAt;

    private PipelineStage stage = PipelineStage.IDLE;
    private final List<StageResult> stageResults = new ArrayList<>();
    private final Map<PipelineStage, StageResultPatch> liveView = new EnumMap<>(PipelineStage.class);
    private ComplianceReport report;
    private String naturalResponse;
    private String errorMessage;
    private Instant completedAt;

    public AnalysisSession(String sessionId, String query, Instant createdAt) {
        this.sessionId = sessionId;
        this.query = query;
        this.createdAt = createdAt;
    }

    public synchronized void advanceTo(PipelineStage next) {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Session " + sessionId + " is already " + stage);
        }
        if (next != stage.next()) {
            throw new IllegalStateException("Illegal transition " + stage + " -> " + next + " for session " + sessionId);
        }
        stage = next;
    }

    public synchronized void recordStageResult(StageResult result) {
        if (result.getStage() != stage) {
            throw new IllegalStateException("Result for " + result.getStage() + " recorded while session is in " + stage);
        }
        if (stageResults.stream().anyMatch(existing -> existing.getStage() == result.getStage())) {
            throw new IllegalStateException("Stage " + result.getStage() + " already has a result");
        }
        if (result.getConfidence() < 0.0 || result.getConfidence() > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + result.getConfidence());
        }
        stageResults.add(result);
        applyPatch(StageResultPatch.from(result));
    }

    public synchronized void applyPatch(StageResultPatch patch) {
        if (!patch.getStage().isWorkStage()) {
            throw new IllegalArgumentException("Stage " + patch.getStage() + " has no live result");
        }
        liveView.merge(patch.getStage(), patch, StageResultPatch::merge);
    }

    public synchronized void complete(ComplianceReport finalReport, String response, Instant at) {
        if (stage != PipelineStage.SYNTHESIZING) {
            throw new IllegalStateException("Cannot complete session " + sessionId + " from " + stage);
        }
        this.stage = PipelineStage.COMPLETE;
        this.report = finalReport;
        this.naturalResponse = response;
        this.completedAt = at;
    }

    /**
     * Moves the session to ERROR. Returns false if it had already finished.
     */
    public synchronized boolean fail(String message, Instant at) {
        if (stage.isTerminal()) {
            return false;
        }
        this.stage = PipelineStage.ERROR;
        this.errorMessage = message;
        this.completedAt = at;
        return true;
    }

    public synchronized PipelineStage getStage() {
        return stage;
    }

    public synchronized boolean isTerminal() {
        return stage.isTerminal();
    }

    public synchronized List<StageResult> getStageResults() {
        return List.copyOf(stageResults);
    }

    public synchronized Map<PipelineStage, StageResultPatch> getLiveView() {
        return Collections.unmodifiableMap(new EnumMap<>(liveView));
    }

    /**
     * Current state of every stage that has reported so far, running stages included, in pipeline order.
     */
    public synchronized List<StageResult> getLiveStages() {
        return liveView.values().stream()
                .map(patch -> patch.applyTo(null))
                .toList();
    }

    public synchronized ComplianceReport getReport() {
        return report;
    }

    public synchronized String getNaturalResponse() {
        return naturalResponse;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }
}
