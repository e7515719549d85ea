package com.waterCompliance.complianceDemo.orchestrator.model;

import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageResultPatchTest {

    @Test
    void shouldLeaveFieldsUntouchedWhenPatchOmitsThem() {
        StageResult previous = StageResult.builder()
                .stage(PipelineStage.VALIDATING)
                .status(StageStatus.RUNNING)
                .message("Data Validator analyzing...")
                .confidence(0.4)
                .risk(RiskLevel.MEDIUM)
                .decisions(List.of("schema_ok"))
                .nextActions(List.of())
                .build();
        StageResultPatch patch = StageResultPatch.builder()
                .stage(PipelineStage.VALIDATING)
                .status(StageStatus.COMPLETE)
                .confidence(0.9)
                .build();

        StageResult merged = patch.applyTo(previous);

        assertThat(merged.getStatus()).isEqualTo(StageStatus.COMPLETE);
        assertThat(merged.getConfidence()).isEqualTo(0.9);
        assertThat(merged.getMessage()).isEqualTo("Data Validator analyzing...");
        assertThat(merged.getRisk()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(merged.getDecisions()).containsExactly("schema_ok");
    }

    @Test
    void shouldStartFromIdleResultWhenNothingWasReceived() {
        StageResult merged = StageResultPatch.running(PipelineStage.SYNTHESIZING).applyTo(null);

        assertThat(merged.getStatus()).isEqualTo(StageStatus.RUNNING);
        assertThat(merged.getConfidence()).isZero();
        assertThat(merged.getRisk()).isEqualTo(RiskLevel.UNKNOWN);
    }

    @Test
    void shouldClampConfidenceIntoUnitRange() {
        StageResultPatch patch = StageResultPatch.builder().stage(PipelineStage.VALIDATING).confidence(1.7).build();

        assertThat(patch.applyTo(null).getConfidence()).isEqualTo(1.0);
        assertThat(StageResult.clampConfidence(-0.2)).isZero();
        assertThat(StageResult.clampConfidence(Double.NaN)).isZero();
    }

    @Test
    void shouldLetNewerPatchWinOnMerge() {
        StageResultPatch running = StageResultPatch.running(PipelineStage.DETECTING_VIOLATIONS);
        StageResultPatch done = StageResultPatch.builder()
                .stage(PipelineStage.DETECTING_VIOLATIONS)
                .status(StageStatus.COMPLETE)
                .risk(RiskLevel.HIGH)
                .build();

        StageResultPatch merged = running.merge(done);

        assertThat(merged.getStatus()).isEqualTo(StageStatus.COMPLETE);
        assertThat(merged.getRisk()).isEqualTo(RiskLevel.HIGH);
        assertThat(merged.getThinkingStream()).isEqualTo(running.getThinkingStream());
    }

    @Test
    void shouldTruncateThinkingPreview() {
        String trace = "x".repeat(1000);
        StageResult result = StageResult.builder()
                .stage(PipelineStage.VALIDATING)
                .status(StageStatus.COMPLETE)
                .reasoningTrace(trace)
                .build();

        StageResultPatch patch = StageResultPatch.from(result);

        assertThat(patch.getThinkingPreview()).hasSize(StageResultPatch.PREVIEW_LENGTH + 3).endsWith("...");
        assertThat(patch.getFullThinking()).isEqualTo(trace);
    }

    @Test
    void shouldRejectPatchForAnotherStage() {
        StageResultPatch patch = StageResultPatch.running(PipelineStage.VALIDATING);

        assertThatThrownBy(() -> patch.applyTo(StageResult.idle(PipelineStage.SYNTHESIZING)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
