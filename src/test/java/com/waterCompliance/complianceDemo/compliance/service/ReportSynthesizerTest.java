package com.waterCompliance.complianceDemo.compliance.service;

import com.waterCompliance.complianceDemo.compliance.model.ComplianceReport;
import com.waterCompliance.complianceDemo.compliance.model.NotificationRequirement;
import com.waterCompliance.complianceDemo.compliance.model.NotificationTier;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.compliance.model.ValidationOutcome;
import com.waterCompliance.complianceDemo.compliance.model.ValidationReport;
import com.waterCompliance.complianceDemo.compliance.model.Violation;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineStage;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResult;
import com.waterCompliance.complianceDemo.orchestrator.model.StageStatus;
import com.waterCompliance.complianceDemo.registry.model.RecordedViolation;
import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.waterCompliance.complianceDemo.compliance.ComplianceFixtures.CLOCK;
import static com.waterCompliance.complianceDemo.compliance.ComplianceFixtures.NOW;
import static com.waterCompliance.complianceDemo.compliance.ComplianceFixtures.bundledTable;
import static com.waterCompliance.complianceDemo.compliance.ComplianceFixtures.sample;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ReportSynthesizerTest {

    private static final WaterSystemInfo CLINTON = WaterSystemInfo.builder()
            .pwsid("OH7700001")
            .name("Clinton Machine PWS")
            .city("Clinton")
            .state("OH")
            .populationServed(76L)
            .dataSource("catalog")
            .build();

    private final ReportSynthesizer synthesizer = new ReportSynthesizer(CLOCK, Duration.ofHours(24));
    private final ViolationClassifier classifier = new ViolationClassifier(bundledTable());
    private final NotificationRequirementGenerator generator = new NotificationRequirementGenerator(0.10);
    private final SampleDataValidator validator = new SampleDataValidator(CLOCK, Duration.ofDays(365), Duration.ofMinutes(5));

    @Test
    void shouldTakeOverallRiskFromMostSevereViolation() {
        List<Violation> violations = classifier.classifyAll(List.of(
                sample("E. coli", 1, "P/A"),
                sample("Lead", 4, "ppb"),
                sample("Copper", 200, "ppb"),
                sample("PFOA", 6.0, "ng/L")));
        List<NotificationRequirement> requirements = generator.generateAll(violations, 0.04, null);

        ComplianceReport report = synthesizer.synthesize(completedStages(0.9, 0.8, 0.7),
                passingValidation(), violations, requirements, CLINTON, List.of());

        assertThat(report.getOverallRisk()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(report.getPopulationAffected()).isEqualTo(76L);
        assertThat(report.getViolationBreakdown().getTotal()).isEqualTo(2);
        assertThat(report.getViolationBreakdown().getByTier()).containsEntry(1, 1L).containsEntry(2, 1L);
        assertThat(report.getKeyFindings()).anyMatch(finding -> finding.startsWith("E. coli detected"));
        assertThat(report.getImmediateActions())
                .anyMatch(action -> action.contains("Tier 1 public notice for E. coli within 24 hours"));
        assertThat(report.getGeneratedAt()).isEqualTo(NOW);
        assertThat(report.getSystem().getLocation()).isEqualTo("Clinton, OH");
    }

    @Test
    void shouldCarryRecordedViolationHistoryIntoSummaryAndFindings() {
        WaterSystemInfo withHistory = CLINTON.toBuilder()
                .dataSource("sdwis")
                .recordedViolations(List.of(
                        RecordedViolation.builder().parameter("Lead").contaminantCode("PB90")
                                .tier(NotificationTier.TIER_2).severity(RiskLevel.CRITICAL).build(),
                        RecordedViolation.builder().parameter("Lead").contaminantCode("PB90")
                                .tier(NotificationTier.TIER_2).severity(RiskLevel.CRITICAL).build(),
                        RecordedViolation.builder().parameter("Nitrate").contaminantCode("1040")
                                .tier(NotificationTier.TIER_1).severity(RiskLevel.CRITICAL).build()))
                .build();

        ComplianceReport report = synthesizer.synthesize(completedStages(0.9, 0.9, 0.9),
                passingValidation(), List.of(), List.of(), withHistory, List.of());

        assertThat(report.getSystem().getRecordedViolations()).hasSize(3);
        assertThat(report.getKeyFindings())
                .containsExactly("EPA records list 3 prior violation(s) for this system: Lead, Nitrate");
        assertThat(report.getOverallRisk()).isEqualTo(RiskLevel.UNKNOWN);
    }

    @Test
    void shouldListOnlyUrgentNoticesAsImmediateActions() {
        List<Violation> violations = classifier.classifyAll(List.of(
                sample("E. coli", 1, "P/A"),
                sample("Lead", 4, "ppb"),
                sample("Copper", 200, "ppb"),
                sample("PFOA", 6.0, "ng/L")));
        List<NotificationRequirement> requirements = generator.generateAll(violations, 0.04, null);

        ComplianceReport report = synthesizer.synthesize(completedStages(0.9, 0.8, 0.7),
                passingValidation(), violations, requirements, CLINTON, List.of());

        assertThat(requirements).hasSize(2);
        assertThat(report.getImmediateActions()).hasSize(1);
        assertThat(report.getImmediateActions().get(0))
                .isEqualTo("Issue Tier 1 public notice for E. coli within 24 hours via broadcast media, direct posting");
    }

    @Test
    void shouldWidenImmediateActionsWithUrgentThreshold() {
        ReportSynthesizer relaxed = new ReportSynthesizer(CLOCK, Duration.ofDays(30));
        List<Violation> violations = classifier.classifyAll(List.of(
                sample("E. coli", 1, "P/A"),
                sample("Lead", 4, "ppb"),
                sample("Copper", 200, "ppb"),
                sample("PFOA", 6.0, "ng/L")));

        ComplianceReport report = relaxed.synthesize(completedStages(0.9, 0.8, 0.7),
                passingValidation(), violations, generator.generateAll(violations, 0.04, null), CLINTON, List.of());

        assertThat(report.getImmediateActions()).hasSize(2);
    }

    @Test
    void shouldReportUnknownRiskAndNoPopulationWhenClean() {
        ComplianceReport report = synthesizer.synthesize(completedStages(0.9, 0.9, 0.9),
                passingValidation(), List.of(), List.of(), CLINTON, List.of());

        assertThat(report.getOverallRisk()).isEqualTo(RiskLevel.UNKNOWN);
        assertThat(report.getValidationOutcome()).isEqualTo(ValidationOutcome.PASS);
        assertThat(report.getPopulationAffected()).isZero();
        assertThat(report.getKeyFindings()).isEmpty();
        assertThat(report.getImmediateActions()).isEmpty();
    }

    @Test
    void shouldReportUnknownRiskWhenValidationFailed() {
        ValidationReport failed = validator.validate("BAD", List.of(sample("Lead", 4, "ppb")));

        ComplianceReport report = synthesizer.synthesize(completedStages(0.9, 0.0, 0.9),
                failed, List.of(), List.of(), null, List.of());

        assertThat(report.getOverallRisk()).isEqualTo(RiskLevel.UNKNOWN);
        assertThat(report.getSystem().getDataSource()).isEqualTo("unavailable");
        assertThat(report.getValidationOutcome()).isEqualTo(ValidationOutcome.FAIL);
        assertThat(report.getKeyFindings()).isNotEmpty().allMatch(finding -> finding.startsWith("Data validation"));
        assertThat(report.getImmediateActions()).isEmpty();
    }

    @Test
    void shouldAverageConfidenceOverSuccessfulStagesOnly() {
        List<StageResult> stages = List.of(
                stage(PipelineStage.VALIDATING, StageStatus.COMPLETE, 0.9),
                stage(PipelineStage.DETECTING_VIOLATIONS, StageStatus.COMPLETE, 0.6),
                StageResult.degraded(PipelineStage.GENERATING_NOTIFICATIONS, "guidance down"));

        ComplianceReport report = synthesizer.synthesize(stages, passingValidation(), List.of(), List.of(), CLINTON, List.of());

        assertThat(report.getConfidence()).isCloseTo(0.75, within(1e-9));
        assertThat(report.getStageAssessments()).hasSize(3);
        assertThat(report.getStageAssessments().get(2).getStatus()).isEqualTo("error");
    }

    @Test
    void shouldReportZeroConfidenceWhenNoStageSucceeded() {
        ComplianceReport report = synthesizer.synthesize(List.of(), passingValidation(), List.of(), List.of(), CLINTON, null);

        assertThat(report.getConfidence()).isZero();
        assertThat(report.getGuidanceReferences()).isEmpty();
    }

    private ValidationReport passingValidation() {
        return validator.validate("OH7700001", List.of(sample("Lead", 4, "ppb")));
    }

    private static List<StageResult> completedStages(double validation, double detection, double notification) {
        return List.of(
                stage(PipelineStage.VALIDATING, StageStatus.COMPLETE, validation),
                stage(PipelineStage.DETECTING_VIOLATIONS, StageStatus.COMPLETE, detection),
                stage(PipelineStage.GENERATING_NOTIFICATIONS, StageStatus.COMPLETE, notification));
    }

    private static StageResult stage(PipelineStage stage, StageStatus status, double confidence) {
        return StageResult.builder()
                .stage(stage)
                .status(status)
                .confidence(confidence)
                .risk(RiskLevel.LOW)
                .decisions(List.of("reviewed"))
                .nextActions(List.of())
                .build();
    }
}
