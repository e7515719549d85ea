package com.waterCompliance.complianceDemo.compliance.service;

import com.waterCompliance.complianceDemo.compliance.config.ThresholdTable;
import com.waterCompliance.complianceDemo.compliance.exception.RuleEvaluationException;
import com.waterCompliance.complianceDemo.compliance.model.ComparisonMode;
import com.waterCompliance.complianceDemo.compliance.model.DistributionMethod;
import com.waterCompliance.complianceDemo.compliance.model.NotificationRequirement;
import com.waterCompliance.complianceDemo.compliance.model.NotificationTier;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.compliance.model.SampleRecord;
import com.waterCompliance.complianceDemo.compliance.model.StatisticMethod;
import com.waterCompliance.complianceDemo.compliance.model.ThresholdEntry;
import com.waterCompliance.complianceDemo.compliance.model.ThresholdKind;
import com.waterCompliance.complianceDemo.compliance.model.Violation;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static com.waterCompliance.complianceDemo.compliance.ComplianceFixtures.bundledTable;
import static com.waterCompliance.complianceDemo.compliance.ComplianceFixtures.sample;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ViolationClassifierTest {

    private final ViolationClassifier classifier = new ViolationClassifier(bundledTable());

    // ========== Presence ==========

    @Test
    void shouldClassifyAnyEColiPresenceAsAcuteTierOne() {
        Optional<Violation> violation = classifier.classify("E. coli", List.of(
                sample("E. coli", 0, "P/A"),
                sample("E.coli", 1, "P/A")));

        assertThat(violation).isPresent();
        assertThat(violation.get().getTier()).isEqualTo(NotificationTier.TIER_1);
        assertThat(violation.get().getSeverity()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(violation.get().getExceedanceRatio()).isNull();
        assertThat(violation.get().getSampleCount()).isEqualTo(2);
    }

    @Test
    void shouldNotFlagAbsentEColi() {
        assertThat(classifier.classify("E. coli", List.of(sample("E. coli", 0, "P/A")))).isEmpty();
    }

    @Test
    void shouldTreatPositiveColonyCountAsEColiPresence() {
        Violation violation = classifier.classify("E. coli", List.of(
                sample("E. coli", 0, "CFU/100mL"),
                sample("E. coli", 3, "CFU/100mL"))).orElseThrow();

        assertThat(violation.getTier()).isEqualTo(NotificationTier.TIER_1);
        assertThat(violation.getSeverity()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(violation.getMeasuredValue()).isEqualTo(1.0);
        assertThat(classifier.classify("E. coli", List.of(sample("E. coli", 0, "MPN/100mL")))).isEmpty();
    }

    @Test
    void shouldRejectConcentrationUnitForPresenceParameter() {
        assertThatThrownBy(() -> classifier.classify("E. coli", List.of(sample("E. coli", 2, "mg/L"))))
                .isInstanceOf(RuleEvaluationException.class)
                .hasMessageContaining("presence");
    }

    // ========== Percentile action levels ==========

    @Test
    void shouldUseNinetiethPercentileForLeadAndRaiseSeverityFromHealthBand() {
        List<SampleRecord> lead = List.of(
                sample("Lead", 4, "ppb"),
                sample("Lead", 9, "ppb"),
                sample("Lead", 12, "ppb"),
                sample("Lead", 18, "ppb"),
                sample("Lead", 0.031, "mg/L"));

        Violation violation = classifier.classify("Lead", lead).orElseThrow();

        assertThat(violation.getMeasuredValue()).isCloseTo(31.0, within(1e-9));
        assertThat(violation.getThresholdKind()).isEqualTo(ThresholdKind.ACTION_LEVEL);
        assertThat(violation.getTier()).isEqualTo(NotificationTier.TIER_2);
        assertThat(violation.getExceedanceRatio()).isCloseTo(31.0 / 15.0, within(1e-9));
        assertThat(violation.getSeverity()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(violation.getCitation()).isEqualTo("40 CFR 141.80(c)");
    }

    @Test
    void shouldKeepTierSeverityBelowHealthBand() {
        Violation violation = classifier.classify("Lead", List.of(sample("Lead", 20, "ppb"))).orElseThrow();

        assertThat(violation.getSeverity()).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void shouldNotFlagValueEqualToThreshold() {
        assertThat(classifier.classify("Lead", List.of(sample("Lead", 15, "ppb")))).isEmpty();
        assertThat(classifier.classify("Lead", List.of(sample("Lead", 16, "ppb")))).isPresent();
    }

    @Test
    void shouldFlagValueEqualToThresholdWhenComparisonIsInclusive() {
        ThresholdEntry turbidity = ThresholdEntry.builder()
                .parameter("Turbidity")
                .threshold(1)
                .unit("NTU")
                .statistic(StatisticMethod.MAXIMUM)
                .comparison(ComparisonMode.GREATER_OR_EQUAL)
                .tier(NotificationTier.TIER_2)
                .build();
        ViolationClassifier inclusive = new ViolationClassifier(new ThresholdTable(List.of(turbidity), List.of()));

        assertThat(inclusive.classify("Turbidity", List.of(sample("Turbidity", 1, "NTU")))).isPresent();
        assertThat(inclusive.classify("Turbidity", List.of(sample("Turbidity", 0.99, "NTU")))).isEmpty();
    }

    // ========== Geometric mean ==========

    @Test
    void shouldSubstituteZeroPlateCountsInsteadOfFailing() {
        List<SampleRecord> clean = List.of(
                sample("HPC", 0, "CFU/mL"),
                sample("HPC", 1200, "CFU/mL"),
                sample("HPC", 900, "CFU/mL"));
        List<SampleRecord> heavy = List.of(
                sample("HPC", 0, "CFU/mL"),
                sample("HPC", 120000, "CFU/mL"),
                sample("HPC", 90000, "CFU/mL"));

        // (1 * 1200 * 900)^(1/3) is about 103
        assertThat(classifier.classify("Heterotrophic Plate Count", clean)).isEmpty();

        Violation violation = classifier.classify("Heterotrophic Plate Count", heavy).orElseThrow();
        assertThat(violation.getMeasuredValue()).isCloseTo(2210.4, within(0.1));
        assertThat(violation.getTier()).isEqualTo(NotificationTier.TIER_3);
    }

    @Test
    void shouldRejectNegativePlateCount() {
        assertThatThrownBy(() -> classifier.classify("HPC", List.of(sample("HPC", -5, "CFU/mL"))))
                .isInstanceOf(RuleEvaluationException.class);
    }

    @Test
    void shouldClassifyTenLeadSamplesAboveActionLevelAsTierTwoWithThirtyDayNotice() {
        List<SampleRecord> records = Stream.concat(
                        Stream.of(sample("E. coli", 0, "P/A"), sample("Copper", 200, "ppb")),
                        Stream.of(2, 3, 4, 5, 6, 7, 8, 10, 12, 18).map(value -> sample("Lead", value, "ppb")))
                .toList();

        List<Violation> violations = classifier.classifyAll(records);

        assertThat(violations).hasSize(1);
        Violation violation = violations.get(0);
        assertThat(violation.getMeasuredValue()).isCloseTo(18.0, within(1e-9));
        assertThat(violation.getTier()).isEqualTo(NotificationTier.TIER_2);
        assertThat(violation.getSeverity()).isEqualTo(RiskLevel.HIGH);

        NotificationRequirement requirement = new NotificationRequirementGenerator(0.10).generateRequirement(violation, null, null);
        assertThat(requirement.getDeadlineWindow()).isEqualTo(Duration.ofDays(30));
        assertThat(requirement.getMethods()).containsExactly(DistributionMethod.DIRECT_MAIL, DistributionMethod.HAND_DELIVERY);
    }

    // ========== Mixed record sets ==========

    @Test
    void shouldReturnViolationsInTableOrder() {
        List<Violation> violations = classifier.classifyAll(List.of(
                sample("PFOA", 6.2, "ng/L"),
                sample("Copper", 420, "ppb"),
                sample("Lead", 31, "ppb"),
                sample("E. coli", 1, "P/A")));

        assertThat(violations).extracting(Violation::getParameter).containsExactly("E. coli", "Lead", "PFOA");
    }

    @Test
    void shouldIgnoreOtherParametersWhenClassifyingOne() {
        assertThat(classifier.classify("Copper", List.of(sample("Lead", 90, "ppb"), sample("Copper", 100, "ppb"))))
                .isEmpty();
    }

    @Test
    void shouldProduceSameResultForSameInput() {
        List<SampleRecord> records = List.of(sample("Nitrate", 12, "mg/L"), sample("Arsenic", 14, "ug/L"));

        assertThat(classifier.classifyAll(records)).isEqualTo(classifier.classifyAll(records));
    }

    // ========== Rule errors ==========

    @Test
    void shouldRejectUnknownParameter() {
        assertThatThrownBy(() -> classifier.classifyAll(List.of(sample("Unobtainium", 1, "ppb"))))
                .isInstanceOf(RuleEvaluationException.class)
                .hasMessageContaining("Unobtainium");
    }

    @Test
    void shouldRejectIncompatibleUnit() {
        assertThatThrownBy(() -> classifier.classify("Lead", List.of(sample("Lead", 3, "CFU/mL"))))
                .isInstanceOf(RuleEvaluationException.class);
    }

    @Test
    void shouldRejectEmptyRecordsWithoutMonitoringRequirement() {
        assertThatThrownBy(() -> classifier.classify("Lead", List.of()))
                .isInstanceOf(RuleEvaluationException.class);
    }

    // ========== Monitoring requirements ==========

    @Test
    void shouldReportRoutinelyMonitoredParametersMissingFromBundledTable() {
        List<Violation> violations = classifier.classifyAll(List.of(sample("Nitrate", 2.4, "mg/L")));

        assertThat(violations).extracting(Violation::getParameter).containsExactly("E. coli", "Lead", "Copper");
        assertThat(violations).allSatisfy(violation -> {
            assertThat(violation.getThresholdKind()).isEqualTo(ThresholdKind.MONITORING_REQUIREMENT);
            assertThat(violation.getTier()).isEqualTo(NotificationTier.TIER_3);
        });
        assertThat(violations).extracting(Violation::getSeverity)
                .containsExactly(RiskLevel.MEDIUM, RiskLevel.MEDIUM, RiskLevel.LOW);
    }

    @Test
    void shouldReportMissingMonitoringAsTierThree() {
        ThresholdEntry radium = ThresholdEntry.builder()
                .parameter("Radium")
                .threshold(5)
                .unit("pCi/L")
                .statistic(StatisticMethod.ARITHMETIC_MEAN)
                .tier(NotificationTier.TIER_2)
                .monitoringRequired(true)
                .build();
        ViolationClassifier monitoringClassifier = new ViolationClassifier(new ThresholdTable(List.of(radium), List.of()));

        List<Violation> violations = monitoringClassifier.classifyAll(List.of());

        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).getThresholdKind()).isEqualTo(ThresholdKind.MONITORING_REQUIREMENT);
        assertThat(violations.get(0).getTier()).isEqualTo(NotificationTier.TIER_3);
        assertThat(violations.get(0).getSeverity()).isEqualTo(RiskLevel.LOW);
        assertThat(violations.get(0).getSampleCount()).isZero();
    }
}
