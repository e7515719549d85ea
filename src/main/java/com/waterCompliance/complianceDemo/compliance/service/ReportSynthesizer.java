package com.waterCompliance.complianceDemo.compliance.service;

import com.waterCompliance.complianceDemo.compliance.model.ComplianceReport;
import com.waterCompliance.complianceDemo.compliance.model.DistributionMethod;
import com.waterCompliance.complianceDemo.compliance.model.NotificationRequirement;
import com.waterCompliance.complianceDemo.compliance.model.NotificationTier;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.compliance.model.StageAssessment;
import com.waterCompliance.complianceDemo.compliance.model.StatisticMethod;
import com.waterCompliance.complianceDemo.compliance.model.SystemSummary;
import com.waterCompliance.complianceDemo.compliance.model.ThresholdKind;
import com.waterCompliance.complianceDemo.compliance.model.ValidationOutcome;
import com.waterCompliance.complianceDemo.compliance.model.ValidationReport;
import com.waterCompliance.complianceDemo.compliance.model.Violation;
import com.waterCompliance.complianceDemo.compliance.model.ViolationBreakdown;
import com.waterCompliance.complianceDemo.guidance.model.GuidanceReference;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineStage;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResult;
import com.waterCompliance.complianceDemo.orchestrator.model.StageStatus;
import com.waterCompliance.complianceDemo.registry.model.RecordedViolation;
import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Merges the outputs of the earlier stages into the final {@link ComplianceReport}.
 * Pure aggregation: no external calls.
 */
@Component
public class ReportSynthesizer {

    private final Clock clock;
    private final Duration urgentThreshold;

    public ReportSynthesizer(Clock clock,
                             @Value("${compliance.report.urgent-threshold:PT24H}") Duration urgentThreshold) {
        this.clock = clock;
        this.urgentThreshold = urgentThreshold;
    }

    public ComplianceReport synthesize(List<StageResult> stageResults,
                                       ValidationReport validation,
                                       List<Violation> violations,
                                       List<NotificationRequirement> requirements,
                                       WaterSystemInfo system,
                                       List<GuidanceReference> guidance) {
        List<StageResult> results = stageResults == null ? List.of() : stageResults;
        List<Violation> found = violations == null ? List.of() : violations;
        List<NotificationRequirement> notices = requirements == null ? List.of() : requirements;

        RiskLevel overallRisk = overallRisk(found);
        long population = found.isEmpty() || system == null || system.getPopulationServed() == null
                ? 0L : system.getPopulationServed();

        return ComplianceReport.builder()
                .system(systemSummary(validation, system))
                .overallRisk(overallRisk)
                .validationOutcome(validation != null ? validation.getOutcome() : null)
                .populationAffected(population)
                .confidence(confidence(results))
                .keyFindings(keyFindings(validation, found, system))
                .immediateActions(immediateActions(notices))
                .stageAssessments(results.stream().map(this::assessment).toList())
                .violations(found)
                .notificationRequirements(notices)
                .violationBreakdown(breakdown(found))
                .guidanceReferences(guidance == null ? List.of() : guidance)
                .generatedAt(clock.instant())
                .build();
    }

    RiskLevel overallRisk(List<Violation> violations) {
        return violations.stream()
                .map(Violation::getSeverity)
                .reduce(RiskLevel.UNKNOWN, RiskLevel::max);
    }

    /**
     * Mean confidence of the stages that finished without error, synthesis excluded.
     */
    double confidence(List<StageResult> results) {
        return results.stream()
                .filter(result -> result.getStage() != PipelineStage.SYNTHESIZING)
                .filter(result -> result.getStatus() != StageStatus.ERROR)
                .mapToDouble(StageResult::getConfidence)
                .average()
                .orElse(0.0);
    }

    private SystemSummary systemSummary(ValidationReport validation, WaterSystemInfo system) {
        if (system == null) {
            return SystemSummary.builder()
                    .pwsid(validation != null ? validation.getPwsid() : null)
                    .dataSource("unavailable")
                    .build();
        }
        return SystemSummary.builder()
                .pwsid(system.getPwsid())
                .name(system.getName())
                .location(system.location())
                .populationServed(system.getPopulationServed())
                .dataSource(system.getDataSource())
                .recordedViolations(system.getRecordedViolations() == null ? List.of() : system.getRecordedViolations())
                .build();
    }

    private List<String> keyFindings(ValidationReport validation, List<Violation> violations, WaterSystemInfo system) {
        List<String> findings = new ArrayList<>();
        if (validation != null && validation.getOutcome() != ValidationOutcome.PASS) {
            validation.getFindings().stream()
                    .filter(finding -> finding.getOutcome() != ValidationOutcome.PASS)
                    .map(finding -> "Data validation " + finding.describe())
                    .forEach(findings::add);
        }
        violations.stream()
                .map(ReportSynthesizer::describeViolation)
                .forEach(findings::add);
        if (system != null && system.getRecordedViolations() != null && !system.getRecordedViolations().isEmpty()) {
            findings.add(describeHistory(system.getRecordedViolations()));
        }
        return findings;
    }

    private static String describeHistory(List<RecordedViolation> history) {
        String parameters = history.stream()
                .map(RecordedViolation::getParameter)
                .distinct()
                .collect(Collectors.joining(", "));
        return "EPA records list " + history.size() + " prior violation(s) for this system: " + parameters;
    }

    /**
     * One action per notice whose delivery window falls within the urgent threshold.
     */
    private List<String> immediateActions(List<NotificationRequirement> requirements) {
        List<String> actions = new ArrayList<>();
        for (NotificationRequirement requirement : requirements) {
            if (requirement.getDeadlineWindow().compareTo(urgentThreshold) > 0) {
                continue;
            }
            String methods = requirement.getMethods().stream()
                    .map(ReportSynthesizer::humanize)
                    .collect(Collectors.joining(", "));
            actions.add("Issue Tier " + requirement.getTier().getNumber() + " public notice for "
                    + requirement.getParameter() + " within " + requirement.getDeadline() + " via " + methods
                    + (requirement.isMultiLanguageRequired() ? " (multi-language)" : ""));
        }
        return actions;
    }

    private StageAssessment assessment(StageResult result) {
        List<String> decisions = result.getDecisions();
        return StageAssessment.builder()
                .agent(result.getAgent())
                .status(result.getStatus().wireValue())
                .risk(result.getRisk())
                .confidence(result.getConfidence())
                .topDecision(decisions == null || decisions.isEmpty() ? null : decisions.get(0))
                .build();
    }

    private ViolationBreakdown breakdown(List<Violation> violations) {
        Map<RiskLevel, Long> bySeverity = new EnumMap<>(RiskLevel.class);
        Map<Integer, Long> byTier = new TreeMap<>();
        for (Violation violation : violations) {
            bySeverity.merge(violation.getSeverity(), 1L, Long::sum);
            byTier.merge(violation.getTier().getNumber(), 1L, Long::sum);
        }
        return ViolationBreakdown.builder()
                .total(violations.size())
                .bySeverity(bySeverity)
                .byTier(byTier)
                .build();
    }

    static String describeViolation(Violation violation) {
        if (violation.getThresholdKind() == ThresholdKind.MONITORING_REQUIREMENT) {
            return violation.getParameter() + " monitoring not performed (Tier "
                    + violation.getTier().getNumber() + ", " + violation.getSeverity() + ")";
        }
        String measured = switch (violation.getStatistic()) {
            case PRESENCE -> "detected";
            case PERCENTILE -> "90th percentile " + format(violation.getMeasuredValue()) + " " + violation.getUnit();
            case MAXIMUM -> "maximum " + format(violation.getMeasuredValue()) + " " + violation.getUnit();
            case ARITHMETIC_MEAN, GEOMETRIC_MEAN -> "average " + format(violation.getMeasuredValue()) + " " + violation.getUnit();
        };
        String limit = violation.getThresholdKind() == ThresholdKind.ACTION_LEVEL
                ? "action level" : "MCL";
        String comparison = violation.getStatistic() == StatisticMethod.PRESENCE
                ? "" : " exceeds " + limit + " " + format(violation.getThreshold()) + " " + violation.getUnit();
        String tier = violation.getTier() == NotificationTier.TIER_1 ? "Tier 1, acute" : "Tier " + violation.getTier().getNumber();
        return violation.getParameter() + " " + measured + comparison + " (" + tier + ", " + violation.getSeverity() + ")"
                + (violation.getCitation() != null ? " - " + violation.getCitation() : "");
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value).replaceAll("\\.?0+$", "");
    }

    private static String humanize(DistributionMethod method) {
        return method.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
