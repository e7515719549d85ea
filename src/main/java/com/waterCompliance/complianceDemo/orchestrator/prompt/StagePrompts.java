package com.waterCompliance.complianceDemo.orchestrator.prompt;

import com.waterCompliance.complianceDemo.compliance.model.NotificationRequirement;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.compliance.model.ValidationFinding;
import com.waterCompliance.complianceDemo.compliance.model.Violation;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineContext;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineStage;
import com.waterCompliance.complianceDemo.registry.model.WaterSystemInfo;

import java.util.List;
import java.util.Locale;

/**
 * Prompts for the per-stage reasoning call.
 *
 * The stage prompt is a block of labelled fact lines computed by the deterministic
 * rules. The model narrates and rates; it never decides tiers or thresholds.
 */
public class StagePrompts {

    public static final String STAGE_LABEL = "Stage:";
    public static final String SYSTEM_LABEL = "System:";
    public static final String VALIDATION_OUTCOME_LABEL = "Validation outcome:";
    public static final String VIOLATION_COUNT_LABEL = "Violation count:";
    public static final String HIGHEST_SEVERITY_LABEL = "Highest severity:";

    private StagePrompts() {}

    /**
     * Gets the system prompt for a stage's specialist role.
     */
    public static String getSystemPrompt(PipelineStage stage) {
        return """
            You are the %s in a drinking water compliance review team.
            You receive facts that were computed by deterministic regulatory rules
            (40 CFR Part 141). Do not recalculate thresholds, tiers or deadlines; treat them as given.

            You MUST call the report_stage_assessment function with:
            - message: one or two sentences summarizing the stage outcome for a compliance officer
            - thinkingProcess: your step-by-step reasoning (assessment, regulatory context, risk, decision)
            - riskAssessment: CRITICAL, HIGH, MEDIUM or LOW public health risk
            - confidence: 0.0 to 1.0
            - decisions: short decisions taken in this stage
            - nextActions: recommended follow-up actions

            %s
            """.formatted(stage.getDisplayName(), roleGuidance(stage));
    }

    private static String roleGuidance(PipelineStage stage) {
        return switch (stage) {
            case VALIDATING -> "Focus on whether the sample data is trustworthy enough to evaluate.";
            case DETECTING_VIOLATIONS -> "Focus on which exceedances matter most for public health and why.";
            case GENERATING_NOTIFICATIONS -> "Focus on notification urgency, audiences and language needs.";
            default -> "Summarize the overall compliance position.";
        };
    }

    public static String buildStagePrompt(PipelineStage stage, PipelineContext context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(STAGE_LABEL).append(' ').append(stage.getDisplayName().toLowerCase(Locale.ROOT)).append('\n');
        prompt.append(SYSTEM_LABEL).append(' ').append(describeSystem(context)).append('\n');
        if (context.getCommand() != null && context.getCommand().getQuestion() != null) {
            prompt.append("Question: ").append(context.getCommand().getQuestion()).append('\n');
        }

        if (context.getValidationReport() != null) {
            prompt.append(VALIDATION_OUTCOME_LABEL).append(' ').append(context.getValidationReport().getOutcome()).append('\n');
            prompt.append("Samples: ").append(context.getValidationReport().getSampleCount()).append('\n');
            for (ValidationFinding finding : context.getValidationReport().getFindings()) {
                prompt.append("- ").append(finding.describe()).append('\n');
            }
        }

        List<Violation> violations = context.getViolations();
        if (stage != PipelineStage.VALIDATING && violations != null) {
            prompt.append(VIOLATION_COUNT_LABEL).append(' ').append(violations.size()).append('\n');
            RiskLevel highest = violations.stream().map(Violation::getSeverity).reduce(RiskLevel.LOW, RiskLevel::max);
            if (!violations.isEmpty()) {
                prompt.append(HIGHEST_SEVERITY_LABEL).append(' ').append(highest).append('\n');
            }
            for (Violation violation : violations) {
                prompt.append(String.format(Locale.ROOT, "- %s: %.3f %s vs limit %.3f %s (%s, tier %d, %s)%n",
                        violation.getParameter(), violation.getMeasuredValue(), violation.getUnit(),
                        violation.getThreshold(), violation.getUnit(), violation.getStatistic(),
                        violation.getTier().getNumber(), violation.getSeverity()));
            }
        }

        List<NotificationRequirement> requirements = context.getNotificationRequirements();
        if (stage == PipelineStage.GENERATING_NOTIFICATIONS && requirements != null) {
            for (NotificationRequirement requirement : requirements) {
                prompt.append("- Notice: ").append(requirement.getParameter())
                        .append(", tier ").append(requirement.getTier().getNumber())
                        .append(", deadline ").append(requirement.getDeadline())
                        .append(requirement.isMultiLanguageRequired() ? ", multi-language" : "")
                        .append('\n');
            }
        }
        return prompt.toString();
    }

    private static String describeSystem(PipelineContext context) {
        WaterSystemInfo info = context.getSystemInfo();
        if (info == null) {
            return context.getPwsid() != null ? context.getPwsid() : "unknown";
        }
        String population = info.getPopulationServed() != null ? ", population " + info.getPopulationServed() : "";
        return info.getName() + " (" + info.getPwsid() + population + ")";
    }
}
