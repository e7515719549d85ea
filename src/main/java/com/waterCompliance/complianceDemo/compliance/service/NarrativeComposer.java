package com.waterCompliance.complianceDemo.compliance.service;

import com.waterCompliance.complianceDemo.compliance.model.ComplianceReport;
import com.waterCompliance.complianceDemo.compliance.model.NotificationRequirement;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.compliance.model.ThresholdEntry;
import com.waterCompliance.complianceDemo.compliance.model.ValidationOutcome;
import com.waterCompliance.complianceDemo.orchestrator.model.AnalysisIntent;
import com.waterCompliance.complianceDemo.orchestrator.model.QueryIntent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns a finished report into a short plain-language answer to the user's question.
 */
@Component
public class NarrativeComposer {

    private static final int MAX_FINDINGS = 3;

    public String compose(ComplianceReport report, QueryIntent intent) {
        StringBuilder answer = new StringBuilder();
        String systemName = report.getSystem().getName() != null
                ? report.getSystem().getName() : "System " + report.getSystem().getPwsid();

        answer.append(headline(report, systemName)).append("\n\n");

        if (intent != null && intent.getIntent() == AnalysisIntent.CONTAMINANT_INQUIRY && intent.getContaminant() != null) {
            answer.append(contaminantAnswer(report, intent.getContaminant())).append("\n\n");
        }

        List<String> findings = report.getKeyFindings();
        if (!findings.isEmpty()) {
            answer.append("Key findings:\n");
            findings.stream().limit(MAX_FINDINGS).forEach(finding -> answer.append("- ").append(finding).append('\n'));
            if (findings.size() > MAX_FINDINGS) {
                answer.append("- and ").append(findings.size() - MAX_FINDINGS).append(" more\n");
            }
        }

        if (!report.getNotificationRequirements().isEmpty()) {
            answer.append('\n').append(notificationSummary(report.getNotificationRequirements())).append('\n');
        }

        if (intent != null && intent.isDefaultedSystem()) {
            answer.append("\nNo water system was named in the question, so the default demonstration system was analyzed.\n");
        }

        answer.append(String.format(Locale.ROOT, "%nAnalysis confidence: %.0f%%", report.getConfidence() * 100));
        return answer.toString();
    }

    private String headline(ComplianceReport report, String systemName) {
        int count = report.getViolations().size();
        RiskLevel risk = report.getOverallRisk();
        return switch (risk) {
            case CRITICAL -> "CRITICAL: " + systemName + " has " + count
                    + " violation(s) including acute health risks. Immediate public notification is required.";
            case HIGH -> "HIGH RISK: " + systemName + " has " + count
                    + " violation(s) that require public notification and corrective action.";
            case MEDIUM -> "ATTENTION: " + systemName + " has " + count + " violation(s) of moderate concern.";
            case LOW -> systemName + " has " + count + " low-severity violation(s).";
            case UNKNOWN -> report.getValidationOutcome() == ValidationOutcome.FAIL
                    ? "Compliance of " + systemName + " could not be determined because the submitted data failed validation."
                    : systemName + " shows no violations in the submitted samples.";
        };
    }

    private String contaminantAnswer(ComplianceReport report, String contaminant) {
        String key = ThresholdEntry.normalizeKey(contaminant);
        return report.getViolations().stream()
                .filter(violation -> ThresholdEntry.normalizeKey(violation.getParameter()).equals(key))
                .findFirst()
                .map(violation -> "About " + violation.getParameter() + ": " + ReportSynthesizer.describeViolation(violation)
                        + (violation.getHealthEffects() != null ? ". " + violation.getHealthEffects() : ""))
                .orElse("About " + contaminant + ": no violation was found in the submitted samples.");
    }

    private String notificationSummary(List<NotificationRequirement> requirements) {
        return "Public notification: " + requirements.stream()
                .map(requirement -> requirement.getParameter() + " (Tier " + requirement.getTier().getNumber()
                        + ", within " + requirement.getDeadline() + ")")
                .collect(Collectors.joining("; "));
    }
}
