package com.waterCompliance.complianceDemo.reasoning.client;

import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.orchestrator.prompt.StagePrompts;
import com.waterCompliance.complianceDemo.reasoning.model.ReasoningDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Offline reasoning used when no model provider is configured. Reads the fact lines
 * of the stage prompt and answers deterministically.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "reasoning.provider", havingValue = "demo", matchIfMissing = true)
public class DemoReasoningClient implements ReasoningClient {

    private static final double DEMO_CONFIDENCE = 0.9;

    @Override
    public ReasoningDecision reason(String systemPrompt, String stagePrompt) {
        String stage = fact(stagePrompt, StagePrompts.STAGE_LABEL).orElse("analysis");
        String system = fact(stagePrompt, StagePrompts.SYSTEM_LABEL).orElse("the water system");
        int violationCount = fact(stagePrompt, StagePrompts.VIOLATION_COUNT_LABEL).map(Integer::parseInt).orElse(0);
        RiskLevel risk = fact(stagePrompt, StagePrompts.HIGHEST_SEVERITY_LABEL)
                .map(RiskLevel::fromLabel)
                .filter(level -> level != RiskLevel.UNKNOWN)
                .orElseGet(() -> riskFromValidation(fact(stagePrompt, StagePrompts.VALIDATION_OUTCOME_LABEL).orElse(null)));

        String thinking = "Reviewing " + stage + " results for " + system + " with " + violationCount + " violation(s). "
                + (risk == RiskLevel.CRITICAL
                    ? "An acute violation is present and requires Tier 1 notification within 24 hours."
                    : "No acute violation is present; standard notification timelines apply.");
        log.debug("Demo reasoning produced - stage: {}, risk: {}", stage, risk);

        return ReasoningDecision.builder()
                .message(capitalize(stage) + " reviewed for " + system)
                .reasoning(thinking)
                .risk(risk)
                .confidence(DEMO_CONFIDENCE)
                .decisions(List.of(risk == RiskLevel.CRITICAL ? "immediate_action" : "standard_notification"))
                .nextActions(List.of("generate_notifications", "implement_corrective_actions"))
                .build();
    }

    private static RiskLevel riskFromValidation(String outcome) {
        if (outcome == null) {
            return RiskLevel.LOW;
        }
        return switch (outcome) {
            case "FAIL" -> RiskLevel.HIGH;
            case "CONDITIONAL" -> RiskLevel.MEDIUM;
            default -> RiskLevel.LOW;
        };
    }

    private static Optional<String> fact(String prompt, String label) {
        return prompt.lines()
                .filter(line -> line.startsWith(label))
                .map(line -> line.substring(label.length()).trim())
                .filter(value -> !value.isEmpty())
                .findFirst();
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
