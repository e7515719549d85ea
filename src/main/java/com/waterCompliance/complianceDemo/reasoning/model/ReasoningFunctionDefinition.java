package com.waterCompliance.complianceDemo.reasoning.model;

import java.util.List;
import java.util.Map;

/**
 * Function schema the model must call to report a stage assessment.
 */
public final class ReasoningFunctionDefinition {

    private ReasoningFunctionDefinition() {}

    public static final String FUNCTION_NAME = "report_stage_assessment";
    public static final String FUNCTION_DESCRIPTION = """
        Reports the assessment of one compliance analysis stage for a public water system.
        Summarize what the deterministic results show, rate the public health risk
        and list the decisions and follow-up actions for this stage.
        """;

    public static Map<String, Object> getFunctionSchema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "message", Map.of(
                    "type", "string",
                    "description", "One or two sentence summary of the stage outcome"
                ),
                "thinkingProcess", Map.of(
                    "type", "string",
                    "description", "Step-by-step reasoning behind the assessment"
                ),
                "riskAssessment", Map.of(
                    "type", "string",
                    "enum", List.of("CRITICAL", "HIGH", "MEDIUM", "LOW"),
                    "description", "Public health risk level for this stage"
                ),
                "confidence", Map.of(
                    "type", "number",
                    "description", "Confidence in the assessment from 0.0 to 1.0",
                    "minimum", 0.0,
                    "maximum", 1.0
                ),
                "decisions", Map.of(
                    "type", "array",
                    "items", Map.of("type", "string"),
                    "description", "Decisions taken in this stage"
                ),
                "nextActions", Map.of(
                    "type", "array",
                    "items", Map.of("type", "string"),
                    "description", "Recommended follow-up actions"
                )
            ),
            "required", List.of("message", "riskAssessment", "confidence", "decisions", "nextActions")
        );
    }
}
