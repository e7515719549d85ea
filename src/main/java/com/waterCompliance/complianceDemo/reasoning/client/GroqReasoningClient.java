package com.waterCompliance.complianceDemo.reasoning.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waterCompliance.complianceDemo.compliance.model.RiskLevel;
import com.waterCompliance.complianceDemo.external.exception.ExternalCallException;
import com.waterCompliance.complianceDemo.reasoning.dto.GroqApiRequest;
import com.waterCompliance.complianceDemo.reasoning.dto.GroqApiResponse;
import com.waterCompliance.complianceDemo.reasoning.dto.ReasoningApiResponse;
import com.waterCompliance.complianceDemo.reasoning.model.ReasoningDecision;
import com.waterCompliance.complianceDemo.reasoning.model.ReasoningFunctionDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Stage reasoning backed by Groq function calling.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reasoning.provider", havingValue = "groq")
public class GroqReasoningClient implements ReasoningClient {

    private final GroqApiClient groqApiClient;
    private final ObjectMapper objectMapper;

    @Override
    public ReasoningDecision reason(String systemPrompt, String stagePrompt) {
        GroqApiRequest.Tool assessmentTool = GroqApiRequest.Tool.builder()
                .type("function")
                .function(GroqApiRequest.Function.builder()
                        .name(ReasoningFunctionDefinition.FUNCTION_NAME)
                        .description(ReasoningFunctionDefinition.FUNCTION_DESCRIPTION)
                        .parameters(ReasoningFunctionDefinition.getFunctionSchema())
                        .build())
                .build();

        GroqApiResponse groqResponse = groqApiClient.callGroqApiWithTools(
                systemPrompt,
                stagePrompt,
                List.of(assessmentTool),
                "required"
        );

        if (!groqResponse.hasToolCalls()) {
            throw new ExternalCallException("Groq API did not return expected function call");
        }

        ReasoningApiResponse arguments = parseFunctionCallResponse(groqResponse);
        log.debug("Stage assessment parsed - risk: {}, confidence: {}",
                arguments.getRiskAssessment(), arguments.getConfidence());

        return ReasoningDecision.builder()
                .message(arguments.getMessage())
                .reasoning(arguments.getThinkingProcess())
                .risk(RiskLevel.fromLabel(arguments.getRiskAssessment()))
                .confidence(arguments.getConfidence() != null ? arguments.getConfidence() : 0.0)
                .decisions(arguments.getDecisions() != null ? arguments.getDecisions() : List.of())
                .nextActions(arguments.getNextActions() != null ? arguments.getNextActions() : List.of())
                .build();
    }

    private ReasoningApiResponse parseFunctionCallResponse(GroqApiResponse groqResponse) {
        GroqApiResponse.ToolCall toolCall = groqResponse.getToolCalls().get(0);
        if (toolCall.getFunction() == null
                || !ReasoningFunctionDefinition.FUNCTION_NAME.equals(toolCall.getFunction().getName())) {
            throw new ExternalCallException("Unexpected function call in Groq response");
        }
        try {
            return objectMapper.readValue(toolCall.getFunction().getArguments(), ReasoningApiResponse.class);
        } catch (JsonProcessingException e) {
            throw new ExternalCallException("Failed to parse stage assessment arguments: " + e.getOriginalMessage(), e);
        }
    }
}
