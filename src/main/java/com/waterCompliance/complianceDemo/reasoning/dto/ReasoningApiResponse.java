package com.waterCompliance.complianceDemo.reasoning.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Arguments of the stage assessment function call returned by the model.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReasoningApiResponse {

    @JsonProperty("message")
    private String message;

    @JsonProperty("thinkingProcess")
    private String thinkingProcess;

    @JsonProperty("riskAssessment")
    private String riskAssessment;

    @JsonProperty("confidence")
    private Double confidence;

    @JsonProperty("decisions")
    private List<String> decisions;

    @JsonProperty("nextActions")
    private List<String> nextActions;
}
