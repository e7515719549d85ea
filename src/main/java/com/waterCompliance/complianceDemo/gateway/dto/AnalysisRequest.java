package com.waterCompliance.complianceDemo.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.waterCompliance.complianceDemo.compliance.model.SampleRecord;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Analysis request. Either a question, a system identifier (optionally with samples), or both.
 * Sample records are not bean-validated here; their completeness is a validation-stage finding.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {

    @Size(max = 2000, message = "Question must not exceed 2000 characters")
    private String question;

    @Size(max = 16, message = "PWSID must not exceed 16 characters")
    private String pwsid;

    @Size(max = 10000, message = "At most 10000 samples per request")
    private List<SampleRecord> samples;

    @DecimalMin(value = "0.0", message = "nonEnglishFraction must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "nonEnglishFraction must be between 0 and 1")
    private Double nonEnglishFraction;

    @JsonIgnore
    @AssertTrue(message = "Either question or pwsid is required")
    public boolean isQuestionOrSystemPresent() {
        return (question != null && !question.isBlank()) || (pwsid != null && !pwsid.isBlank());
    }
}
