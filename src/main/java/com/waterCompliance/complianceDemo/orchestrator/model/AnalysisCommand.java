package com.waterCompliance.complianceDemo.orchestrator.model;

import com.waterCompliance.complianceDemo.compliance.model.SampleRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Validated analysis request handed from the gateway to the orchestrator.
 * Either a free-text question, a structured pwsid + samples submission, or both.
 */
@Value
@Builder
public class AnalysisCommand {
    String correlationId;
    String question;
    String pwsid;
    List<SampleRecord> samples;
    Double nonEnglishFraction;

    public String describe() {
        if (question != null && !question.isBlank()) {
            return question;
        }
        return "Compliance analysis for " + pwsid;
    }
}
