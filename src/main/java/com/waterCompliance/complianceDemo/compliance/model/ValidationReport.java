package com.waterCompliance.complianceDemo.compliance.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ValidationReport {
    String pwsid;
    ValidationOutcome outcome;
    int sampleCount;
    List<ValidationFinding> findings;

    public boolean isBlocking() {
        return outcome == ValidationOutcome.FAIL;
    }
}
