package com.waterCompliance.complianceDemo.compliance.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ValidationFinding {
    ValidationCheck check;
    ValidationOutcome outcome;
    String detail;

    public String describe() {
        return check + " " + outcome + ": " + detail;
    }
}
