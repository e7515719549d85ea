package com.waterCompliance.complianceDemo.compliance.model;

import com.waterCompliance.complianceDemo.registry.model.RecordedViolation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SystemSummary {
    String pwsid;
    String name;
    String location;
    Long populationServed;
    String dataSource;
    List<RecordedViolation> recordedViolations;
}
