package com.waterCompliance.complianceDemo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

/**
 * What a free-text question asks for: which system, optionally which contaminant.
 */
@Value
@Builder
public class QueryIntent {
    AnalysisIntent intent;
    String pwsid;
    String contaminant;
    /** True when no system could be matched and the default demo system was used. */
    boolean defaultedSystem;
}
