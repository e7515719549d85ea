package com.waterCompliance.complianceDemo.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisStartResponse {
    private String sessionId;
    private String correlationId;
    private String status;
    /** Relative path of the live status stream for this session. */
    private String streamPath;
}
