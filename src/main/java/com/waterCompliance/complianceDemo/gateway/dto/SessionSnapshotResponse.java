package com.waterCompliance.complianceDemo.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.waterCompliance.complianceDemo.compliance.model.ComplianceReport;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineStage;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a session for polling clients.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionSnapshotResponse {
    String sessionId;
    String query;
    PipelineStage stage;
    boolean terminal;
    Instant createdAt;
    Instant completedAt;
    List<StageResult> stageResults;
    List<StageResult> liveStages;
    ComplianceReport report;
    String naturalResponse;
    String errorMessage;
}
