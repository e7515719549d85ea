package com.waterCompliance.complianceDemo.orchestrator.service;

import com.waterCompliance.complianceDemo.orchestrator.model.PipelineContext;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineStage;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResult;

/**
 * One step of the analysis pipeline.
 *
 * Implementations write their deterministic outputs into the context before making any
 * external call, and report external failures as a degraded result instead of throwing.
 * Rule evaluation errors propagate and end the session.
 */
public interface StageService {

    PipelineStage stage();

    StageResult execute(PipelineContext context);
}
