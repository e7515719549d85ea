package com.waterCompliance.complianceDemo.orchestrator.service;

import com.waterCompliance.complianceDemo.compliance.model.SampleRecord;
import com.waterCompliance.complianceDemo.compliance.model.ValidationFinding;
import com.waterCompliance.complianceDemo.compliance.model.ValidationReport;
import com.waterCompliance.complianceDemo.compliance.service.SampleDataValidator;
import com.waterCompliance.complianceDemo.external.exception.ExternalCallException;
import com.waterCompliance.complianceDemo.external.service.ExternalCallExecutor;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineContext;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineStage;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResult;
import com.waterCompliance.complianceDemo.orchestrator.model.StageStatus;
import com.waterCompliance.complianceDemo.reasoning.model.ReasoningDecision;
import com.waterCompliance.complianceDemo.registry.client.SystemLookupClient;
import com.waterCompliance.complianceDemo.registry.repository.SampleDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Stage 1: validate the sample set and look up the water system.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataValidationService implements StageService {

    private final SampleDataValidator sampleDataValidator;
    private final SampleDataRepository sampleDataRepository;
    private final SystemLookupClient systemLookupClient;
    private final ExternalCallExecutor externalCallExecutor;
    private final StageReasoner stageReasoner;

    @Override
    public PipelineStage stage() {
        return PipelineStage.VALIDATING;
    }

    @Override
    public StageResult execute(PipelineContext context) {
        // Step 1: samples from the request, else the recorded set for the system
        List<SampleRecord> submitted = context.getCommand() != null ? context.getCommand().getSamples() : null;
        List<SampleRecord> samples = submitted != null ? submitted : sampleDataRepository.findByPwsid(context.getPwsid());
        context.setSamples(samples);

        // Step 2: deterministic checks
        ValidationReport report = sampleDataValidator.validate(context.getPwsid(), samples);
        context.setValidationReport(report);
        List<String> findingLines = report.getFindings().stream().map(ValidationFinding::describe).toList();
        log.info("Sample validation finished - sessionId: {}, pwsid: {}, samples: {}, outcome: {}",
                context.getSessionId(), context.getPwsid(), samples.size(), report.getOutcome());

        try {
            // Step 3: registry lookup
            if (context.getPwsid() != null) {
                context.setSystemInfo(externalCallExecutor.execute("system-lookup",
                        () -> systemLookupClient.lookup(context.getPwsid())).orElse(null));
            }

            // Step 4: reasoning
            ReasoningDecision decision = stageReasoner.reason(stage(), context);
            List<String> decisions = new ArrayList<>(findingLines);
            decisions.addAll(decision.getDecisions());

            return StageResult.builder()
                    .stage(stage())
                    .status(StageStatus.COMPLETE)
                    .message("Validation " + report.getOutcome() + " for " + samples.size() + " samples. " + decision.getMessage())
                    .confidence(decision.getConfidence())
                    .risk(decision.getRisk())
                    .reasoningTrace(decision.getReasoning())
                    .decisions(decisions)
                    .nextActions(decision.getNextActions())
                    .outcome(report.getOutcome())
                    .build();
        } catch (ExternalCallException e) {
            log.warn("Data validation degraded - sessionId: {}, error: {}", context.getSessionId(), e.getMessage());
            return StageResult.degraded(stage(), "Data validation degraded: " + e.getMessage()).toBuilder()
                    .decisions(findingLines)
                    .outcome(report.getOutcome())
                    .build();
        }
    }
}
