package com.waterCompliance.complianceDemo.orchestrator.service;

import com.waterCompliance.complianceDemo.broadcast.model.AnalysisEvent;
import com.waterCompliance.complianceDemo.broadcast.service.StatusBroadcastHub;
import com.waterCompliance.complianceDemo.compliance.exception.RuleEvaluationException;
import com.waterCompliance.complianceDemo.external.exception.ExternalCallException;
import com.waterCompliance.complianceDemo.orchestrator.model.AnalysisCommand;
import com.waterCompliance.complianceDemo.orchestrator.model.AnalysisSession;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineContext;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineStage;
import com.waterCompliance.complianceDemo.orchestrator.model.QueryIntent;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResult;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResultPatch;
import com.waterCompliance.complianceDemo.orchestrator.model.StageStatus;
import com.waterCompliance.complianceDemo.orchestrator.util.QueryIntentResolver;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Orchestrator service - owns the analysis state machine.
 *
 * Workflow per session:
 * IDLE -> VALIDATING -> DETECTING_VIOLATIONS -> GENERATING_NOTIFICATIONS -> SYNTHESIZING -> COMPLETE
 * with ERROR reachable from any non-terminal stage.
 *
 * Each session runs on the analysis executor; sessions share nothing but the read-only
 * rule tables. External failures degrade a stage, rule failures end the session.
 */
@Slf4j
@Service
public class OrchestratorService {

    static final String MDC_SESSION_ID = "sessionId";
    static final String MDC_CORRELATION_ID = "correlationId";

    private final SessionService sessionService;
    private final StatusBroadcastHub broadcastHub;
    private final QueryIntentResolver queryIntentResolver;
    private final Executor analysisExecutor;
    private final Clock clock;
    private final List<StageService> pipeline;

    public OrchestratorService(SessionService sessionService,
                               StatusBroadcastHub broadcastHub,
                               QueryIntentResolver queryIntentResolver,
                               DataValidationService dataValidationService,
                               ViolationDetectionService violationDetectionService,
                               NotificationService notificationService,
                               SynthesisService synthesisService,
                               @Qualifier("analysisExecutor") Executor analysisExecutor,
                               Clock clock) {
        this.sessionService = sessionService;
        this.broadcastHub = broadcastHub;
        this.queryIntentResolver = queryIntentResolver;
        this.analysisExecutor = analysisExecutor;
        this.clock = clock;
        this.pipeline = List.of(dataValidationService, violationDetectionService, notificationService, synthesisService);
    }

    /**
     * Creates a session, moves it to VALIDATING and schedules its pipeline.
     * Returns without waiting for any stage.
     *
     * @return the new session id
     */
    public String startSession(AnalysisCommand command) {
        AnalysisSession session = sessionService.createSession(command.describe());
        String sessionId = session.getSessionId();
        broadcastHub.open(sessionId);
        session.advanceTo(PipelineStage.VALIDATING);
        log.info("Starting analysis - correlationId: {}, sessionId: {}", command.getCorrelationId(), sessionId);

        try {
            analysisExecutor.execute(() -> runPipeline(session, command));
        } catch (RejectedExecutionException e) {
            log.error("Analysis executor rejected session - sessionId: {}", sessionId, e);
            failSession(session, "Analysis capacity exhausted, please retry");
            throw e;
        }
        return sessionId;
    }

    void runPipeline(AnalysisSession session, AnalysisCommand command) {
        String sessionId = session.getSessionId();
        MDC.put(MDC_SESSION_ID, sessionId);
        if (command.getCorrelationId() != null) {
            MDC.put(MDC_CORRELATION_ID, command.getCorrelationId());
        }
        try {
            broadcastHub.publish(sessionId, AnalysisEvent.analysisStart(sessionId, session.getQuery(), clock.instant()));

            // Step 0: resolve what the question is about
            QueryIntent intent = queryIntentResolver.resolve(command);
            PipelineContext context = PipelineContext.builder()
                    .sessionId(sessionId)
                    .command(command)
                    .intent(intent)
                    .pwsid(intent.getPwsid())
                    .build();

            // Steps 1-4: stages in order
            for (StageService stageService : pipeline) {
                runStage(session, context, stageService);
            }

            session.complete(context.getReport(), context.getNaturalResponse(), clock.instant());
            broadcastHub.publish(sessionId, AnalysisEvent.analysisComplete(
                    sessionId, context.getReport(), context.getNaturalResponse(), clock.instant()));
            log.info("Analysis complete - sessionId: {}, overallRisk: {}",
                    sessionId, context.getReport().getOverallRisk());

        } catch (RuleEvaluationException e) {
            log.error("Rule evaluation failed - sessionId: {}, stage: {}, error: {}",
                    sessionId, session.getStage(), e.getMessage());
            failSession(session, "Rule evaluation failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in analysis - sessionId: {}, stage: {}", sessionId, session.getStage(), e);
            failSession(session, "Analysis failed: " + e.getMessage());
        } finally {
            MDC.remove(MDC_SESSION_ID);
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    private void runStage(AnalysisSession session, PipelineContext context, StageService stageService) {
        PipelineStage stage = stageService.stage();
        String sessionId = session.getSessionId();
        if (session.getStage() != stage) {
            session.advanceTo(stage);
        }

        StageResultPatch running = StageResultPatch.running(stage);
        session.applyPatch(running);
        broadcastHub.publish(sessionId, AnalysisEvent.agentUpdate(sessionId, running, clock.instant()));
        log.debug("Stage started - sessionId: {}, stage: {}", sessionId, stage);

        StageResult result;
        try {
            result = stageService.execute(context);
        } catch (ExternalCallException e) {
            log.warn("Stage degraded by unhandled external failure - sessionId: {}, stage: {}", sessionId, stage);
            result = StageResult.degraded(stage, stage.getDisplayName() + " degraded: " + e.getMessage());
        }

        session.recordStageResult(result);
        context.getStageResults().add(result);
        broadcastHub.publish(sessionId, AnalysisEvent.agentUpdate(sessionId, StageResultPatch.from(result), clock.instant()));
        if (result.getStatus() == StageStatus.ERROR) {
            broadcastHub.publish(sessionId, AnalysisEvent.status(sessionId, result.getMessage(), clock.instant()));
        }
        log.info("Stage finished - sessionId: {}, stage: {}, status: {}, confidence: {}, risk: {}",
                sessionId, stage, result.getStatus(), result.getConfidence(), result.getRisk());
    }

    private void failSession(AnalysisSession session, String message) {
        if (session.fail(message, clock.instant())) {
            broadcastHub.publish(session.getSessionId(),
                    AnalysisEvent.error(session.getSessionId(), message, clock.instant()));
        }
    }
}
