package com.waterCompliance.complianceDemo.gateway.service;

import com.waterCompliance.complianceDemo.gateway.dto.AnalysisRequest;
import com.waterCompliance.complianceDemo.gateway.dto.AnalysisStartResponse;
import com.waterCompliance.complianceDemo.gateway.dto.SessionSnapshotResponse;
import com.waterCompliance.complianceDemo.gateway.exception.InvalidAnalysisRequestException;
import com.waterCompliance.complianceDemo.gateway.exception.RateLimitExceededException;
import com.waterCompliance.complianceDemo.gateway.exception.SessionNotFoundException;
import com.waterCompliance.complianceDemo.orchestrator.model.AnalysisCommand;
import com.waterCompliance.complianceDemo.orchestrator.model.AnalysisSession;
import com.waterCompliance.complianceDemo.orchestrator.service.OrchestratorService;
import com.waterCompliance.complianceDemo.orchestrator.service.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Gateway service - request admission and hand-off to the orchestrator.
 *
 * Responsibilities:
 * - Rate limit per client
 * - Assign correlation IDs
 * - Turn the HTTP request into an AnalysisCommand
 * - Serve session snapshots for polling clients
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    static final String STREAM_PATH = "/ws/analysis?sessionId=";

    private final CorrelationIdService correlationIdService;
    private final RateLimiter rateLimiter;
    private final OrchestratorService orchestratorService;
    private final SessionService sessionService;

    public AnalysisStartResponse startAnalysis(AnalysisRequest request, String clientKey, String incomingCorrelationId) {
        String correlationId = correlationIdService.resolveCorrelationId(incomingCorrelationId);
        log.info("Received analysis request - correlationId: {}, client: {}, pwsid: {}, samples: {}",
                correlationId, clientKey, request.getPwsid(), request.getSamples() != null ? request.getSamples().size() : 0);

        if (!rateLimiter.isAllowed(clientKey)) {
            throw new RateLimitExceededException("Rate limit exceeded. Please try again later.");
        }
        if (!request.isQuestionOrSystemPresent()) {
            throw new InvalidAnalysisRequestException("Either question or pwsid is required");
        }

        AnalysisCommand command = AnalysisCommand.builder()
                .correlationId(correlationId)
                .question(request.getQuestion() != null ? request.getQuestion().trim() : null)
                .pwsid(request.getPwsid() != null && !request.getPwsid().isBlank()
                        ? request.getPwsid().trim().toUpperCase(Locale.ROOT) : null)
                .samples(request.getSamples())
                .nonEnglishFraction(request.getNonEnglishFraction())
                .build();

        String sessionId = orchestratorService.startSession(command);
        return AnalysisStartResponse.builder()
                .sessionId(sessionId)
                .correlationId(correlationId)
                .status("accepted")
                .streamPath(STREAM_PATH + sessionId)
                .build();
    }

    public SessionSnapshotResponse getSessionSnapshot(String sessionId) {
        AnalysisSession session = sessionService.getSession(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return SessionSnapshotResponse.builder()
                .sessionId(session.getSessionId())
                .query(session.getQuery())
                .stage(session.getStage())
                .terminal(session.isTerminal())
                .createdAt(session.getCreatedAt())
                .completedAt(session.getCompletedAt())
                .stageResults(session.getStageResults())
                .liveStages(session.getLiveStages())
                .report(session.getReport())
                .naturalResponse(session.getNaturalResponse())
                .errorMessage(session.getErrorMessage())
                .build();
    }
}
