package com.waterCompliance.complianceDemo.broadcast.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waterCompliance.complianceDemo.broadcast.service.StatusBroadcastHub;
import com.waterCompliance.complianceDemo.orchestrator.service.SessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Live status endpoint: {@code /ws/analysis?sessionId=...}.
 * Each connection subscribes to exactly one analysis session; inbound text is treated as keep-alive.
 */
@Slf4j
@Component
public class AnalysisWebSocketHandler extends TextWebSocketHandler {

    static final String SESSION_ID_PARAM = "sessionId";
    private static final String SUBSCRIPTION_ATTRIBUTE = "analysisSessionId";

    private final StatusBroadcastHub broadcastHub;
    private final SessionService sessionService;
    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public AnalysisWebSocketHandler(StatusBroadcastHub broadcastHub,
                                    SessionService sessionService,
                                    ObjectMapper objectMapper,
                                    @Value("${broadcast.websocket.send-time-limit-ms:10000}") int sendTimeLimitMs,
                                    @Value("${broadcast.websocket.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.broadcastHub = broadcastHub;
        this.sessionService = sessionService;
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String analysisSessionId = extractSessionId(session.getUri());
        if (analysisSessionId == null || sessionService.getSession(analysisSessionId).isEmpty()) {
            log.info("Rejecting WebSocket connection for unknown session - wsId: {}, sessionId: {}",
                    session.getId(), analysisSessionId);
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Unknown analysis session"));
            return;
        }

        session.getAttributes().put(SUBSCRIPTION_ATTRIBUTE, analysisSessionId);
        WebSocketSession concurrentSession =
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
        broadcastHub.subscribe(analysisSessionId, new WebSocketEventSubscriber(concurrentSession, objectMapper));
        log.info("WebSocket subscribed - wsId: {}, sessionId: {}", session.getId(), analysisSessionId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.trace("Keep-alive received - wsId: {}", session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("WebSocket transport error - wsId: {}, error: {}", session.getId(), exception.getMessage());
        unsubscribe(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("WebSocket closed - wsId: {}, status: {}", session.getId(), status);
        unsubscribe(session);
    }

    private void unsubscribe(WebSocketSession session) {
        Object analysisSessionId = session.getAttributes().get(SUBSCRIPTION_ATTRIBUTE);
        if (analysisSessionId != null) {
            broadcastHub.unsubscribe(analysisSessionId.toString(), session.getId());
        }
    }

    static String extractSessionId(URI uri) {
        if (uri == null) {
            return null;
        }
        String value = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(SESSION_ID_PARAM);
        return value == null || value.isBlank() ? null : value;
    }
}
