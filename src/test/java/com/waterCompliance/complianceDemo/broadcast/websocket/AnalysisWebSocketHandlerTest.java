package com.waterCompliance.complianceDemo.broadcast.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waterCompliance.complianceDemo.broadcast.service.EventSubscriber;
import com.waterCompliance.complianceDemo.broadcast.service.StatusBroadcastHub;
import com.waterCompliance.complianceDemo.orchestrator.model.AnalysisSession;
import com.waterCompliance.complianceDemo.orchestrator.service.SessionService;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnalysisWebSocketHandlerTest {

    private final StatusBroadcastHub hub = mock(StatusBroadcastHub.class);
    private final SessionService sessionService = mock(SessionService.class);
    private final AnalysisWebSocketHandler handler =
            new AnalysisWebSocketHandler(hub, sessionService, new ObjectMapper(), 1000, 65536);

    @Test
    void shouldExtractSessionIdFromQuery() {
        assertThat(AnalysisWebSocketHandler.extractSessionId(URI.create("ws://localhost/ws/analysis?sessionId=abc-1")))
                .isEqualTo("abc-1");
        assertThat(AnalysisWebSocketHandler.extractSessionId(URI.create("ws://localhost/ws/analysis"))).isNull();
        assertThat(AnalysisWebSocketHandler.extractSessionId(null)).isNull();
    }

    @Test
    void shouldSubscribeKnownSession() throws Exception {
        when(sessionService.getSession("abc-1"))
                .thenReturn(Optional.of(new AnalysisSession("abc-1", "q", Instant.EPOCH)));
        WebSocketSession socket = socket("ws://localhost/ws/analysis?sessionId=abc-1");

        handler.afterConnectionEstablished(socket);

        verify(hub).subscribe(eq("abc-1"), argThat((EventSubscriber subscriber) -> "ws-1".equals(subscriber.getSubscriberId())));
        verify(socket, never()).close(any(CloseStatus.class));

        handler.afterConnectionClosed(socket, CloseStatus.NORMAL);
        verify(hub).unsubscribe("abc-1", "ws-1");
    }

    @Test
    void shouldCloseConnectionForUnknownSession() throws Exception {
        when(sessionService.getSession("missing")).thenReturn(Optional.empty());
        WebSocketSession socket = socket("ws://localhost/ws/analysis?sessionId=missing");

        handler.afterConnectionEstablished(socket);

        verify(socket).close(argThat((CloseStatus status) -> status.getCode() == CloseStatus.POLICY_VIOLATION.getCode()));
        verify(hub, never()).subscribe(any(), any());
    }

    private static WebSocketSession socket(String uri) {
        WebSocketSession socket = mock(WebSocketSession.class);
        Map<String, Object> attributes = new HashMap<>();
        when(socket.getUri()).thenReturn(URI.create(uri));
        when(socket.getId()).thenReturn("ws-1");
        when(socket.getAttributes()).thenReturn(attributes);
        return socket;
    }
}
