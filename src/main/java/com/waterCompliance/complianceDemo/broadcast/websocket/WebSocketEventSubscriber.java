package com.waterCompliance.complianceDemo.broadcast.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waterCompliance.complianceDemo.broadcast.model.AnalysisEvent;
import com.waterCompliance.complianceDemo.broadcast.service.EventSubscriber;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Delivers events to one WebSocket connection as JSON text frames.
 */
public class WebSocketEventSubscriber implements EventSubscriber {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketEventSubscriber(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getSubscriberId() {
        return session.getId();
    }

    @Override
    public void deliver(AnalysisEvent event) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
    }
}
