package com.waterCompliance.complianceDemo.config;

import com.waterCompliance.complianceDemo.broadcast.websocket.AnalysisWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ANALYSIS_STREAM_PATH = "/ws/analysis";

    private final AnalysisWebSocketHandler analysisWebSocketHandler;

    @Value("${broadcast.websocket.allowed-origins:http://localhost:5173,http://localhost:3000}")
    private String[] allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(analysisWebSocketHandler, ANALYSIS_STREAM_PATH)
                .setAllowedOrigins(allowedOrigins);
    }
}
