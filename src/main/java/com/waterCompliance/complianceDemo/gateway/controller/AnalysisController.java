package com.waterCompliance.complianceDemo.gateway.controller;

import com.waterCompliance.complianceDemo.gateway.dto.AnalysisRequest;
import com.waterCompliance.complianceDemo.gateway.dto.AnalysisStartResponse;
import com.waterCompliance.complianceDemo.gateway.dto.SessionSnapshotResponse;
import com.waterCompliance.complianceDemo.gateway.service.GatewayService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Analysis REST controller - thin HTTP layer.
 *
 * POST starts a session and returns immediately; progress arrives over the WebSocket
 * stream or by polling GET.
 */
@RestController
@RequestMapping("/api/v1/analysis")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class AnalysisController {

    private static final String CLIENT_ID_HEADER = "X-Client-ID";
    private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private final GatewayService gatewayService;

    @PostMapping
    public ResponseEntity<AnalysisStartResponse> startAnalysis(
            @Valid @RequestBody AnalysisRequest request,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientIdHeader,
            @RequestHeader(value = CORRELATION_ID_HEADER, required = false) String correlationIdHeader,
            HttpServletRequest httpRequest) {

        String clientKey = clientIdHeader != null && !clientIdHeader.isBlank()
                ? clientIdHeader : httpRequest.getRemoteAddr();
        AnalysisStartResponse response = gatewayService.startAnalysis(request, clientKey, correlationIdHeader);
        return ResponseEntity.accepted().body(response);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionSnapshotResponse> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(gatewayService.getSessionSnapshot(sessionId));
    }
}
