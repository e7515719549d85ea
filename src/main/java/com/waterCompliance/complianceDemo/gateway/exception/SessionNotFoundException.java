package com.waterCompliance.complianceDemo.gateway.exception;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Analysis session not found or expired: " + sessionId);
    }
}
