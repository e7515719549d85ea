package com.waterCompliance.complianceDemo.gateway.exception;

/**
 * Request can't start an analysis (nothing to analyze, malformed identifiers).
 */
public class InvalidAnalysisRequestException extends RuntimeException {

    public InvalidAnalysisRequestException(String message) {
        super(message);
    }
}
