package com.waterCompliance.complianceDemo.compliance.exception;

/**
 * Thrown when deterministic compliance rules cannot be evaluated against the input
 * (unknown parameter, incompatible unit, arithmetic on an empty sample set).
 * Terminates the analysis session.
 */
public class RuleEvaluationException extends RuntimeException {

    public RuleEvaluationException(String message) {
        super(message);
    }

    public RuleEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
