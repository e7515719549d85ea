package com.waterCompliance.complianceDemo.external.exception;

public class ExternalCallTimeoutException extends ExternalCallException {

    public ExternalCallTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
