package com.waterCompliance.complianceDemo.external.exception;

/**
 * A call to an outside service (reasoning provider, system registry, guidance search) failed.
 * Degrades the current stage; never ends the session on its own.
 */
public class ExternalCallException extends RuntimeException {

    public ExternalCallException(String message) {
        super(message);
    }

    public ExternalCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
