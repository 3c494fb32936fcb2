package org.tfregistry.webserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Base exception for SCM integration failures. Carries the error code and HTTP status it is rendered with.
 */
public class ScmIntegrationException extends RuntimeException {

    private final String errorCode;
    private final HttpStatus status;

    public ScmIntegrationException(String message) {
        this(message, "INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR, null);
    }

    public ScmIntegrationException(String message, Throwable cause) {
        this(message, "INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }

    protected ScmIntegrationException(String message, String errorCode, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
