package org.tfregistry.webserver.exception;

import org.springframework.http.HttpStatus;

public class ScmUpstreamException extends ScmIntegrationException {

    public ScmUpstreamException(String message, Throwable cause) {
        super(message, "UPSTREAM_ERROR", HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }
}
