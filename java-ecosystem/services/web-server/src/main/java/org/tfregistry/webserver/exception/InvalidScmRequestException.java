package org.tfregistry.webserver.exception;

import org.springframework.http.HttpStatus;

public class InvalidScmRequestException extends ScmIntegrationException {

    public InvalidScmRequestException(String message) {
        super(message, "INVALID_REQUEST", HttpStatus.BAD_REQUEST, null);
    }
}
