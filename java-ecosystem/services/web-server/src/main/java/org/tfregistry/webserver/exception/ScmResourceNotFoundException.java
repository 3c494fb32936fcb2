package org.tfregistry.webserver.exception;

import org.springframework.http.HttpStatus;

public class ScmResourceNotFoundException extends ScmIntegrationException {

    public ScmResourceNotFoundException(String message) {
        super(message, "NOT_FOUND", HttpStatus.NOT_FOUND, null);
    }
}
