package org.tfregistry.webserver.exception;

import org.springframework.http.HttpStatus;

public class UnauthenticatedException extends ScmIntegrationException {

    public UnauthenticatedException(String message) {
        super(message, "UNAUTHENTICATED", HttpStatus.UNAUTHORIZED, null);
    }
}
