package org.tfregistry.webserver.exception;

import org.springframework.http.HttpStatus;

/**
 * The provider keeps rejecting the stored credential and it could not be renewed.
 * The upstream detail stays in the cause and is not shown to the user.
 */
public class ScmReconnectRequiredException extends ScmIntegrationException {

    public static final String MESSAGE =
            "OAuth token is invalid or has been revoked; please reconnect to this SCM provider";

    public ScmReconnectRequiredException(Throwable cause) {
        super(MESSAGE, "RECONNECT_REQUIRED", HttpStatus.UNAUTHORIZED, cause);
    }
}
