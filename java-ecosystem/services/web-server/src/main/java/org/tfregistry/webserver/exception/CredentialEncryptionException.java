package org.tfregistry.webserver.exception;

import org.springframework.http.HttpStatus;

/**
 * Sealing or opening a secret failed. The message names the secret's role, never its value.
 */
public class CredentialEncryptionException extends ScmIntegrationException {

    public CredentialEncryptionException(String message, Throwable cause) {
        super(message, "ENCRYPTION_FAILURE", HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }
}
