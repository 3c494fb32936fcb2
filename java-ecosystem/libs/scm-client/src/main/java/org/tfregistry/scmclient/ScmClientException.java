package org.tfregistry.scmclient;

/**
 * Exception thrown when an SCM connector cannot be built or an SCM operation fails.
 */
public class ScmClientException extends RuntimeException {

    public ScmClientException(String message) {
        super(message);
    }

    public ScmClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
