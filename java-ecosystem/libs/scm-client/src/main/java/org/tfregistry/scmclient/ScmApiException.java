package org.tfregistry.scmclient;

/**
 * An SCM provider API answered with a non-success HTTP status.
 */
public class ScmApiException extends ScmClientException {

    private final int statusCode;

    public ScmApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ScmApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }

    public boolean isForbidden() {
        return statusCode == 403;
    }

    /**
     * 401, 403, and 203. Some providers answer 203 Non-Authoritative Information
     * instead of 401 when a token is no longer accepted.
     */
    public boolean isAuthFailure() {
        return isUnauthorized() || isForbidden() || statusCode == 203;
    }

    @Override
    public String getMessage() {
        return "HTTP " + statusCode + ": " + super.getMessage();
    }
}
