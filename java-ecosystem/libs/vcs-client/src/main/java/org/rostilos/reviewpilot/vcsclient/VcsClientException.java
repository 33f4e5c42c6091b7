package org.rostilos.reviewpilot.vcsclient;

/**
 * A VCS client could not be created for an account (missing account, bad URL, empty token).
 */
public class VcsClientException extends RuntimeException {

    public VcsClientException(String message) {
        super(message);
    }

    public VcsClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
