package org.rostilos.reviewpilot.analysisengine.llm;

import java.io.IOException;

/**
 * A model call failed. Transient failures (network, HTTP 5xx) may be retried.
 */
public class LlmClientException extends IOException {

    private final boolean transientFailure;

    public LlmClientException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public LlmClientException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
