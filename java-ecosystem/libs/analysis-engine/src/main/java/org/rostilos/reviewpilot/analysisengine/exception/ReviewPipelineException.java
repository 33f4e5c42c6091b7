package org.rostilos.reviewpilot.analysisengine.exception;

/**
 * Unrecoverable review error; the run is marked failed with this message.
 */
public class ReviewPipelineException extends RuntimeException {

    public ReviewPipelineException(String message) {
        super(message);
    }

    public ReviewPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
