package org.rostilos.reviewpilot.analysisengine.exception;

/**
 * No usable model configuration could be resolved for a repository.
 */
public class ModelConfigurationException extends RuntimeException {

    public ModelConfigurationException(String message) {
        super(message);
    }
}
