package org.rostilos.reviewpilot.pipelineagent.exception;

public class RepositoryNotFoundException extends RuntimeException {

    public RepositoryNotFoundException(Long repositoryId) {
        super("Repository not found: " + repositoryId);
    }
}
