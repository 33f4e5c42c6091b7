package org.rostilos.reviewpilot.vcsclient.model;

/**
 * A commit comment. GitLab does not return an id for every commit comment,
 * so {@code noteId} may be null.
 */
public record CommitNote(
        Long noteId,
        String note
) {
}
