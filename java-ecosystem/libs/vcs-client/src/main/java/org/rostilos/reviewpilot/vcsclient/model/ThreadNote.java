package org.rostilos.reviewpilot.vcsclient.model;

/**
 * Ids of a merge request discussion and the note that carries its body.
 */
public record ThreadNote(
        String discussionId,
        Long noteId
) {
}
