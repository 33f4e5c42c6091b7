package org.rostilos.reviewpilot.vcsclient.model;

/**
 * Anchor of a merge request comment on a line of the new file version.
 */
public record DiffPosition(
        DiffRefs diffRefs,
        String oldPath,
        String newPath,
        int newLine
) {
}
