package org.rostilos.reviewpilot.vcsclient.model;

/**
 * The base/head/start commit triple GitLab needs to anchor a positioned comment.
 */
public record DiffRefs(
        String baseSha,
        String headSha,
        String startSha
) {
}
