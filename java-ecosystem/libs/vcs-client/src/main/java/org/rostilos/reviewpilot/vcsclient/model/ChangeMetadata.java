package org.rostilos.reviewpilot.vcsclient.model;

public record ChangeMetadata(
        Long id,
        long iid,
        String title,
        String description,
        String sourceBranch,
        String targetBranch,
        String authorName,
        String authorUsername,
        String webUrl,
        DiffRefs diffRefs
) {
    public String headSha() {
        return diffRefs != null ? diffRefs.headSha() : null;
    }
}
