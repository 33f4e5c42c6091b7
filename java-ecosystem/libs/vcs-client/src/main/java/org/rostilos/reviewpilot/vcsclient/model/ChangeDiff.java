package org.rostilos.reviewpilot.vcsclient.model;

/**
 * One changed file of a merge request or commit.
 *
 * @param diff unified diff hunks without the file header lines
 */
public record ChangeDiff(
        String oldPath,
        String newPath,
        String diff,
        boolean newFile,
        boolean renamedFile,
        boolean deletedFile
) {
    /**
     * Path used to address the file in reviews: the new path, or the old one for deletions.
     */
    public String path() {
        if (newPath != null && !newPath.isBlank()) {
            return newPath;
        }
        return oldPath;
    }
}
