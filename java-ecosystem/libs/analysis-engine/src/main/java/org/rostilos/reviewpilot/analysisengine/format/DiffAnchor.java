package org.rostilos.reviewpilot.analysisengine.format;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Builds links into GitLab's diff viewer. GitLab names a diff line anchor
 * {@code <sha1 of file path>_<old line>_<new line>}; the range end stands in for the second part.
 */
public final class DiffAnchor {

    private DiffAnchor() {
    }

    public static String anchor(String filePath, int line, Integer lineEnd) {
        return sha1Hex(filePath) + "_" + line + "_" + (lineEnd != null ? lineEnd : line);
    }

    /**
     * Merge request diff view when the run belongs to a merge request, otherwise the commit view.
     */
    public static String link(String webBaseUrl, String projectPath, long mergeRequestIid, String commitSha,
                              String filePath, int line, Integer lineEnd) {
        String base = webBaseUrl + "/" + projectPath;
        String fragment = "#" + anchor(filePath, line, lineEnd);
        if (mergeRequestIid > 0) {
            return base + "/-/merge_requests/" + mergeRequestIid + "/diffs" + fragment;
        }
        return base + "/-/commit/" + commitSha + fragment;
    }

    static String sha1Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
