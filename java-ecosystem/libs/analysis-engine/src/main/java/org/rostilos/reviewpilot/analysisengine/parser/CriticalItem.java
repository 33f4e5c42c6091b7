package org.rostilos.reviewpilot.analysisengine.parser;

/**
 * A critical finding extracted from model output.
 *
 * @param filePath null when the response did not name a file and no default was given
 * @param lineRangeEnd null for single-line findings
 */
public record CriticalItem(String filePath, int lineNumber, Integer lineRangeEnd, String content) {

    public CriticalItem withDefaultPath(String defaultPath) {
        return filePath != null ? this : new CriticalItem(defaultPath, lineNumber, lineRangeEnd, content);
    }

    public String location() {
        String base = (filePath != null ? filePath : "?") + ":" + lineNumber;
        return lineRangeEnd != null ? base + "-" + lineRangeEnd : base;
    }
}
