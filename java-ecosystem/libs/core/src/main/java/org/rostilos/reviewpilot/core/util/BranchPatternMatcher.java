package org.rostilos.reviewpilot.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches branch names against a repository's watch-branch setting.
 * The setting is a comma-separated list of globs where "*" matches any sequence of
 * characters, "/" included. Each glob must match the whole branch name.
 *
 * Examples:
 * - "" or "*" matches every branch
 * - "main,develop" matches exactly "main" or "develop"
 * - "release/*" matches "release/1.0" and "release/1.0/hotfix"
 */
public final class BranchPatternMatcher {

    private static final Logger log = LoggerFactory.getLogger(BranchPatternMatcher.class);

    private BranchPatternMatcher() {
    }

    /**
     * Check if a branch name matches a watch-branch setting.
     *
     * @param branchName the branch name to check
     * @param pattern comma-separated globs; null, blank or separators only matches everything
     * @return true if at least one glob matches the whole branch name
     */
    public static boolean matches(String branchName, String pattern) {
        List<String> globs = split(pattern);
        if (globs.isEmpty()) {
            return true;
        }
        if (branchName == null) {
            return false;
        }
        for (String glob : globs) {
            if (matchesGlob(branchName, glob)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Split a watch-branch setting into its trimmed, non-empty globs.
     */
    public static List<String> split(String pattern) {
        if (pattern == null) {
            return List.of();
        }
        return Arrays.stream(pattern.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    static boolean matchesGlob(String branchName, String glob) {
        if (!glob.contains("*")) {
            return branchName.equals(glob);
        }
        try {
            return Pattern.compile(globToRegex(glob)).matcher(branchName).matches();
        } catch (PatternSyntaxException e) {
            log.warn("Invalid branch pattern '{}', comparing literally: {}", glob, e.getMessage());
            return branchName.equals(glob);
        }
    }

    /**
     * "*" becomes ".*"; every other run of characters is quoted.
     */
    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (!literal.isEmpty()) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(".*");
            } else {
                literal.append(c);
            }
        }
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.toString();
    }
}
