package org.rostilos.reviewpilot.analysisengine.parser;

import org.rostilos.reviewpilot.core.model.review.FindingSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form model output into severity counts and a bounded list of critical items.
 * <p>
 * Two output dialects are understood:
 * <ul>
 *   <li>a statistics line ({@code statistics: critical=1 normal=2 suggestion=0}) plus
 *       {@code path:line[-end] description} entries for critical problems;</li>
 *   <li>per-line entries ({@code 12: [critical] description}) optionally grouped under file headings,
 *       used when no statistics line is present or it reports nothing.</li>
 * </ul>
 * Unrecognizable input yields zero counts, never an exception.
 */
public final class FindingParser {
    private static final Logger log = LoggerFactory.getLogger(FindingParser.class);

    private static final Pattern STATISTICS_LINE = Pattern.compile(
            "^[\\s>*_#`-]*(?:statistics|stats|统计)[*_`]*\\s*[:：]\\s*(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern CRITICAL_COUNT = countPattern("critical|严重");
    private static final Pattern NORMAL_COUNT = countPattern("normal|一般");
    private static final Pattern SUGGESTION_COUNT = countPattern("suggestions?|建议");

    private static final Pattern CRITICAL_ITEM = Pattern.compile(
            "^\\s*(?:[-*]|\\d+[.)])?\\s*`?([^\\s`:：]+):(\\d+)(?:-(\\d+))?`?\\s*[:：-]?\\s+(\\S.*)$");

    private static final Pattern LINE_ENTRY = Pattern.compile("^\\s*(\\d+)(?:-(\\d+))?:\\s*(.*)$");
    private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#{2,3}\\s+`?([^\\s`]*[./][^\\s`]*)`?\\s*$");
    private static final Pattern FILE_LABEL = Pattern.compile(
            "^\\s*(?:file|文件)\\s*[:：]\\s*`?([^\\s`]+)`?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEVERITY_TAG = Pattern.compile(
            "^\\[(严重|一般|建议|critical|normal|suggestion)]\\s*", Pattern.CASE_INSENSITIVE);

    private static final List<String> CRITICAL_KEYWORDS = List.of(
            "严重", "critical", "security", "vulnerability", "bug", "error", "breaking", "crash", "injection");
    private static final List<String> SUGGESTION_KEYWORDS = List.of(
            "建议", "suggest", "consider", "could", "might");

    private FindingParser() {
    }

    /**
     * @param response         raw model text, may be null
     * @param defaultFilePath  file assumed for entries that name none; may be null
     * @param maxCriticalItems upper bound on returned critical items
     */
    public static ParsedReview parse(String response, String defaultFilePath, int maxCriticalItems) {
        if (response == null || response.isBlank()) {
            return ParsedReview.empty();
        }
        int cap = Math.max(0, maxCriticalItems);
        String[] lines = response.split("\\R");

        SeverityCounts statistics = null;
        List<CriticalItem> items = new ArrayList<>();
        for (String line : lines) {
            if (statistics == null) {
                SeverityCounts parsed = parseStatisticsLine(line);
                if (parsed != null) {
                    statistics = parsed;
                    continue;
                }
            }
            if (STATISTICS_LINE.matcher(line).matches()) {
                continue;
            }
            Matcher item = CRITICAL_ITEM.matcher(line);
            if (item.matches() && items.size() < cap) {
                Integer lineNumber = toInt(item.group(2));
                if (lineNumber != null) {
                    items.add(new CriticalItem(item.group(1), lineNumber, toInt(item.group(3)), item.group(4).trim()));
                }
            }
        }

        if (statistics != null && !statistics.isZero()) {
            return new ParsedReview(statistics, List.copyOf(items), true);
        }

        LegacyScan legacy = scanLegacyEntries(lines, defaultFilePath);
        for (CriticalItem critical : legacy.criticalItems) {
            if (items.size() >= cap) {
                break;
            }
            items.add(critical);
        }

        if (legacy.counts.isZero() && statistics == null && !looksClean(response)) {
            log.warn("Model response matched no known review format ({} chars); counting it as zero findings",
                    response.length());
        }
        return new ParsedReview(legacy.counts, List.copyOf(items), statistics != null);
    }

    /**
     * @return counts from a statistics line, or null if the line is not one
     */
    static SeverityCounts parseStatisticsLine(String line) {
        Matcher label = STATISTICS_LINE.matcher(line);
        if (!label.matches()) {
            return null;
        }
        String rest = label.group(1);
        Integer critical = firstNumber(CRITICAL_COUNT, rest);
        Integer normal = firstNumber(NORMAL_COUNT, rest);
        Integer suggestion = firstNumber(SUGGESTION_COUNT, rest);
        if (critical == null || normal == null || suggestion == null) {
            return null;
        }
        return new SeverityCounts(critical, normal, suggestion);
    }

    static FindingSeverity inferSeverity(String text) {
        Matcher tag = SEVERITY_TAG.matcher(text.trim());
        if (tag.find()) {
            return severityOfTag(tag.group(1));
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (CRITICAL_KEYWORDS.stream().anyMatch(lower::contains)) {
            return FindingSeverity.CRITICAL;
        }
        if (SUGGESTION_KEYWORDS.stream().anyMatch(lower::contains)) {
            return FindingSeverity.SUGGESTION;
        }
        return FindingSeverity.NORMAL;
    }

    static String stripSeverityTag(String content) {
        return SEVERITY_TAG.matcher(content.trim()).replaceFirst("").trim();
    }

    private static LegacyScan scanLegacyEntries(String[] lines, String defaultFilePath) {
        LegacyScan scan = new LegacyScan();
        String currentFile = defaultFilePath;
        PendingEntry pending = null;

        for (String line : lines) {
            String heading = headingPath(line);
            if (heading != null) {
                scan.accept(pending);
                pending = null;
                currentFile = heading;
                continue;
            }
            Matcher entry = LINE_ENTRY.matcher(line);
            Integer lineNumber = entry.matches() ? toInt(entry.group(1)) : null;
            if (lineNumber != null) {
                scan.accept(pending);
                pending = new PendingEntry(currentFile, lineNumber, toInt(entry.group(2)), entry.group(3));
            } else if (pending != null) {
                pending.append(line);
            }
        }
        scan.accept(pending);
        return scan;
    }

    private static String headingPath(String line) {
        Matcher heading = MARKDOWN_HEADING.matcher(line);
        if (heading.matches()) {
            return heading.group(1);
        }
        Matcher label = FILE_LABEL.matcher(line);
        return label.matches() ? label.group(1) : null;
    }

    private static FindingSeverity severityOfTag(String tag) {
        return switch (tag.toLowerCase(Locale.ROOT)) {
            case "严重", "critical" -> FindingSeverity.CRITICAL;
            case "建议", "suggestion" -> FindingSeverity.SUGGESTION;
            default -> FindingSeverity.NORMAL;
        };
    }

    private static boolean looksClean(String response) {
        return response.toUpperCase(Locale.ROOT).contains("LGTM");
    }

    private static boolean isLgtm(String content) {
        return content.replaceAll("[!.。！\\s]", "").equalsIgnoreCase("LGTM");
    }

    private static Pattern countPattern(String keys) {
        return Pattern.compile("(?:" + keys + ")[*_`]*\\s*[=:：]\\s*(\\d+)",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static Integer firstNumber(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? toInt(matcher.group(1)) : null;
    }

    /**
     * @return the value of a captured digit group, or null if it is absent or does not fit an int
     */
    private static Integer toInt(String digits) {
        if (digits == null) {
            return null;
        }
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            log.debug("Ignoring out of range number {} in model response", digits);
            return null;
        }
    }

    private static final class PendingEntry {
        private final String filePath;
        private final int line;
        private final Integer lineEnd;
        private final String firstLine;
        private final StringBuilder content = new StringBuilder();

        PendingEntry(String filePath, int line, Integer lineEnd, String firstLine) {
            this.filePath = filePath;
            this.line = line;
            this.lineEnd = lineEnd;
            this.firstLine = firstLine;
            this.content.append(firstLine);
        }

        void append(String text) {
            content.append('\n').append(text);
        }
    }

    private static final class LegacyScan {
        private SeverityCounts counts = SeverityCounts.ZERO;
        private final List<CriticalItem> criticalItems = new ArrayList<>();

        void accept(PendingEntry entry) {
            if (entry == null) {
                return;
            }
            String text = entry.content.toString().trim();
            if (text.isEmpty() || isLgtm(text)) {
                return;
            }
            FindingSeverity severity = inferSeverity(entry.firstLine.isBlank() ? text : entry.firstLine);
            String content = stripSeverityTag(text);
            switch (severity) {
                case CRITICAL -> {
                    counts = counts.plus(new SeverityCounts(1, 0, 0));
                    criticalItems.add(new CriticalItem(entry.filePath, entry.line, entry.lineEnd, content));
                }
                case SUGGESTION -> counts = counts.plus(new SeverityCounts(0, 0, 1));
                default -> counts = counts.plus(new SeverityCounts(0, 1, 0));
            }
        }
    }
}
