package org.rostilos.reviewpilot.analysisengine.parser;

public record SeverityCounts(int critical, int normal, int suggestion) {

    public static final SeverityCounts ZERO = new SeverityCounts(0, 0, 0);

    public SeverityCounts plus(SeverityCounts other) {
        return new SeverityCounts(
                critical + other.critical,
                normal + other.normal,
                suggestion + other.suggestion);
    }

    public int total() {
        return critical + normal + suggestion;
    }

    public boolean isZero() {
        return total() == 0;
    }
}
