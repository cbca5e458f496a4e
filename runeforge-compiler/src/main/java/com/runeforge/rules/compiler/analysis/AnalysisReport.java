package com.runeforge.rules.compiler.analysis;

import java.util.List;

/**
 * Findings of a {@link RuleElementAnalyzer} run.
 *
 * @param elementCount number of elements inspected
 * @param findings     problems found, in source order
 */
public record AnalysisReport(int elementCount, List<Finding> findings) {

    public AnalysisReport {
        findings = List.copyOf(findings);
    }

    public boolean hasErrors() {
        return findings.stream().anyMatch(f -> f.severity() == Severity.ERROR);
    }

    public List<Finding> errors() {
        return findings.stream().filter(f -> f.severity() == Severity.ERROR).toList();
    }

    public List<Finding> warnings() {
        return findings.stream().filter(f -> f.severity() == Severity.WARNING).toList();
    }

    public enum Severity {
        /** The element will be processed, possibly differently from what the author meant. */
        WARNING,
        /** The element will contribute nothing. */
        ERROR
    }

    /**
     * @param source display name of the source carrying the element
     * @param index  position of the element within its source
     * @param key    wire key of the element
     */
    public record Finding(String source, int index, String key, Severity severity, String message) {

        @Override
        public String toString() {
            return String.format("%s %s[%d] %s: %s", severity, source, index, key, message);
        }
    }
}
