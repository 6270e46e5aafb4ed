package com.smelldetector.core.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Findings of a whole analysis run, one entry per analysed unit.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * AnalysisReport report = projectAnalyzer.analyze(Paths.get("src"));
 * if (report.hasFindingsAtOrAbove(Severity.HIGH)) {
 *     // fail the build
 * }
 * }</pre>
 *
 * @param results per-unit results, in the order the units were analysed
 */
public record AnalysisReport(List<FileAnalysisResult> results) {

    public AnalysisReport {
        results = results != null ? List.copyOf(results) : List.of();
    }

    public static AnalysisReport empty() {
        return new AnalysisReport(List.of());
    }

    public int filesAnalyzed() {
        return results.size();
    }

    public List<FileAnalysisResult> filesWithFindings() {
        return results.stream().filter(FileAnalysisResult::hasFindings).toList();
    }

    public List<FileAnalysisResult> failedFiles() {
        return results.stream().filter(FileAnalysisResult::isFailed).toList();
    }

    public List<Finding> allFindings() {
        return results.stream().flatMap(result -> result.findings().stream()).toList();
    }

    public int totalFindings() {
        return results.stream().mapToInt(result -> result.findings().size()).sum();
    }

    /**
     * Number of findings per severity; severities without findings map to 0.
     *
     * @return counts keyed by severity, in severity order
     */
    public Map<Severity, Long> countsBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        allFindings().forEach(finding -> counts.merge(finding.severity(), 1L, Long::sum));
        return counts;
    }

    /**
     * Number of findings per smell type.
     *
     * @return counts keyed by smell type, sorted by type
     */
    public Map<String, Long> countsBySmellType() {
        return allFindings().stream()
            .collect(Collectors.groupingBy(Finding::smellType, TreeMap::new, Collectors.counting()));
    }

    /**
     * CI gate check.
     *
     * @param severity minimum severity that should fail a build
     * @return true if any finding is at least that severe
     */
    public boolean hasFindingsAtOrAbove(Severity severity) {
        return allFindings().stream().anyMatch(finding -> finding.severity().isAtLeast(severity));
    }
}
