package com.smelldetector.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of analysing one source unit.
 *
 * <p>A unit that could not be read or parsed has no findings and carries an error message;
 * it never aborts the analysis of other units.
 *
 * @param source file path or origin label of the unit
 * @param findings findings in (definition, detector) order
 * @param error failure description, {@code null} on success
 */
public record FileAnalysisResult(
    String source,
    List<Finding> findings,
    String error
) {
    public FileAnalysisResult {
        Objects.requireNonNull(source, "source must not be null");
        findings = findings != null ? List.copyOf(findings) : List.of();
    }

    public static FileAnalysisResult success(String source, List<Finding> findings) {
        return new FileAnalysisResult(source, findings, null);
    }

    public static FileAnalysisResult failed(String source, String error) {
        return new FileAnalysisResult(source, List.of(), Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
