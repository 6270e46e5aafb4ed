package com.smelldetector.core.report.impl;

import com.smelldetector.core.model.AnalysisReport;
import com.smelldetector.core.model.FileAnalysisResult;
import com.smelldetector.core.model.Finding;
import com.smelldetector.core.model.Severity;
import com.smelldetector.core.report.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;

/**
 * Human-readable report with optional ANSI color formatting.
 *
 * <p>Only files with findings or failures are listed. Colors can be disabled for CI/CD
 * environments or when redirecting output.
 *
 * <p><b>Example Output:</b>
 * <pre>
 * ================================================================================
 * CODE SMELL DETECTION REPORT
 * ================================================================================
 * Total files analyzed: 3
 * Total code smells found: 1
 * ================================================================================
 *
 * File: app/orders.py
 *    Found 1 smell(s)
 *
 *    [!] LONG-METHOD [high]
 *       Function: process_order
 *       Location: Line 12, Column 0
 *       Message: Function is 140 lines long (threshold: 50)
 * </pre>
 */
public class ConsoleReportRenderer implements ReportRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleReportRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private static final String RULE = "=".repeat(80);
    private static final String NO_SMELLS = "No code smells detected!";

    private final boolean useColors;

    public ConsoleReportRenderer() {
        this(true);
    }

    public ConsoleReportRenderer(boolean useColors) {
        this.useColors = useColors;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(AnalysisReport report, Appendable out) throws IOException {
        logger.debug("Rendering report for {} files (colors: {})", report.filesAnalyzed(), useColors);

        printSummary(report, out);

        for (FileAnalysisResult result : report.filesWithFindings()) {
            printFile(result, out);
        }

        if (!report.failedFiles().isEmpty()) {
            out.append('\n').append(color(ANSI_BOLD + ANSI_RED, "Files that could not be analyzed:")).append('\n');
            for (FileAnalysisResult failed : report.failedFiles()) {
                out.append("   ").append(failed.source()).append(": ")
                    .append(failed.errorMessage().orElse("unknown error")).append('\n');
            }
        }

        if (report.totalFindings() == 0) {
            out.append('\n').append(color(ANSI_BOLD + ANSI_GREEN, NO_SMELLS)).append('\n');
        }
    }

    private void printSummary(AnalysisReport report, Appendable out) throws IOException {
        out.append(RULE).append('\n');
        out.append(color(ANSI_BOLD, "CODE SMELL DETECTION REPORT")).append('\n');
        out.append(RULE).append('\n');
        out.append("Total files analyzed: ").append(String.valueOf(report.filesAnalyzed())).append('\n');
        out.append("Total code smells found: ").append(String.valueOf(report.totalFindings())).append('\n');
        out.append(RULE).append('\n');
    }

    private void printFile(FileAnalysisResult result, Appendable out) throws IOException {
        out.append('\n').append(color(ANSI_BOLD + ANSI_CYAN, "File: " + result.source())).append('\n');
        out.append("   Found ").append(String.valueOf(result.findings().size())).append(" smell(s)\n\n");

        for (Finding finding : result.findings()) {
            String heading = glyph(finding.severity()) + " "
                + finding.smellType().toUpperCase(Locale.ROOT) + " [" + finding.severity().label() + "]";
            out.append("   ").append(color(severityColor(finding.severity()), heading)).append('\n');
            out.append("      Function: ").append(finding.subjectName()).append('\n');
            out.append("      Location: ").append(finding.location().toDisplayString()).append('\n');
            out.append("      Message: ").append(finding.message()).append('\n');
            out.append('\n');
        }
    }

    private static String glyph(Severity severity) {
        return switch (severity) {
            case HIGH -> "[!]";
            case MEDIUM -> "[*]";
            case LOW -> "[-]";
        };
    }

    private static String severityColor(Severity severity) {
        return switch (severity) {
            case HIGH -> ANSI_RED;
            case MEDIUM -> ANSI_YELLOW;
            case LOW -> ANSI_GREEN;
        };
    }

    private String color(String code, String text) {
        return useColors ? code + text + ANSI_RESET : text;
    }
}
