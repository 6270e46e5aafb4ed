package com.smelldetector.core.report;

import com.smelldetector.core.model.AnalysisReport;

import java.io.IOException;

/**
 * Interface for renderers that turn an {@link AnalysisReport} into text.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class CsvReportRenderer implements ReportRenderer {
 *     @Override
 *     public String getId() {
 *         return "csv";
 *     }
 *
 *     @Override
 *     public void render(AnalysisReport report, Appendable out) throws IOException {
 *         for (Finding finding : report.allFindings()) {
 *             out.append(finding.smellType()).append(',').append(finding.subjectName()).append('\n');
 *         }
 *     }
 * }
 * }</pre>
 *
 * @see com.smelldetector.core.report.impl.ConsoleReportRenderer
 * @see com.smelldetector.core.report.impl.JsonReportRenderer
 */
public interface ReportRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used as the value of the CLI {@code --format} option. Should be lowercase
     * (e.g., "console", "json").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Writes the report to {@code out}.
     *
     * @param report analysis report
     * @param out destination
     * @throws IOException if writing to the destination fails
     */
    void render(AnalysisReport report, Appendable out) throws IOException;
}
