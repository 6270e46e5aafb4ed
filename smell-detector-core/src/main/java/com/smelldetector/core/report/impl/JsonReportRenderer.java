package com.smelldetector.core.report.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smelldetector.core.model.AnalysisReport;
import com.smelldetector.core.model.FileAnalysisResult;
import com.smelldetector.core.model.Finding;
import com.smelldetector.core.model.Severity;
import com.smelldetector.core.report.ReportRenderer;

import java.io.IOException;
import java.util.Map;

/**
 * Machine-readable report for CI pipelines and other tooling.
 *
 * <p>Shape:
 * <pre>{@code
 * {
 *   "summary" : { "filesAnalyzed" : 2, "totalFindings" : 1, "failedFiles" : 0,
 *                 "bySeverity" : { "low" : 0, "medium" : 1, "high" : 0 },
 *                 "bySmellType" : { "long-method" : 1 } },
 *   "files" : [ { "source" : "a.py", "error" : null, "findings" : [ {
 *       "smellType" : "long-method", "severity" : "medium", "subjectName" : "f",
 *       "line" : 1, "column" : 0, "message" : "...", "details" : { "line_count" : 60, ... } } ] } ]
 * }
 * }</pre>
 */
public class JsonReportRenderer implements ReportRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public void render(AnalysisReport report, Appendable out) throws IOException {
        out.append(MAPPER.writeValueAsString(toJson(report))).append('\n');
    }

    ObjectNode toJson(AnalysisReport report) {
        ObjectNode root = MAPPER.createObjectNode();

        ObjectNode summary = root.putObject("summary");
        summary.put("filesAnalyzed", report.filesAnalyzed());
        summary.put("totalFindings", report.totalFindings());
        summary.put("failedFiles", report.failedFiles().size());
        ObjectNode bySeverity = summary.putObject("bySeverity");
        for (Map.Entry<Severity, Long> entry : report.countsBySeverity().entrySet()) {
            bySeverity.put(entry.getKey().label(), entry.getValue());
        }
        ObjectNode byType = summary.putObject("bySmellType");
        report.countsBySmellType().forEach(byType::put);

        ArrayNode files = root.putArray("files");
        for (FileAnalysisResult result : report.results()) {
            ObjectNode file = files.addObject();
            file.put("source", result.source());
            file.put("error", result.error());
            ArrayNode findings = file.putArray("findings");
            for (Finding finding : result.findings()) {
                findings.add(toJson(finding));
            }
        }
        return root;
    }

    private ObjectNode toJson(Finding finding) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("smellType", finding.smellType());
        node.put("severity", finding.severity().label());
        node.put("subjectName", finding.subjectName());
        node.put("line", finding.location().line());
        node.put("column", finding.location().column());
        node.put("message", finding.message());
        ObjectNode details = node.putObject("details");
        finding.details().forEach(details::put);
        return node;
    }
}
