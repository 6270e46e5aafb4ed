package com.smelldetector.core.report.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smelldetector.core.model.AnalysisReport;
import com.smelldetector.core.model.FileAnalysisResult;
import com.smelldetector.core.model.Finding;
import com.smelldetector.core.model.Location;
import com.smelldetector.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JsonReportRenderer}.
 */
class JsonReportRendererTest {

    private final JsonReportRenderer renderer = new JsonReportRenderer();

    @Test
    void render_producesParseableReport() throws IOException {
        Map<String, Integer> details = new LinkedHashMap<>();
        details.put("param_count", 6);
        details.put("threshold", 5);
        Finding finding = new Finding("too-many-parameters", Severity.MEDIUM, new Location(3, 4), "create_user",
            "Function has 6 parameters (threshold: 5)", details);
        AnalysisReport report = new AnalysisReport(List.of(
            FileAnalysisResult.success("users.py", List.of(finding)),
            FileAnalysisResult.failed("broken.py", "cannot read source")
        ));
        StringBuilder out = new StringBuilder();

        renderer.render(report, out);
        JsonNode json = new ObjectMapper().readTree(out.toString());

        assertThat(json.at("/summary/filesAnalyzed").asInt()).isEqualTo(2);
        assertThat(json.at("/summary/totalFindings").asInt()).isEqualTo(1);
        assertThat(json.at("/summary/failedFiles").asInt()).isEqualTo(1);
        assertThat(json.at("/summary/bySeverity/medium").asLong()).isEqualTo(1);
        assertThat(json.at("/summary/bySeverity/high").asLong()).isZero();
        assertThat(json.at("/summary/bySmellType/too-many-parameters").asLong()).isEqualTo(1);

        JsonNode first = json.at("/files/0/findings/0");
        assertThat(first.get("smellType").asText()).isEqualTo("too-many-parameters");
        assertThat(first.get("severity").asText()).isEqualTo("medium");
        assertThat(first.get("subjectName").asText()).isEqualTo("create_user");
        assertThat(first.get("line").asInt()).isEqualTo(3);
        assertThat(first.get("column").asInt()).isEqualTo(4);
        assertThat(first.at("/details/param_count").asInt()).isEqualTo(6);

        assertThat(json.at("/files/0/error").isNull()).isTrue();
        assertThat(json.at("/files/1/error").asText()).isEqualTo("cannot read source");
    }

    @Test
    void getId_returnsJson() {
        assertThat(renderer.getId()).isEqualTo("json");
    }
}
