package com.smelldetector.core.analysis;

import com.smelldetector.core.config.AnalysisConfig;
import com.smelldetector.core.config.AnalysisConfig.DetectorSettings;
import com.smelldetector.core.config.AnalysisConfig.SourceSettings;
import com.smelldetector.core.model.AnalysisReport;
import com.smelldetector.core.model.FileAnalysisResult;
import com.smelldetector.core.model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ProjectAnalyzer}.
 */
class ProjectAnalyzerTest {

    @TempDir
    Path tempDir;

    @Test
    void analyze_directory_reportsEveryPythonFileInPathOrder() throws IOException {
        write("b_module.py", PythonSources.functionWithParameters("wide", 8));
        write("a_module.py", PythonSources.functionWithLines("long_one", 60));
        write("pkg/clean.py", "def fine():\n    return 1\n");
        write("notes.txt", "def not_python(a, b, c, d, e, f, g, h):\n    pass\n");

        AnalysisReport report = ProjectAnalyzer.create(AnalysisConfig.defaults()).analyze(tempDir);

        assertThat(report.results()).extracting(FileAnalysisResult::source).containsExactly(
            tempDir.resolve("a_module.py").toString(),
            tempDir.resolve("b_module.py").toString(),
            tempDir.resolve("pkg/clean.py").toString()
        );
        assertThat(report.totalFindings()).isEqualTo(2);
        assertThat(report.countsBySmellType()).containsEntry("long-method", 1L).containsEntry("too-many-parameters", 1L);
        assertThat(report.hasFindingsAtOrAbove(Severity.HIGH)).isTrue();
    }

    @Test
    void analyze_invalidUtf8File_isFailedUnitAndOthersStillAnalyzed() throws IOException {
        write("good.py", PythonSources.functionWithParameters("wide", 6));
        Path bad = tempDir.resolve("bad.py");
        Files.write(bad, new byte[] {'d', 'e', 'f', ' ', (byte) 0xC3, (byte) 0x28, '(', ')', ':', '\n'});

        AnalysisReport report = ProjectAnalyzer.create(AnalysisConfig.defaults()).analyze(tempDir);

        assertThat(report.filesAnalyzed()).isEqualTo(2);
        assertThat(report.failedFiles()).extracting(FileAnalysisResult::source).containsExactly(bad.toString());
        assertThat(report.totalFindings()).isEqualTo(1);
    }

    @Test
    void analyze_singleFile_analyzesItWhateverItsName() throws IOException {
        Path script = write("tool", PythonSources.functionWithParameters("wide", 6));

        AnalysisReport report = ProjectAnalyzer.create(AnalysisConfig.defaults()).analyze(script);

        assertThat(report.filesAnalyzed()).isEqualTo(1);
        assertThat(report.totalFindings()).isEqualTo(1);
    }

    @Test
    void analyze_appliesExcludesAndThresholds() throws IOException {
        write("src/app.py", PythonSources.functionWithLines("medium_length", 30));
        write("venv/lib/vendor.py", PythonSources.functionWithLines("vendored", 200));
        AnalysisConfig config = new AnalysisConfig(
            Map.of("long-method", DetectorSettings.of(20, 40)),
            null,
            new SourceSettings(null, List.of("venv/**"), 1)
        );

        AnalysisReport report = ProjectAnalyzer.create(config).analyze(tempDir);

        assertThat(report.filesAnalyzed()).isEqualTo(1);
        assertThat(report.allFindings()).singleElement().satisfies(finding -> {
            assertThat(finding.subjectName()).isEqualTo("medium_length");
            assertThat(finding.severity()).isEqualTo(Severity.MEDIUM);
        });
    }

    @Test
    void analyze_parallelRunMatchesSequentialRun() throws IOException {
        for (int i = 0; i < 12; i++) {
            write("m" + i + ".py", PythonSources.functionWithParameters("f" + i, i));
        }
        AnalysisConfig sequential = new AnalysisConfig(null, null, new SourceSettings(null, null, 1));
        AnalysisConfig parallel = new AnalysisConfig(null, null, new SourceSettings(null, null, 4));

        AnalysisReport one = ProjectAnalyzer.create(sequential).analyze(tempDir);
        AnalysisReport four = ProjectAnalyzer.create(parallel).analyze(tempDir);

        assertThat(four).isEqualTo(one);
        assertThat(four.totalFindings()).isEqualTo(6);
    }

    @Test
    void analyze_emptyDirectory_returnsEmptyReport() throws IOException {
        AnalysisReport report = ProjectAnalyzer.create(AnalysisConfig.defaults()).analyze(tempDir);

        assertThat(report.filesAnalyzed()).isZero();
    }

    @Test
    void analyze_missingTarget_throwsNoSuchFileException() {
        ProjectAnalyzer analyzer = ProjectAnalyzer.create(AnalysisConfig.defaults());

        assertThatThrownBy(() -> analyzer.analyze(tempDir.resolve("nope")))
            .isInstanceOf(NoSuchFileException.class);
    }

    private Path write(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
