package com.smelldetector.core.analysis;

import com.smelldetector.core.model.FileAnalysisResult;
import com.smelldetector.core.model.Finding;
import com.smelldetector.core.parser.SourceParseException;
import com.smelldetector.core.parser.SourceParser;
import com.smelldetector.core.tree.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Parses and analyses one source unit at a time.
 *
 * <p>This is the per-unit failure boundary: a unit that cannot be read or parsed yields a failed
 * {@link FileAnalysisResult} with no findings instead of an exception, so a multi-file run always
 * completes.
 *
 * @since 1.0.0
 */
public class SourceFileAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SourceFileAnalyzer.class);

    private final SourceParser parser;
    private final SmellAnalyzer analyzer;

    public SourceFileAnalyzer(SourceParser parser, SmellAnalyzer analyzer) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
    }

    /**
     * Analyses a file.
     *
     * @param file source file
     * @return findings, or a failed result if the file could not be parsed
     */
    public FileAnalysisResult analyzeFile(Path file) {
        String source = file.toString();
        try {
            SyntaxTree tree = parser.parseFile(file);
            List<Finding> findings = analyzer.analyze(tree);
            return FileAnalysisResult.success(source, findings);
        } catch (SourceParseException e) {
            log.warn("Skipping {}: {}", source, e.getMessage());
            return FileAnalysisResult.failed(source, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Analysis of {} failed", source, e);
            return FileAnalysisResult.failed(source, "analysis failed: " + e);
        }
    }

    /**
     * Analyses source text held in memory.
     *
     * @param origin label reported as the result's source
     * @param sourceCode source text
     * @return findings, or a failed result if the text could not be parsed
     */
    public FileAnalysisResult analyzeSource(String origin, String sourceCode) {
        try {
            SyntaxTree tree = parser.parseString(sourceCode);
            return FileAnalysisResult.success(origin, analyzer.analyze(tree));
        } catch (SourceParseException e) {
            log.warn("Skipping {}: {}", origin, e.getMessage());
            return FileAnalysisResult.failed(origin, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Analysis of {} failed", origin, e);
            return FileAnalysisResult.failed(origin, "analysis failed: " + e);
        }
    }

    public SourceParser getParser() {
        return parser;
    }

    public SmellAnalyzer getAnalyzer() {
        return analyzer;
    }
}
