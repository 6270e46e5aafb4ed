package com.smelldetector.core.analysis;

import com.smelldetector.core.config.AnalysisConfig;
import com.smelldetector.core.config.ConfigurationException;
import com.smelldetector.core.detector.DetectorRegistry;
import com.smelldetector.core.model.AnalysisReport;
import com.smelldetector.core.model.FileAnalysisResult;
import com.smelldetector.core.parser.SourceParser;
import com.smelldetector.core.parser.SourceParsers;
import com.smelldetector.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Analyses a single file or every matching file below a directory.
 *
 * <p>Files are analysed independently on a fixed pool of worker threads; the report lists them
 * in path order whatever order they finish in. A file that fails to parse is recorded as a failed
 * result and does not stop the run.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * AnalysisConfig config = ConfigLoader.load(root.resolve(ConfigLoader.DEFAULT_FILE_NAME));
 * AnalysisReport report = ProjectAnalyzer.create(config).analyze(root);
 * }</pre>
 *
 * @since 1.0.0
 */
public class ProjectAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ProjectAnalyzer.class);

    private static final String DEFAULT_LANGUAGE = "python";

    private final SourceFileAnalyzer fileAnalyzer;
    private final AnalysisConfig.SourceSettings sources;

    public ProjectAnalyzer(SourceFileAnalyzer fileAnalyzer, AnalysisConfig.SourceSettings sources) {
        this.fileAnalyzer = Objects.requireNonNull(fileAnalyzer, "fileAnalyzer must not be null");
        this.sources = Objects.requireNonNull(sources, "sources must not be null");
    }

    /**
     * Wires parser, detectors and file discovery from a configuration.
     *
     * @param config analysis configuration
     * @return project analyzer
     * @throws ConfigurationException if no Python parser is registered or a detector rejects its settings
     */
    public static ProjectAnalyzer create(AnalysisConfig config) {
        SourceParser parser = SourceParsers.forLanguage(DEFAULT_LANGUAGE)
            .orElseThrow(() -> new ConfigurationException("No source parser registered for " + DEFAULT_LANGUAGE));
        SmellAnalyzer analyzer = new SmellAnalyzer(DetectorRegistry.fromServiceLoader().createDetectors(config));
        return new ProjectAnalyzer(new SourceFileAnalyzer(parser, analyzer), config.sources());
    }

    /**
     * Analyses a file or directory.
     *
     * <p>A regular file is analysed whatever its name. A directory is searched recursively for
     * files matching the include glob and none of the exclude globs.
     *
     * @param target file or directory
     * @return report with one result per analysed file
     * @throws NoSuchFileException if the target does not exist
     * @throws IOException if the directory cannot be traversed
     */
    public AnalysisReport analyze(Path target) throws IOException {
        if (!Files.exists(target)) {
            throw new NoSuchFileException(target.toString());
        }
        if (Files.isRegularFile(target)) {
            return new AnalysisReport(List.of(fileAnalyzer.analyzeFile(target)));
        }

        List<Path> files = FileUtils.findFiles(target, sources.include(), sources.exclude());
        log.info("Analyzing {} files under {}", files.size(), target);
        return new AnalysisReport(analyzeAll(files));
    }

    private List<FileAnalysisResult> analyzeAll(List<Path> files) {
        if (files.isEmpty()) {
            return List.of();
        }
        int threads = Math.min(sources.effectiveParallelism(), files.size());
        if (threads == 1) {
            return files.stream().map(fileAnalyzer::analyzeFile).toList();
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileAnalysisResult>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> fileAnalyzer.analyzeFile(file)));
            }
            List<FileAnalysisResult> results = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), files.get(i)));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private FileAnalysisResult await(Future<FileAnalysisResult> future, Path file) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Analysis interrupted while waiting for " + file, e);
        } catch (ExecutionException e) {
            log.warn("Analysis of {} failed", file, e.getCause());
            return FileAnalysisResult.failed(file.toString(), "analysis failed: " + e.getCause());
        }
    }

    public SourceFileAnalyzer getFileAnalyzer() {
        return fileAnalyzer;
    }
}
