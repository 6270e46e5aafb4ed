package com.smelldetector.cli;

import com.smelldetector.core.analysis.ProjectAnalyzer;
import com.smelldetector.core.config.AnalysisConfig;
import com.smelldetector.core.config.ConfigLoader;
import com.smelldetector.core.config.ConfigurationException;
import com.smelldetector.core.metric.NestedScopePolicy;
import com.smelldetector.core.model.AnalysisReport;
import com.smelldetector.core.model.Severity;
import com.smelldetector.core.report.ReportRenderer;
import com.smelldetector.core.report.impl.ConsoleReportRenderer;
import com.smelldetector.core.report.impl.JsonReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to analyze a Python file or directory and print a smell report.
 *
 * <p><b>Exit codes:</b> 0 on success, 1 on invalid configuration or unreadable input,
 * 2 when {@code --fail-on} is set and a finding at or above that severity exists.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Analyze a single file
 * smell-detector analyze my_script.py
 *
 * # Analyze a project with its own configuration
 * smell-detector analyze ./my_project --config ./my_project/smelldetector.yaml
 *
 * # JSON for CI, failing on high-severity smells
 * smell-detector analyze src --format json --fail-on high
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a Python file or directory for code smells",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    /** Output formats accepted by {@code --format}. */
    public enum Format { CONSOLE, JSON }

    /** Severities accepted by {@code --fail-on}. */
    public enum FailOn { NONE, LOW, MEDIUM, HIGH }

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "File or directory to analyze")
    private Path target;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: smelldetector.yaml in the analyzed directory)"
    )
    private Path configPath;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "CONSOLE"
    )
    private Format format;

    @Option(names = {"--no-color"}, description = "Disable ANSI colors in console output")
    private boolean noColor;

    @Option(
        names = {"--fail-on"},
        description = "Exit with code 2 if a finding at or above this severity exists: "
            + "${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "NONE"
    )
    private FailOn failOn;

    @Option(
        names = {"--nested-scopes"},
        description = "Whether nested functions and classes add to nesting depth: ${COMPLETION-CANDIDATES}"
    )
    private NestedScopePolicy nestedScopes;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();

        if (!Files.exists(target)) {
            err.println("Error: " + target + " is not a valid file or directory");
            return ExitCodes.ERROR;
        }

        AnalysisConfig config;
        ProjectAnalyzer analyzer;
        try {
            config = loadConfiguration();
            analyzer = ProjectAnalyzer.create(config);
        } catch (ConfigurationException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return ExitCodes.ERROR;
        }

        AnalysisReport report;
        try {
            log.info("Analyzing: {}", target.toAbsolutePath());
            report = analyzer.analyze(target);
        } catch (IOException e) {
            log.error("Cannot analyze {}", target, e);
            err.println("Error: cannot analyze " + target + ": " + e.getMessage());
            return ExitCodes.ERROR;
        }

        PrintWriter out = spec.commandLine().getOut();
        try {
            renderer().render(report, out);
        } catch (IOException e) {
            log.error("Failed to write report", e);
            return ExitCodes.ERROR;
        }
        out.flush();

        if (failOn != FailOn.NONE && report.hasFindingsAtOrAbove(Severity.fromString(failOn.name()))) {
            log.info("Findings at or above {} severity, failing", failOn);
            return ExitCodes.FINDINGS;
        }
        return ExitCodes.OK;
    }

    private AnalysisConfig loadConfiguration() {
        AnalysisConfig config;
        if (configPath != null) {
            if (!Files.exists(configPath)) {
                throw new ConfigurationException("Configuration file not found: " + configPath);
            }
            config = ConfigLoader.load(configPath);
        } else {
            Path directory = Files.isDirectory(target) ? target : target.toAbsolutePath().getParent();
            Path candidate = directory.resolve(ConfigLoader.DEFAULT_FILE_NAME);
            config = Files.exists(candidate) ? ConfigLoader.load(candidate) : AnalysisConfig.defaults();
        }
        return nestedScopes != null ? config.withNestedScopes(nestedScopes) : config;
    }

    private ReportRenderer renderer() {
        return switch (format) {
            case CONSOLE -> new ConsoleReportRenderer(!noColor);
            case JSON -> new JsonReportRenderer();
        };
    }
}
