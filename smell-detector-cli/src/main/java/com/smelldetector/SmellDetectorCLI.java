package com.smelldetector;

import ch.qos.logback.classic.Level;
import com.smelldetector.cli.AnalyzeCommand;
import com.smelldetector.cli.ListCommand;
import com.smelldetector.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Main CLI entry point for the smell detector.
 *
 * <p>Finds structural code smells (long methods, long parameter lists, deeply nested control
 * flow) in Python sources.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze a file or directory</li>
 *   <li>{@code list} - List available detectors</li>
 *   <li>{@code validate} - Validate a configuration file</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Analyze a project
 * smell-detector analyze ./my_project
 *
 * # Fail a CI build on high-severity findings
 * smell-detector analyze src --format json --fail-on high
 *
 * # Show detectors and their thresholds
 * smell-detector list
 * }</pre>
 */
@Command(
    name = "smell-detector",
    mixinStandardHelpOptions = true,
    version = "Smell Detector 1.0.0-SNAPSHOT",
    description = "Structural code smell detection for Python sources",
    subcommands = {
        AnalyzeCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class SmellDetectorCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SmellDetectorCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("Smell Detector - Structural code smell detection");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'smell-detector --help' to see available commands");
        out.println("Use 'smell-detector <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.WARN);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with the global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        SmellDetectorCLI cli = new SmellDetectorCLI();
        CommandLine commandLine = new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
