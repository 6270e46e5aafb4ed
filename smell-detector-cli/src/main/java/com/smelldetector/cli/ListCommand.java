package com.smelldetector.cli;

import com.smelldetector.core.config.AnalysisConfig;
import com.smelldetector.core.config.ConfigLoader;
import com.smelldetector.core.config.ConfigurationException;
import com.smelldetector.core.detector.AbstractThresholdDetector;
import com.smelldetector.core.detector.DetectorRegistry;
import com.smelldetector.core.detector.SmellDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the registered detectors with their effective thresholds.
 *
 * <p>Detectors are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Built-in defaults
 * smell-detector list
 *
 * # Thresholds as configured for a project
 * smell-detector list --config ./my_project/smelldetector.yaml
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available detectors and their thresholds",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-c", "--config"}, description = "Configuration file to apply")
    private Path configPath;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        List<SmellDetector> detectors;
        try {
            AnalysisConfig config = configPath != null ? ConfigLoader.load(configPath) : AnalysisConfig.defaults();
            detectors = DetectorRegistry.fromServiceLoader().createDetectors(config);
        } catch (ConfigurationException e) {
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return ExitCodes.ERROR;
        }
        log.debug("Listing {} detectors", detectors.size());

        out.println("Available Detectors:");
        out.println();

        for (SmellDetector detector : detectors) {
            out.printf("  - %s (ID: %s)%n", detector.getDisplayName(), detector.getId());
            out.printf("    Order: %d%n", detector.getOrder());
            if (detector instanceof AbstractThresholdDetector thresholdDetector) {
                out.printf("    Metric: %s%n", thresholdDetector.getMetric().getId());
                out.printf("    Threshold: %d (high above %d)%n",
                    thresholdDetector.getThreshold(), thresholdDetector.getHighSeverityAbove());
            }
            out.println();
        }

        if (detectors.isEmpty()) {
            out.println("  No detectors enabled.");
        }
        return ExitCodes.OK;
    }
}
