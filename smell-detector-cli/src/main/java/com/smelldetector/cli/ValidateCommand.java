package com.smelldetector.cli;

import com.smelldetector.core.config.AnalysisConfig;
import com.smelldetector.core.config.ConfigLoader;
import com.smelldetector.core.config.ConfigurationException;
import com.smelldetector.core.detector.DetectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a configuration file.
 *
 * <p>The file is parsed and every enabled detector is built from it, so out-of-range values
 * are reported here rather than at analysis time.
 */
@Command(
    name = "validate",
    description = "Validate a configuration file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        log.info("Validating configuration: {}", configFile);

        if (!Files.exists(configFile)) {
            spec.commandLine().getErr().println("Configuration file not found: " + configFile);
            return ExitCodes.ERROR;
        }

        try {
            AnalysisConfig config = ConfigLoader.load(configFile);
            int enabled = DetectorRegistry.fromServiceLoader().createDetectors(config).size();
            spec.commandLine().getOut().printf("Configuration is valid: %s (%d detectors enabled)%n", configFile, enabled);
            return ExitCodes.OK;
        } catch (ConfigurationException e) {
            spec.commandLine().getErr().println("Invalid configuration: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
