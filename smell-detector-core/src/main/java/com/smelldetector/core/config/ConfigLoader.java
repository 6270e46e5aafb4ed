package com.smelldetector.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link AnalysisConfig} from YAML files.
 *
 * <p>A missing file is not an error: the built-in defaults apply. A file that exists but cannot
 * be read, parsed or validated is rejected with a {@link ConfigurationException}, so a typo in a
 * threshold never silently turns into the default.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalysisConfig config = ConfigLoader.load(Paths.get("smelldetector.yaml"));
 * DetectorRegistry registry = DetectorRegistry.fromServiceLoader();
 * SmellAnalyzer analyzer = new SmellAnalyzer(registry.createDetectors(config));
 * }</pre>
 */
public class ConfigLoader {

    /** Default configuration file name, looked up in the analysed directory. */
    public static final String DEFAULT_FILE_NAME = "smelldetector.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
        .build();

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to the configuration file
     * @return loaded configuration, or {@link AnalysisConfig#defaults()} if the file does not exist
     * @throws ConfigurationException if the file is unreadable, malformed or holds invalid values
     */
    public static AnalysisConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return AnalysisConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigurationException("Configuration file is not readable: " + configPath);
        }

        String yaml;
        try {
            log.debug("Loading configuration from: {}", configPath);
            yaml = Files.readString(configPath);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + configPath + ": " + e.getMessage(), e);
        }

        if (yaml.isBlank()) {
            log.info("Configuration file {} is empty. Using defaults.", configPath);
            return AnalysisConfig.defaults();
        }

        try {
            AnalysisConfig config = YAML_MAPPER.readValue(yaml, AnalysisConfig.class);
            log.info("Loaded configuration from: {}", configPath);
            return config != null ? config : AnalysisConfig.defaults();
        } catch (IOException e) {
            throw new ConfigurationException(
                "Invalid configuration file " + configPath + ": " + rootMessage(e), e);
        }
    }

    /**
     * Parses configuration from YAML text.
     *
     * @param yaml YAML document
     * @return parsed configuration, defaults for an empty document
     * @throws ConfigurationException if the document is malformed or holds invalid values
     */
    public static AnalysisConfig parse(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            return AnalysisConfig.defaults();
        }
        try {
            AnalysisConfig config = YAML_MAPPER.readValue(yaml, AnalysisConfig.class);
            return config != null ? config : AnalysisConfig.defaults();
        } catch (IOException e) {
            throw new ConfigurationException("Invalid configuration: " + rootMessage(e), e);
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        if (current instanceof ConfigurationException) {
            return current.getMessage();
        }
        return error.getMessage();
    }
}
