package com.smelldetector.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.smelldetector.core.metric.NestedScopePolicy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration of an analysis run.
 *
 * <p>Loaded from {@code smelldetector.yaml}. Every section and key is optional; anything left out
 * falls back to the built-in defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * detectors:
 *   long-method:
 *     threshold: 40
 *     highSeverityAbove: 80
 *   too-many-parameters:
 *     enabled: false
 *
 * nesting:
 *   nestedScopes: ISOLATE
 *
 * sources:
 *   include: "**.py"
 *   exclude:
 *     - "venv/**"
 *   parallelism: 4
 * }</pre>
 *
 * @param detectors per-detector settings keyed by detector id
 * @param nesting nesting-depth settings
 * @param sources file discovery settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisConfig(
    @JsonProperty("detectors") Map<String, DetectorSettings> detectors,
    @JsonProperty("nesting") NestingSettings nesting,
    @JsonProperty("sources") SourceSettings sources
) {
    public AnalysisConfig {
        detectors = detectors != null ? withoutNullSettings(detectors) : Map.of();
        nesting = nesting != null ? nesting : NestingSettings.defaults();
        sources = sources != null ? sources : SourceSettings.defaults();
    }

    /**
     * Creates a configuration where every detector uses its defaults.
     *
     * @return default configuration
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(Map.of(), NestingSettings.defaults(), SourceSettings.defaults());
    }

    /**
     * Settings for one detector.
     *
     * @param detectorId detector id (e.g. "deep-nesting")
     * @return configured settings, or an all-defaults entry when the detector is not configured
     */
    public DetectorSettings detector(String detectorId) {
        return detectors.getOrDefault(detectorId, DetectorSettings.unset());
    }

    /**
     * Copy of this configuration with one detector's settings replaced.
     *
     * @param detectorId detector id
     * @param settings new settings
     * @return updated configuration
     */
    public AnalysisConfig withDetector(String detectorId, DetectorSettings settings) {
        Map<String, DetectorSettings> updated = new LinkedHashMap<>(detectors);
        updated.put(detectorId, settings);
        return new AnalysisConfig(updated, nesting, sources);
    }

    public AnalysisConfig withNestedScopes(NestedScopePolicy policy) {
        return new AnalysisConfig(detectors, new NestingSettings(policy), sources);
    }

    // An empty YAML section ("long-method:") deserializes to a null value.
    private static Map<String, DetectorSettings> withoutNullSettings(Map<String, DetectorSettings> detectors) {
        Map<String, DetectorSettings> copy = new LinkedHashMap<>();
        detectors.forEach((id, settings) -> copy.put(id, settings != null ? settings : DetectorSettings.unset()));
        return Map.copyOf(copy);
    }

    /**
     * Settings for a single detector. Null fields mean "use the detector's default".
     *
     * @param enabled whether the detector runs
     * @param threshold value the metric must exceed for a finding
     * @param highSeverityAbove value the metric must exceed for the finding to be HIGH
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DetectorSettings(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("threshold") Integer threshold,
        @JsonProperty("highSeverityAbove") Integer highSeverityAbove
    ) {
        public DetectorSettings {
            if (threshold != null && threshold < 0) {
                throw new ConfigurationException("threshold must not be negative, was " + threshold);
            }
            if (highSeverityAbove != null && highSeverityAbove < 0) {
                throw new ConfigurationException("highSeverityAbove must not be negative, was " + highSeverityAbove);
            }
        }

        public static DetectorSettings unset() {
            return new DetectorSettings(null, null, null);
        }

        public static DetectorSettings of(int threshold, int highSeverityAbove) {
            return new DetectorSettings(true, threshold, highSeverityAbove);
        }

        public boolean isEnabled() {
            return enabled == null || enabled;
        }

        public int thresholdOr(int defaultValue) {
            return threshold != null ? threshold : defaultValue;
        }

        public int highSeverityAboveOr(int defaultValue) {
            return highSeverityAbove != null ? highSeverityAbove : defaultValue;
        }
    }

    /**
     * Nesting-depth settings.
     *
     * @param nestedScopes treatment of functions and classes nested in the measured definition
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NestingSettings(
        @JsonProperty("nestedScopes") NestedScopePolicy nestedScopes
    ) {
        public NestingSettings {
            nestedScopes = nestedScopes != null ? nestedScopes : NestedScopePolicy.ACCUMULATE;
        }

        public static NestingSettings defaults() {
            return new NestingSettings(NestedScopePolicy.ACCUMULATE);
        }
    }

    /**
     * Which files a directory analysis picks up, and how many are analysed at once.
     *
     * @param include glob matched against paths relative to the analysed directory
     * @param exclude globs of relative paths to skip
     * @param parallelism number of worker threads, null for one per available processor
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SourceSettings(
        @JsonProperty("include") String include,
        @JsonProperty("exclude") List<String> exclude,
        @JsonProperty("parallelism") Integer parallelism
    ) {
        public static final String DEFAULT_INCLUDE = "**.py";

        public SourceSettings {
            include = include != null && !include.isBlank() ? include : DEFAULT_INCLUDE;
            exclude = exclude != null ? List.copyOf(exclude) : List.of();
            if (parallelism != null && parallelism < 1) {
                throw new ConfigurationException("parallelism must be at least 1, was " + parallelism);
            }
        }

        public static SourceSettings defaults() {
            return new SourceSettings(DEFAULT_INCLUDE, List.of(), null);
        }

        public int effectiveParallelism() {
            return parallelism != null ? parallelism : Runtime.getRuntime().availableProcessors();
        }
    }
}
