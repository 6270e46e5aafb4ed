package com.smelldetector.core.detector;

import com.smelldetector.core.config.AnalysisConfig;
import com.smelldetector.core.config.ConfigurationException;
import com.smelldetector.core.detector.impl.DeepNestingDetector;
import com.smelldetector.core.detector.impl.LongMethodDetector;
import com.smelldetector.core.detector.impl.TooManyParametersDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * The set of detector providers an analysis can draw from.
 *
 * <p>{@link #createDetectors(AnalysisConfig)} instantiates every enabled detector and returns them
 * in run order: ascending {@link SmellDetector#getOrder()}, ties kept in registration order.
 * With the built-in providers that is long-method, too-many-parameters, deep-nesting.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * DetectorRegistry registry = DetectorRegistry.fromServiceLoader()
 *     .register(new MyCustomDetector.Provider());
 * List<SmellDetector> detectors = registry.createDetectors(config);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final List<SmellDetectorProvider> providers;

    /**
     * @param providers providers in registration order
     * @throws ConfigurationException if two providers share an id
     */
    public DetectorRegistry(List<SmellDetectorProvider> providers) {
        Set<String> ids = new HashSet<>();
        for (SmellDetectorProvider provider : providers) {
            if (!ids.add(provider.getId())) {
                throw new ConfigurationException("Duplicate detector id: " + provider.getId());
            }
        }
        this.providers = List.copyOf(providers);
    }

    /**
     * Registry with the three built-in detectors only.
     *
     * @return built-in registry
     */
    public static DetectorRegistry builtIn() {
        return new DetectorRegistry(List.of(
            new LongMethodDetector.Provider(),
            new TooManyParametersDetector.Provider(),
            new DeepNestingDetector.Provider()
        ));
    }

    /**
     * Registry of every provider registered through {@link ServiceLoader}.
     *
     * <p>Falls back to {@link #builtIn()} if no registration is visible on the classpath
     * (e.g. a repackaged jar that dropped {@code META-INF/services}).
     *
     * @return discovered registry
     */
    public static DetectorRegistry fromServiceLoader() {
        List<SmellDetectorProvider> discovered = new ArrayList<>();
        ServiceLoader.load(SmellDetectorProvider.class).forEach(discovered::add);
        if (discovered.isEmpty()) {
            log.warn("No detector providers registered via ServiceLoader; using built-in detectors");
            return builtIn();
        }
        log.debug("Discovered {} detector providers", discovered.size());
        return new DetectorRegistry(discovered);
    }

    /**
     * Returns a registry with one more provider appended.
     *
     * @param provider provider to add
     * @return new registry
     */
    public DetectorRegistry register(SmellDetectorProvider provider) {
        Objects.requireNonNull(provider, "provider must not be null");
        List<SmellDetectorProvider> extended = new ArrayList<>(providers);
        extended.add(provider);
        return new DetectorRegistry(extended);
    }

    public List<SmellDetectorProvider> providers() {
        return providers;
    }

    /**
     * Creates every enabled detector, configured from {@code config}.
     *
     * @param config analysis configuration
     * @return detectors in run order
     * @throws ConfigurationException if a detector rejects its settings
     */
    public List<SmellDetector> createDetectors(AnalysisConfig config) {
        warnAboutUnknownIds(config);

        List<SmellDetector> detectors = new ArrayList<>();
        for (SmellDetectorProvider provider : providers) {
            if (!config.detector(provider.getId()).isEnabled()) {
                log.debug("Detector {} disabled by configuration", provider.getId());
                continue;
            }
            detectors.add(provider.create(config));
        }
        // List.sort is stable, so equal orders keep registration order
        detectors.sort(Comparator.comparingInt(SmellDetector::getOrder));
        return detectors;
    }

    private void warnAboutUnknownIds(AnalysisConfig config) {
        Set<String> known = new HashSet<>();
        providers.forEach(provider -> known.add(provider.getId()));
        for (String configured : config.detectors().keySet()) {
            if (!known.contains(configured)) {
                log.warn("Configuration references unknown detector '{}'. Available: {}", configured, known);
            }
        }
    }
}
