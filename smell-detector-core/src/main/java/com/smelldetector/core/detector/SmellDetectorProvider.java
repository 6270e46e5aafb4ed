package com.smelldetector.core.detector;

import com.smelldetector.core.config.AnalysisConfig;

/**
 * Service provider that builds a configured {@link SmellDetector}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.smelldetector.core.detector.SmellDetectorProvider}
 *
 * @since 1.0.0
 */
public interface SmellDetectorProvider {

    /**
     * Id of the detector this provider creates.
     *
     * @return detector id
     */
    String getId();

    /**
     * Creates the detector with thresholds taken from {@code config}.
     *
     * @param config analysis configuration
     * @return configured detector
     * @throws com.smelldetector.core.config.ConfigurationException if the settings are invalid
     */
    SmellDetector create(AnalysisConfig config);
}
