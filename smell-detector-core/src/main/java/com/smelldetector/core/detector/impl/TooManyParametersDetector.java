package com.smelldetector.core.detector.impl;

import com.smelldetector.core.config.AnalysisConfig;
import com.smelldetector.core.detector.AbstractThresholdDetector;
import com.smelldetector.core.detector.SmellDetector;
import com.smelldetector.core.detector.SmellDetectorProvider;
import com.smelldetector.core.metric.ParameterCountMetric;

/**
 * Flags functions that declare too many ordinary parameters.
 *
 * <p><b>Defaults:</b> finding above 5 parameters, HIGH above 7.
 *
 * <p><b>Message:</b> {@code Function has 6 parameters (threshold: 5)}
 *
 * @see ParameterCountMetric
 * @since 1.0.0
 */
public class TooManyParametersDetector extends AbstractThresholdDetector {

    public static final String ID = "too-many-parameters";
    public static final int DEFAULT_THRESHOLD = 5;
    public static final int DEFAULT_HIGH_SEVERITY_ABOVE = 7;

    public TooManyParametersDetector() {
        this(DEFAULT_THRESHOLD, DEFAULT_HIGH_SEVERITY_ABOVE);
    }

    public TooManyParametersDetector(int threshold, int highSeverityAbove) {
        super(new ParameterCountMetric(), threshold, highSeverityAbove);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Too Many Parameters";
    }

    @Override
    public int getOrder() {
        return 200;
    }

    @Override
    protected String formatMessage(int measured, int threshold) {
        return String.format("Function has %d parameters (threshold: %d)", measured, threshold);
    }

    /**
     * Builds a {@link TooManyParametersDetector} from the {@code too-many-parameters} section.
     */
    public static class Provider implements SmellDetectorProvider {

        @Override
        public String getId() {
            return ID;
        }

        @Override
        public SmellDetector create(AnalysisConfig config) {
            AnalysisConfig.DetectorSettings settings = config.detector(ID);
            return new TooManyParametersDetector(
                settings.thresholdOr(DEFAULT_THRESHOLD),
                settings.highSeverityAboveOr(DEFAULT_HIGH_SEVERITY_ABOVE)
            );
        }
    }
}
