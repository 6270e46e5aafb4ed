package com.smelldetector.core.detector.impl;

import com.smelldetector.core.config.AnalysisConfig;
import com.smelldetector.core.detector.AbstractThresholdDetector;
import com.smelldetector.core.detector.SmellDetector;
import com.smelldetector.core.detector.SmellDetectorProvider;
import com.smelldetector.core.metric.LineSpanMetric;

/**
 * Flags functions whose source spans too many lines.
 *
 * <p><b>Defaults:</b> finding above 50 lines, HIGH above 100 lines.
 *
 * <p><b>Message:</b> {@code Function is 120 lines long (threshold: 50)}
 *
 * @see LineSpanMetric
 * @since 1.0.0
 */
public class LongMethodDetector extends AbstractThresholdDetector {

    public static final String ID = "long-method";
    public static final int DEFAULT_THRESHOLD = 50;
    public static final int DEFAULT_HIGH_SEVERITY_ABOVE = 100;

    public LongMethodDetector() {
        this(DEFAULT_THRESHOLD, DEFAULT_HIGH_SEVERITY_ABOVE);
    }

    public LongMethodDetector(int threshold, int highSeverityAbove) {
        super(new LineSpanMetric(), threshold, highSeverityAbove);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Long Method";
    }

    @Override
    public int getOrder() {
        return 100;
    }

    @Override
    protected String formatMessage(int measured, int threshold) {
        return String.format("Function is %d lines long (threshold: %d)", measured, threshold);
    }

    /**
     * Builds a {@link LongMethodDetector} from the {@code long-method} section of the configuration.
     */
    public static class Provider implements SmellDetectorProvider {

        @Override
        public String getId() {
            return ID;
        }

        @Override
        public SmellDetector create(AnalysisConfig config) {
            AnalysisConfig.DetectorSettings settings = config.detector(ID);
            return new LongMethodDetector(
                settings.thresholdOr(DEFAULT_THRESHOLD),
                settings.highSeverityAboveOr(DEFAULT_HIGH_SEVERITY_ABOVE)
            );
        }
    }
}
