package com.smelldetector.core.detector.impl;

import com.smelldetector.core.config.AnalysisConfig;
import com.smelldetector.core.detector.AbstractThresholdDetector;
import com.smelldetector.core.detector.SmellDetector;
import com.smelldetector.core.detector.SmellDetectorProvider;
import com.smelldetector.core.metric.NestedScopePolicy;
import com.smelldetector.core.metric.NestingDepthMetric;

/**
 * Flags functions whose control structures are nested too deeply.
 *
 * <p><b>Defaults:</b> finding above depth 4, HIGH above depth 5. Whether functions and classes
 * defined inside the function add to its depth is controlled by {@link NestedScopePolicy}.
 *
 * <p><b>Message:</b> {@code Function has nesting depth of 5 (threshold: 4)}
 *
 * @see NestingDepthMetric
 * @since 1.0.0
 */
public class DeepNestingDetector extends AbstractThresholdDetector {

    public static final String ID = "deep-nesting";
    public static final int DEFAULT_THRESHOLD = 4;
    public static final int DEFAULT_HIGH_SEVERITY_ABOVE = 5;

    public DeepNestingDetector() {
        this(DEFAULT_THRESHOLD, DEFAULT_HIGH_SEVERITY_ABOVE, NestedScopePolicy.ACCUMULATE);
    }

    public DeepNestingDetector(int threshold, int highSeverityAbove) {
        this(threshold, highSeverityAbove, NestedScopePolicy.ACCUMULATE);
    }

    public DeepNestingDetector(int threshold, int highSeverityAbove, NestedScopePolicy nestedScopes) {
        super(new NestingDepthMetric(nestedScopes), threshold, highSeverityAbove);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Deep Nesting";
    }

    @Override
    public int getOrder() {
        return 300;
    }

    @Override
    protected String formatMessage(int measured, int threshold) {
        return String.format("Function has nesting depth of %d (threshold: %d)", measured, threshold);
    }

    /**
     * Builds a {@link DeepNestingDetector} from the {@code deep-nesting} and {@code nesting} sections.
     */
    public static class Provider implements SmellDetectorProvider {

        @Override
        public String getId() {
            return ID;
        }

        @Override
        public SmellDetector create(AnalysisConfig config) {
            AnalysisConfig.DetectorSettings settings = config.detector(ID);
            return new DeepNestingDetector(
                settings.thresholdOr(DEFAULT_THRESHOLD),
                settings.highSeverityAboveOr(DEFAULT_HIGH_SEVERITY_ABOVE),
                config.nesting().nestedScopes()
            );
        }
    }
}
