package com.smelldetector.core.detector;

import com.smelldetector.core.config.ConfigurationException;
import com.smelldetector.core.metric.StructuralMetric;
import com.smelldetector.core.model.Finding;
import com.smelldetector.core.model.Location;
import com.smelldetector.core.model.Severity;
import com.smelldetector.core.query.TreeQueries;
import com.smelldetector.core.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for detectors that compare a single metric against a threshold.
 *
 * <p>The policy is shared by every built-in detector:
 * <ul>
 *   <li>no finding while the measured value is at or below the threshold</li>
 *   <li>{@link Severity#MEDIUM} while it is at or below the high-severity ceiling</li>
 *   <li>{@link Severity#HIGH} above the ceiling</li>
 * </ul>
 *
 * <p>Subclasses supply the metric, their id and the message wording. The details map of each
 * finding holds the measured value under the metric's id, the threshold under
 * {@value #THRESHOLD_KEY} and the ceiling under {@value #HIGH_SEVERITY_ABOVE_KEY}.
 *
 * @since 1.0.0
 */
public abstract class AbstractThresholdDetector implements SmellDetector {

    public static final String THRESHOLD_KEY = "threshold";
    public static final String HIGH_SEVERITY_ABOVE_KEY = "high_severity_above";

    /**
     * Logger instance for this detector.
     * Automatically initialized with the concrete detector class name.
     */
    protected final Logger log;

    private final StructuralMetric metric;
    private final int threshold;
    private final int highSeverityAbove;

    /**
     * @param metric metric this detector applies
     * @param threshold value the metric must exceed to produce a finding
     * @param highSeverityAbove value the metric must exceed for the finding to be HIGH
     * @throws ConfigurationException if either limit is negative
     */
    protected AbstractThresholdDetector(StructuralMetric metric, int threshold, int highSeverityAbove) {
        this.log = LoggerFactory.getLogger(getClass());
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        if (threshold < 0) {
            throw new ConfigurationException(getClass().getSimpleName() + ": threshold must not be negative, was " + threshold);
        }
        if (highSeverityAbove < 0) {
            throw new ConfigurationException(getClass().getSimpleName()
                + ": highSeverityAbove must not be negative, was " + highSeverityAbove);
        }
        this.threshold = threshold;
        this.highSeverityAbove = highSeverityAbove;
    }

    @Override
    public Optional<Finding> detect(SyntaxNode definition) {
        int measured = metric.measure(definition);
        if (measured <= threshold) {
            return Optional.empty();
        }

        String name = TreeQueries.nameOf(definition);
        Severity severity = classify(measured);
        log.debug("{} at line {}: {} = {} (threshold {}), severity {}",
            name, definition.start().line(), metric.getId(), measured, threshold, severity);

        Map<String, Integer> details = new LinkedHashMap<>();
        details.put(metric.getId(), measured);
        details.put(THRESHOLD_KEY, threshold);
        details.put(HIGH_SEVERITY_ABOVE_KEY, highSeverityAbove);

        return Optional.of(new Finding(
            getId(),
            severity,
            Location.of(definition.start()),
            name,
            formatMessage(measured, threshold),
            details
        ));
    }

    /**
     * Severity of a value that already exceeds the threshold.
     *
     * @param measured measured value
     * @return HIGH above the ceiling, MEDIUM otherwise
     */
    protected Severity classify(int measured) {
        return measured > highSeverityAbove ? Severity.HIGH : Severity.MEDIUM;
    }

    /**
     * Human-readable message for a finding.
     *
     * @param measured measured value
     * @param threshold configured threshold
     * @return message
     */
    protected abstract String formatMessage(int measured, int threshold);

    public StructuralMetric getMetric() {
        return metric;
    }

    public int getThreshold() {
        return threshold;
    }

    public int getHighSeverityAbove() {
        return highSeverityAbove;
    }
}
