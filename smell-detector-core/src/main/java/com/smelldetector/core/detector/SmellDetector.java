package com.smelldetector.core.detector;

import com.smelldetector.core.model.Finding;
import com.smelldetector.core.tree.SyntaxNode;

import java.util.Optional;

/**
 * Policy unit that checks one definition for one kind of code smell.
 *
 * <p>A detector measures the definition, compares the value against its configured threshold and
 * reports at most one {@link Finding}. Detectors are stateless with respect to the trees they
 * inspect: they never modify a node and keep nothing between calls, so one instance may be shared
 * across threads and the result never depends on which other detectors ran before.
 *
 * <p>New smell categories are added by implementing this interface and registering a
 * {@link SmellDetectorProvider}; the analyzer and the query utilities stay untouched.
 *
 * @see SmellDetectorProvider
 * @see DetectorRegistry
 * @since 1.0.0
 */
public interface SmellDetector {

    /**
     * Returns unique identifier for this detector.
     *
     * <p>Used as the finding's smell type and as the configuration key. Should be kebab-case
     * (e.g., "long-method", "deep-nesting").
     *
     * @return unique detector identifier
     */
    String getId();

    /**
     * Returns human-readable display name (e.g., "Long Method").
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the position of this detector in the run order.
     *
     * <p>Lower values run first. Built-in detectors use 100, 200 and 300; detectors added later
     * should pick larger values. Detectors with equal order keep their registration order.
     *
     * @return order value
     */
    int getOrder();

    /**
     * Checks a definition.
     *
     * @param definition function definition node
     * @return a finding if the measured value exceeds the threshold, otherwise empty
     */
    Optional<Finding> detect(SyntaxNode definition);
}
