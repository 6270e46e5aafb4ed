package com.smelldetector.core.metric;

import com.smelldetector.core.tree.SyntaxNode;

/**
 * A pure, integer-valued measurement of a definition node.
 *
 * <p>Implementations must not modify the node and must not fail on incomplete structure; a
 * missing part of the tree contributes nothing to the value.
 *
 * @since 1.0.0
 */
public interface StructuralMetric {

    /**
     * Key under which the measured value is reported in finding details
     * (e.g. "line_count", "param_count").
     *
     * @return snake_case metric key
     */
    String getId();

    /**
     * Measures a definition.
     *
     * @param definition function or class definition node
     * @return measured value, never negative
     */
    int measure(SyntaxNode definition);
}
