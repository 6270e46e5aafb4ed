package com.smelldetector.core.metric;

/**
 * How {@link NestingDepthMetric} treats functions and classes defined inside the measured one.
 */
public enum NestedScopePolicy {

    /**
     * Nested definitions are walked like any other statement; their control structures add to
     * the enclosing definition's depth.
     */
    ACCUMULATE,

    /**
     * Nested definitions are skipped. They are measured on their own when the analyzer visits them.
     */
    ISOLATE
}
