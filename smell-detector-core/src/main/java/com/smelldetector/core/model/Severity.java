package com.smelldetector.core.model;

import java.util.Locale;

/**
 * Urgency of a finding, ordered from least to most urgent.
 *
 * <p>Built-in detectors only produce {@link #MEDIUM} and {@link #HIGH}; {@link #LOW} is available
 * to detectors with a softer policy.
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Worth knowing about, no action expected.
     */
    LOW,

    /**
     * Exceeds the threshold; should be reviewed.
     */
    MEDIUM,

    /**
     * Far beyond the threshold; should be fixed.
     */
    HIGH;

    /**
     * Whether this severity is at least as urgent as {@code other}.
     *
     * @param other severity to compare against
     * @return true if {@code this >= other}
     */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Lower-case label used in reports ("low", "medium", "high").
     *
     * @return label
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a severity name, ignoring case.
     *
     * @param value severity name
     * @return matching severity
     * @throws IllegalArgumentException if the value names no severity
     */
    public static Severity fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
