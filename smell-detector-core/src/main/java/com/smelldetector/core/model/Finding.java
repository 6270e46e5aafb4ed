package com.smelldetector.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single detected code smell.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Finding finding = new Finding(
 *     "long-method",
 *     Severity.HIGH,
 *     new Location(12, 4),
 *     "process_order",
 *     "Function is 120 lines long (threshold: 50)",
 *     Map.of("line_count", 120, "threshold", 50)
 * );
 * }</pre>
 *
 * @param smellType id of the detector that produced the finding (e.g. "long-method")
 * @param severity urgency derived from the measured value
 * @param location start of the offending definition
 * @param subjectName name of the function, "unknown" if it has none
 * @param message human-readable summary with measured value and threshold
 * @param details metric key to measured value, plus the threshold that was applied
 */
public record Finding(
    String smellType,
    Severity severity,
    Location location,
    String subjectName,
    String message,
    Map<String, Integer> details
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        Objects.requireNonNull(smellType, "smellType must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(subjectName, "subjectName must not be null");
        Objects.requireNonNull(message, "message must not be null");
        details = details != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
            : Map.of();
    }

    /**
     * Looks up a detail value.
     *
     * @param key detail key (e.g. "threshold")
     * @return value, or {@code null} when absent
     */
    public Integer detail(String key) {
        return details.get(key);
    }
}
