package com.smelldetector.core.parser;

/**
 * Raised when a source unit cannot be read, decoded or parsed.
 *
 * <p>This is a per-unit failure: callers analysing many files record it against the one unit
 * and keep going.
 */
public class SourceParseException extends RuntimeException {

    private final String origin;

    public SourceParseException(String origin, String message, Throwable cause) {
        super(origin + ": " + message, cause);
        this.origin = origin;
    }

    public SourceParseException(String origin, String message) {
        super(origin + ": " + message);
        this.origin = origin;
    }

    /**
     * Label of the unit that failed (file path or {@code <string>}).
     *
     * @return origin label
     */
    public String getOrigin() {
        return origin;
    }
}
