package com.smelldetector.core.model;

import com.smelldetector.core.tree.Position;

/**
 * Where a finding starts.
 *
 * @param line 1-based line of the definition's first line
 * @param column 0-based column of the definition's first character
 */
public record Location(int line, int column) {

    public static Location of(Position position) {
        return new Location(position.line(), position.column());
    }

    public String toDisplayString() {
        return "Line " + line + ", Column " + column;
    }
}
