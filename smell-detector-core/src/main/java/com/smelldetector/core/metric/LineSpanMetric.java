package com.smelldetector.core.metric;

import com.smelldetector.core.tree.SyntaxNode;

/**
 * Number of source lines a definition covers, first and last line included.
 *
 * <p>Purely positional: blank lines, comments and docstrings inside the range are counted.
 * Always at least 1.
 */
public class LineSpanMetric implements StructuralMetric {

    public static final String ID = "line_count";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public int measure(SyntaxNode definition) {
        return definition.end().line() - definition.start().line() + 1;
    }
}
