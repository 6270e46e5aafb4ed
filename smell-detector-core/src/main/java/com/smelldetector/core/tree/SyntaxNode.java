package com.smelldetector.core.tree;

import java.util.List;
import java.util.Objects;

/**
 * Immutable node of a parsed syntax tree.
 *
 * <p>Produced once per analyzed unit by a {@link com.smelldetector.core.parser.SourceParser}
 * and never mutated afterwards. Sibling order in {@link #children()} matches source order.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * SyntaxNode name = SyntaxNode.leaf("identifier", new Position(1, 4), new Position(1, 9), "greet");
 * SyntaxNode def = SyntaxNode.of("function_definition", new Position(1, 0), new Position(2, 12),
 *     List.of(name, parameters, body));
 * }</pre>
 *
 * @param type parser tag (e.g. "function_definition", "if_statement")
 * @param kind analysis kind derived from {@code type}
 * @param start start position
 * @param end end position (inclusive line)
 * @param text source text for leaf nodes, empty for interior nodes
 * @param children ordered child nodes
 */
public record SyntaxNode(
    String type,
    NodeKind kind,
    Position start,
    Position end,
    String text,
    List<SyntaxNode> children
) {
    public SyntaxNode {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.line() < start.line()) {
            throw new IllegalArgumentException(
                "end line " + end.line() + " precedes start line " + start.line());
        }
        kind = kind != null ? kind : NodeKind.fromType(type);
        text = text != null ? text : "";
        children = children != null ? List.copyOf(children) : List.of();
    }

    /**
     * Creates an interior node.
     *
     * @param type parser tag
     * @param start start position
     * @param end end position
     * @param children ordered children
     * @return new node
     */
    public static SyntaxNode of(String type, Position start, Position end, List<SyntaxNode> children) {
        return new SyntaxNode(type, NodeKind.fromType(type), start, end, "", children);
    }

    /**
     * Creates a leaf node carrying its source text.
     *
     * @param type parser tag
     * @param start start position
     * @param end end position
     * @param text source text
     * @return new node
     */
    public static SyntaxNode leaf(String type, Position start, Position end, String text) {
        return new SyntaxNode(type, NodeKind.fromType(type), start, end, text, List.of());
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
