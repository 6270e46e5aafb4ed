package com.smelldetector.core.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Result of parsing one source unit.
 *
 * @param root root node of the tree
 * @param source decoded source text the tree was built from
 * @param origin label of the unit (file path or {@code <string>})
 * @param recovered whether the parser reported syntax errors it recovered from, including
 *     zero-width missing tokens that leave no {@link NodeKind#ERROR} node behind
 */
public record SyntaxTree(SyntaxNode root, String source, String origin, boolean recovered) {

    public static final String STRING_ORIGIN = "<string>";

    public SyntaxTree {
        Objects.requireNonNull(root, "root must not be null");
        source = source != null ? source : "";
        origin = origin != null ? origin : STRING_ORIGIN;
    }

    public SyntaxTree(SyntaxNode root, String source, String origin) {
        this(root, source, origin, false);
    }

    /**
     * Whether the parser had to recover from syntax errors anywhere in the tree.
     *
     * @return true if the parser flagged the tree or at least one {@link NodeKind#ERROR} node exists
     */
    public boolean hasErrors() {
        if (recovered) {
            return true;
        }
        Deque<SyntaxNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            SyntaxNode node = pending.pop();
            if (node.is(NodeKind.ERROR)) {
                return true;
            }
            node.children().forEach(pending::push);
        }
        return false;
    }
}
