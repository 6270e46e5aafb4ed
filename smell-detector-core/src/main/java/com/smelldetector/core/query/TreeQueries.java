package com.smelldetector.core.query;

import com.smelldetector.core.tree.NodeKind;
import com.smelldetector.core.tree.SyntaxNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tree-walking primitives shared by metrics and detectors.
 *
 * <p>All methods are pure: they never modify the tree and never fail on structurally incomplete
 * nodes. Lookups that cannot be resolved return a fallback value instead of throwing.
 *
 * @since 1.0.0
 */
public final class TreeQueries {

    /** Name reported for definitions without an identifier child. */
    public static final String UNKNOWN_NAME = "unknown";

    /** Name reported for classes without an identifier child. */
    public static final String UNKNOWN_CLASS_NAME = "UnknownClass";

    private TreeQueries() {
        // Utility class
    }

    /**
     * Collects every node of the given kind below (and including) {@code root}.
     *
     * <p>Full pre-order traversal: every node is visited exactly once and results appear in source
     * order. {@link NodeKind#ERROR} nodes are traversed but never returned.
     *
     * @param root subtree root
     * @param kind kind to collect
     * @return matching nodes in traversal order
     */
    public static List<SyntaxNode> findDefinitions(SyntaxNode root, NodeKind kind) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == NodeKind.ERROR) {
            return List.of();
        }

        List<SyntaxNode> found = new ArrayList<>();
        Deque<SyntaxNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            SyntaxNode node = pending.pop();
            if (node.is(kind)) {
                found.add(node);
            }
            List<SyntaxNode> children = node.children();
            // push in reverse so the leftmost child is visited first
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return found;
    }

    public static List<SyntaxNode> findFunctions(SyntaxNode root) {
        return findDefinitions(root, NodeKind.FUNCTION_DEFINITION);
    }

    public static List<SyntaxNode> findClasses(SyntaxNode root) {
        return findDefinitions(root, NodeKind.CLASS_DEFINITION);
    }

    /**
     * Name of a definition: the text of its first identifier child.
     *
     * @param definition function or class definition node
     * @return identifier text, or {@value #UNKNOWN_NAME} if there is none
     */
    public static String nameOf(SyntaxNode definition) {
        return nameOf(definition, UNKNOWN_NAME);
    }

    /**
     * Name of a definition with a caller-chosen fallback.
     *
     * @param definition function or class definition node
     * @param fallback value returned when no identifier child exists
     * @return identifier text or {@code fallback}
     */
    public static String nameOf(SyntaxNode definition, String fallback) {
        return firstChild(definition, NodeKind.IDENTIFIER)
            .map(SyntaxNode::text)
            .filter(text -> !text.isEmpty())
            .orElse(fallback);
    }

    public static String classNameOf(SyntaxNode classDefinition) {
        return nameOf(classDefinition, UNKNOWN_CLASS_NAME);
    }

    /**
     * Methods declared directly in a class body.
     *
     * <p>Only function definitions that are immediate statements of the class block count;
     * helpers nested inside a method are not methods of the class.
     *
     * @param classDefinition class definition node
     * @return method nodes in source order
     */
    public static List<SyntaxNode> methodsOf(SyntaxNode classDefinition) {
        List<SyntaxNode> methods = new ArrayList<>();
        for (SyntaxNode child : classDefinition.children()) {
            if (child.is(NodeKind.BLOCK)) {
                for (SyntaxNode statement : child.children()) {
                    if (statement.is(NodeKind.FUNCTION_DEFINITION)) {
                        methods.add(statement);
                    }
                }
            }
        }
        return methods;
    }

    /**
     * First direct child of the given kind.
     *
     * @param node parent node
     * @param kind wanted kind
     * @return the child, if present
     */
    public static Optional<SyntaxNode> firstChild(SyntaxNode node, NodeKind kind) {
        for (SyntaxNode child : node.children()) {
            if (child.is(kind)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }
}
