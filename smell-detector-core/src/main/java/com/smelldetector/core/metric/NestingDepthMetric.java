package com.smelldetector.core.metric;

import com.smelldetector.core.tree.SyntaxNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Deepest nesting of control structures inside a definition.
 *
 * <p>The walk starts at depth 0 on the definition itself. Every if, for, while, with or try
 * statement raises the depth by one for its own subtree; siblings keep the depth of their parent.
 * The result is the highest depth seen anywhere below the definition. {@code elif}, {@code else},
 * {@code except} and {@code finally} clauses are children of their statement and add no level.
 *
 * <p>Uses an explicit work stack, so very deep trees cannot exhaust the call stack.
 */
public class NestingDepthMetric implements StructuralMetric {

    public static final String ID = "nesting_depth";

    private final NestedScopePolicy nestedScopes;

    public NestingDepthMetric() {
        this(NestedScopePolicy.ACCUMULATE);
    }

    public NestingDepthMetric(NestedScopePolicy nestedScopes) {
        this.nestedScopes = Objects.requireNonNull(nestedScopes, "nestedScopes must not be null");
    }

    @Override
    public String getId() {
        return ID;
    }

    public NestedScopePolicy getNestedScopes() {
        return nestedScopes;
    }

    @Override
    public int measure(SyntaxNode definition) {
        int maxDepth = 0;
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(definition, 0));

        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            maxDepth = Math.max(maxDepth, frame.depth());
            for (SyntaxNode child : frame.node().children()) {
                if (nestedScopes == NestedScopePolicy.ISOLATE && child.kind().isDefinition()) {
                    continue;
                }
                int childDepth = child.kind().isControlStructure() ? frame.depth() + 1 : frame.depth();
                pending.push(new Frame(child, childDepth));
            }
        }
        return maxDepth;
    }

    private record Frame(SyntaxNode node, int depth) {
    }
}
