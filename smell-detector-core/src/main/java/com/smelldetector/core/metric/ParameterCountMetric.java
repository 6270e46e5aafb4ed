package com.smelldetector.core.metric;

import com.smelldetector.core.query.TreeQueries;
import com.smelldetector.core.tree.NodeKind;
import com.smelldetector.core.tree.SyntaxNode;

import java.util.EnumSet;
import java.util.Set;

/**
 * Number of ordinary parameters a function declares.
 *
 * <p>Counts the children of the parameter list that are plain identifiers, type-annotated
 * parameters or defaulted parameters. Everything else the grammar puts in the list
 * ({@code *args}, {@code **kwargs}, bare {@code *} and {@code /} markers, annotated defaults)
 * has a different tag and is not counted. A receiver such as {@code self} is a plain identifier
 * and therefore counts.
 *
 * <p>A definition without a parameter list has 0 parameters.
 */
public class ParameterCountMetric implements StructuralMetric {

    public static final String ID = "param_count";

    private static final Set<NodeKind> COUNTED = EnumSet.of(
        NodeKind.IDENTIFIER,
        NodeKind.TYPED_PARAMETER,
        NodeKind.DEFAULT_PARAMETER
    );

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public int measure(SyntaxNode definition) {
        return TreeQueries.firstChild(definition, NodeKind.PARAMETERS)
            .map(parameters -> (int) parameters.children().stream()
                .filter(child -> COUNTED.contains(child.kind()))
                .count())
            .orElse(0);
    }
}
