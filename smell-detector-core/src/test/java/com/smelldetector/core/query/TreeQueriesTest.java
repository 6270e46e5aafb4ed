package com.smelldetector.core.query;

import com.smelldetector.core.tree.NodeKind;
import com.smelldetector.core.tree.Position;
import com.smelldetector.core.tree.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.smelldetector.core.tree.SyntaxNodes.anonymousFunction;
import static com.smelldetector.core.tree.SyntaxNodes.classDef;
import static com.smelldetector.core.tree.SyntaxNodes.control;
import static com.smelldetector.core.tree.SyntaxNodes.error;
import static com.smelldetector.core.tree.SyntaxNodes.function;
import static com.smelldetector.core.tree.SyntaxNodes.module;
import static com.smelldetector.core.tree.SyntaxNodes.statement;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TreeQueries}.
 */
class TreeQueriesTest {

    @Test
    void findFunctions_returnsAllFunctionsInSourceOrder() {
        SyntaxNode root = module(
            function("first"),
            classDef("Service",
                function("method_a", function("inner")),
                function("method_b")),
            control("if_statement", function("conditional")),
            function("last")
        );

        List<String> names = TreeQueries.findFunctions(root).stream().map(TreeQueries::nameOf).toList();

        assertThat(names).containsExactly("first", "method_a", "inner", "method_b", "conditional", "last");
    }

    @Test
    void findDefinitions_includesRootItself() {
        SyntaxNode fn = function("solo");

        assertThat(TreeQueries.findFunctions(fn)).containsExactly(fn);
    }

    @Test
    void findDefinitions_noDefinitions_returnsEmpty() {
        assertThat(TreeQueries.findFunctions(module())).isEmpty();
        assertThat(TreeQueries.findClasses(module(statement()))).isEmpty();
    }

    @Test
    void findClasses_findsNestedClasses() {
        SyntaxNode root = module(classDef("Outer", classDef("Inner")), function("f", classDef("Local")));

        List<String> names = TreeQueries.findClasses(root).stream().map(TreeQueries::classNameOf).toList();

        assertThat(names).containsExactly("Outer", "Inner", "Local");
    }

    @Test
    void findDefinitions_descendsIntoErrorNodesButNeverReturnsThem() {
        SyntaxNode root = module(error(function("recovered")), function("ok"));

        assertThat(TreeQueries.findFunctions(root)).hasSize(2);
        assertThat(TreeQueries.findDefinitions(root, NodeKind.ERROR)).isEmpty();
    }

    @Test
    void findDefinitions_deepTree_doesNotOverflowStack() {
        SyntaxNode node = function("bottom");
        for (int i = 0; i < 20_000; i++) {
            node = control("if_statement", node);
        }

        assertThat(TreeQueries.findFunctions(module(node))).hasSize(1);
    }

    @Test
    void nameOf_returnsFirstIdentifierChild() {
        assertThat(TreeQueries.nameOf(function("process_order"))).isEqualTo("process_order");
    }

    @Test
    void nameOf_withoutIdentifier_returnsUnknown() {
        assertThat(TreeQueries.nameOf(anonymousFunction())).isEqualTo(TreeQueries.UNKNOWN_NAME);
        assertThat(TreeQueries.nameOf(anonymousFunction(), "<lambda>")).isEqualTo("<lambda>");
    }

    @Test
    void classNameOf_withoutIdentifier_returnsUnknownClass() {
        SyntaxNode nameless = SyntaxNode.of("class_definition", new Position(1, 0), new Position(1, 0), List.of());

        assertThat(TreeQueries.classNameOf(nameless)).isEqualTo("UnknownClass");
    }

    @Test
    void methodsOf_returnsOnlyDirectBodyFunctions() {
        SyntaxNode cls = classDef("Repository",
            function("save", function("helper")),
            statement(),
            function("load"),
            control("if_statement", function("conditional_method"))
        );

        List<String> methods = TreeQueries.methodsOf(cls).stream().map(TreeQueries::nameOf).toList();

        assertThat(methods).containsExactly("save", "load");
    }

    @Test
    void methodsOf_emptyClass_returnsEmpty() {
        assertThat(TreeQueries.methodsOf(classDef("Empty"))).isEmpty();
    }

    @Test
    void firstChild_missingKind_returnsEmpty() {
        assertThat(TreeQueries.firstChild(function("f"), NodeKind.PARAMETERS)).isPresent();
        assertThat(TreeQueries.firstChild(function("f"), NodeKind.TRY_STATEMENT)).isEmpty();
    }
}
