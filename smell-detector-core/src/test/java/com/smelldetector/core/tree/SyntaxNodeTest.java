package com.smelldetector.core.tree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SyntaxNode}, {@link NodeKind} and {@link Position}.
 */
class SyntaxNodeTest {

    @Test
    void of_derivesKindFromType() {
        SyntaxNode node = SyntaxNode.of("if_statement", new Position(3, 4), new Position(5, 0), List.of());

        assertThat(node.kind()).isEqualTo(NodeKind.IF_STATEMENT);
        assertThat(node.is(NodeKind.IF_STATEMENT)).isTrue();
        assertThat(node.text()).isEmpty();
    }

    @Test
    void of_unknownType_mapsToOtherAndKeepsTag() {
        SyntaxNode node = SyntaxNode.of("lambda", new Position(1, 0), new Position(1, 10), List.of());

        assertThat(node.kind()).isEqualTo(NodeKind.OTHER);
        assertThat(node.type()).isEqualTo("lambda");
    }

    @Test
    void leaf_carriesText() {
        SyntaxNode leaf = SyntaxNode.leaf("identifier", new Position(1, 4), new Position(1, 9), "greet");

        assertThat(leaf.isLeaf()).isTrue();
        assertThat(leaf.text()).isEqualTo("greet");
        assertThat(leaf.kind()).isEqualTo(NodeKind.IDENTIFIER);
    }

    @Test
    void constructor_endBeforeStart_throwsException() {
        assertThatThrownBy(() -> SyntaxNode.of("block", new Position(5, 0), new Position(4, 0), List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("precedes");
    }

    @Test
    void constructor_copiesChildren() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(SyntaxNodes.identifier("a"));
        SyntaxNode node = SyntaxNode.of("block", new Position(1, 0), new Position(1, 0), children);

        children.add(SyntaxNodes.identifier("b"));

        assertThat(node.children()).hasSize(1);
    }

    @Test
    void nodeKind_controlStructures() {
        assertThat(NodeKind.IF_STATEMENT.isControlStructure()).isTrue();
        assertThat(NodeKind.FOR_STATEMENT.isControlStructure()).isTrue();
        assertThat(NodeKind.WHILE_STATEMENT.isControlStructure()).isTrue();
        assertThat(NodeKind.WITH_STATEMENT.isControlStructure()).isTrue();
        assertThat(NodeKind.TRY_STATEMENT.isControlStructure()).isTrue();
        assertThat(NodeKind.FUNCTION_DEFINITION.isControlStructure()).isFalse();
        assertThat(NodeKind.OTHER.isControlStructure()).isFalse();
    }

    @Test
    void nodeKind_fromType_handlesNullAndUnknown() {
        assertThat(NodeKind.fromType(null)).isEqualTo(NodeKind.OTHER);
        assertThat(NodeKind.fromType("")).isEqualTo(NodeKind.OTHER);
        assertThat(NodeKind.fromType("elif_clause")).isEqualTo(NodeKind.OTHER);
        assertThat(NodeKind.fromType("ERROR")).isEqualTo(NodeKind.ERROR);
    }

    @Test
    void position_fromZeroBasedRow_shiftsLine() {
        assertThat(Position.fromZeroBasedRow(0, 7)).isEqualTo(new Position(1, 7));
    }

    @Test
    void position_rejectsInvalidCoordinates() {
        assertThatThrownBy(() -> new Position(0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Position(1, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void syntaxTree_hasErrors_findsNestedErrorNode() {
        SyntaxNode clean = SyntaxNodes.module(SyntaxNodes.function("f"));
        SyntaxNode broken = SyntaxNodes.module(SyntaxNodes.function("f", SyntaxNodes.error(SyntaxNodes.identifier("x"))));

        assertThat(new SyntaxTree(clean, "", SyntaxTree.STRING_ORIGIN).hasErrors()).isFalse();
        assertThat(new SyntaxTree(broken, "", SyntaxTree.STRING_ORIGIN).hasErrors()).isTrue();
    }

    @Test
    void syntaxTree_hasErrors_reportsParserRecoveryWithoutErrorNode() {
        SyntaxNode clean = SyntaxNodes.module(SyntaxNodes.function("f"));

        assertThat(new SyntaxTree(clean, "", SyntaxTree.STRING_ORIGIN, true).hasErrors()).isTrue();
    }
}
