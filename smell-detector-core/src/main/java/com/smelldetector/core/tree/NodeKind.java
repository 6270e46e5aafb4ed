package com.smelldetector.core.tree;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Syntactic kinds the analysis distinguishes.
 *
 * <p>The parser's own tag set is open-ended; every tag the analysis does not care about maps
 * to {@link #OTHER}. The original tag is kept on {@link SyntaxNode#type()}.
 *
 * @since 1.0.0
 */
public enum NodeKind {
    MODULE("module"),
    FUNCTION_DEFINITION("function_definition"),
    CLASS_DEFINITION("class_definition"),
    DECORATED_DEFINITION("decorated_definition"),
    BLOCK("block"),
    IDENTIFIER("identifier"),
    PARAMETERS("parameters"),
    TYPED_PARAMETER("typed_parameter"),
    DEFAULT_PARAMETER("default_parameter"),
    TYPED_DEFAULT_PARAMETER("typed_default_parameter"),
    LIST_SPLAT_PATTERN("list_splat_pattern"),
    DICTIONARY_SPLAT_PATTERN("dictionary_splat_pattern"),
    IF_STATEMENT("if_statement"),
    FOR_STATEMENT("for_statement"),
    WHILE_STATEMENT("while_statement"),
    WITH_STATEMENT("with_statement"),
    TRY_STATEMENT("try_statement"),
    ERROR("ERROR"),
    OTHER("");

    private static final Map<String, NodeKind> BY_TYPE = Stream.of(values())
        .filter(kind -> kind != OTHER)
        .collect(Collectors.toUnmodifiableMap(NodeKind::type, Function.identity()));

    private final String type;

    NodeKind(String type) {
        this.type = type;
    }

    /**
     * Returns the parser tag this kind corresponds to.
     *
     * @return tree-sitter node type, empty for {@link #OTHER}
     */
    public String type() {
        return type;
    }

    /**
     * Whether this kind opens a new level of control-flow nesting.
     *
     * @return true for if/for/while/with/try statements
     */
    public boolean isControlStructure() {
        return switch (this) {
            case IF_STATEMENT, FOR_STATEMENT, WHILE_STATEMENT, WITH_STATEMENT, TRY_STATEMENT -> true;
            default -> false;
        };
    }

    /**
     * Whether this kind declares a function or class scope.
     *
     * @return true for function and class definitions
     */
    public boolean isDefinition() {
        return this == FUNCTION_DEFINITION || this == CLASS_DEFINITION;
    }

    /**
     * Maps a parser tag to its kind.
     *
     * @param type parser node type (may be null)
     * @return matching kind, or {@link #OTHER} when the tag is not one the analysis uses
     */
    public static NodeKind fromType(String type) {
        if (type == null) {
            return OTHER;
        }
        return BY_TYPE.getOrDefault(type, OTHER);
    }
}
