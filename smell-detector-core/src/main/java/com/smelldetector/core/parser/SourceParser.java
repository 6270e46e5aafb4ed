package com.smelldetector.core.parser;

import com.smelldetector.core.tree.SyntaxTree;

import java.nio.file.Path;
import java.util.Set;

/**
 * Seam over the external parsing library.
 *
 * <p>A parser turns source text into a {@link SyntaxTree}. The analysis core never tokenizes or
 * parses itself; it only consumes what an implementation of this interface produces.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * SourceParser parser = SourceParsers.forFile(Paths.get("service.py")).orElseThrow();
 * SyntaxTree tree = parser.parseFile(Paths.get("service.py"));
 * List<Finding> findings = analyzer.analyze(tree);
 * }</pre>
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; register them in
 * {@code META-INF/services/com.smelldetector.core.parser.SourceParser}.
 *
 * @see SourceParsers
 * @since 1.0.0
 */
public interface SourceParser {

    /**
     * Reads and parses a source file.
     *
     * @param filePath path to the source file
     * @return parsed tree
     * @throws SourceParseException if the file cannot be read or decoded
     */
    SyntaxTree parseFile(Path filePath);

    /**
     * Parses source text held in memory.
     *
     * @param sourceCode source text
     * @return parsed tree with origin {@link SyntaxTree#STRING_ORIGIN}
     * @throws SourceParseException if the parser cannot produce a tree
     */
    SyntaxTree parseString(String sourceCode);

    /**
     * Checks if the underlying parsing library can be used in this runtime.
     *
     * @return true if parser is available, false otherwise
     */
    boolean isAvailable();

    /**
     * Gets the language this parser supports.
     *
     * @return language identifier (e.g., "python")
     */
    String getLanguage();

    /**
     * File extensions (without the dot) handled by this parser.
     *
     * @return lower-case extensions
     */
    Set<String> getFileExtensions();
}
