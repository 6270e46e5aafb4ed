package com.smelldetector.core.parser.impl;

import com.smelldetector.core.parser.SourceParseException;
import com.smelldetector.core.parser.SourceParser;
import com.smelldetector.core.tree.Position;
import com.smelldetector.core.tree.SyntaxNode;
import com.smelldetector.core.tree.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Python parser backed by tree-sitter.
 *
 * <p>Each call creates its own {@link TSParser}: tree-sitter parsers are not thread-safe, and a
 * parser per call lets callers analyse many files concurrently through one instance of this class.
 * The native tree is copied eagerly into immutable {@link SyntaxNode}s so no native handle
 * outlives the call.
 *
 * <p>Tree-sitter recovers from syntax errors by inserting {@code ERROR} nodes. Such trees are
 * returned as-is; the query layer never reports an {@code ERROR} node as a definition.
 *
 * @since 1.0.0
 */
public class TreeSitterPythonParser implements SourceParser {

    private static final Logger log = LoggerFactory.getLogger(TreeSitterPythonParser.class);

    private static final String LANGUAGE = "python";
    private static final Set<String> EXTENSIONS = Set.of("py", "pyi");

    @Override
    public SyntaxTree parseFile(Path filePath) {
        String origin = filePath.toString();
        String source;
        try {
            source = Files.readString(filePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceParseException(origin, "cannot read source (" + e.getClass().getSimpleName()
                + (e.getMessage() != null ? ": " + e.getMessage() : "") + ")", e);
        }
        return parse(source, origin);
    }

    @Override
    public SyntaxTree parseString(String sourceCode) {
        return parse(sourceCode, SyntaxTree.STRING_ORIGIN);
    }

    @Override
    public boolean isAvailable() {
        try {
            TSParser parser = new TSParser();
            return parser.setLanguage(new TreeSitterPython());
        } catch (LinkageError e) {
            log.warn("tree-sitter native library not available: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getLanguage() {
        return LANGUAGE;
    }

    @Override
    public Set<String> getFileExtensions() {
        return EXTENSIONS;
    }

    private SyntaxTree parse(String source, String origin) {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            throw new SourceParseException(origin, "tree-sitter rejected the Python grammar");
        }

        TSTree tree = parser.parseString(null, source);
        if (tree == null) {
            throw new SourceParseException(origin, "tree-sitter returned no tree");
        }
        TSNode rootNode = tree.getRootNode();
        if (rootNode.isNull()) {
            throw new SourceParseException(origin, "tree-sitter returned an empty root node");
        }

        byte[] sourceBytes = source.getBytes(StandardCharsets.UTF_8);
        boolean recovered = rootNode.hasError();
        if (recovered) {
            log.debug("{} contains syntax errors; analysing the recovered tree", origin);
        }
        return new SyntaxTree(convert(rootNode, sourceBytes), source, origin, recovered);
    }

    /**
     * Copies the native tree bottom-up with an explicit stack, so nesting depth is bounded by
     * heap rather than by the thread's call stack.
     */
    private SyntaxNode convert(TSNode rootNode, byte[] sourceBytes) {
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(rootNode));
        SyntaxNode converted = null;

        while (!pending.isEmpty()) {
            Frame frame = pending.peek();
            if (frame.nextChild < frame.childCount) {
                TSNode child = frame.node.getChild(frame.nextChild++);
                if (child != null && !child.isNull()) {
                    pending.push(new Frame(child));
                }
                continue;
            }

            pending.pop();
            converted = toSyntaxNode(frame, sourceBytes);
            Frame parent = pending.peek();
            if (parent != null) {
                parent.children.add(converted);
            }
        }
        return converted;
    }

    private static SyntaxNode toSyntaxNode(Frame frame, byte[] sourceBytes) {
        TSNode node = frame.node;
        String text = frame.children.isEmpty() ? slice(sourceBytes, node.getStartByte(), node.getEndByte()) : "";
        return new SyntaxNode(
            node.getType(),
            null,
            toPosition(node.getStartPoint()),
            toPosition(node.getEndPoint()),
            text,
            frame.children
        );
    }

    private static Position toPosition(TSPoint point) {
        return Position.fromZeroBasedRow(point.getRow(), point.getColumn());
    }

    private static String slice(byte[] sourceBytes, int startByte, int endByte) {
        if (startByte < 0 || endByte <= startByte || startByte >= sourceBytes.length) {
            return "";
        }
        int end = Math.min(endByte, sourceBytes.length);
        return new String(sourceBytes, startByte, end - startByte, StandardCharsets.UTF_8);
    }

    private static final class Frame {
        private final TSNode node;
        private final int childCount;
        private final List<SyntaxNode> children;
        private int nextChild;

        private Frame(TSNode node) {
            this.node = node;
            this.childCount = node.getChildCount();
            this.children = new ArrayList<>(childCount);
        }
    }
}
