package ai.algovision.treesitter;

import ai.algovision.analyzer.Language;
import ai.algovision.analyzer.SyntaxTree;
import ai.algovision.ir.IrRange;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterCSharp;
import org.treesitter.TreeSitterPython;

/**
 * Adapter over the tree-sitter binding. Grammars are loaded once and shared; parsers are not thread-safe, so each
 * worker thread keeps its own parser per language.
 */
public final class ParserRuntime {
    private static final Logger logger = LogManager.getLogger(ParserRuntime.class);

    static final String ERROR_NODE_TYPE = "ERROR";

    private final Map<Language, TSLanguage> grammars = new ConcurrentHashMap<>();
    private final ThreadLocal<Map<Language, TSParser>> parsers =
            ThreadLocal.withInitial(() -> new EnumMap<>(Language.class));

    /**
     * Loads every grammar and primes a parser for each on the calling thread.
     *
     * @return elapsed milliseconds
     */
    public long warmUp() {
        long start = System.nanoTime();
        for (var language : Language.values()) {
            parser(language);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        logger.info("Loaded {} tree-sitter grammars in {} ms", Language.values().length, elapsedMs);
        return elapsedMs;
    }

    /**
     * Parses {@code text}, reusing {@code previous} for incremental re-parse when it has been edited in step with the
     * text.
     *
     * @throws ParseFailedException when the parser yields no tree
     */
    public TSTree parse(Language language, String text, @Nullable TSTree previous) {
        TSTree tree;
        try {
            tree = parser(language).parseString(previous, text);
        } catch (RuntimeException e) {
            throw new ParseFailedException(language, "Parser failed for " + language.displayName(), e);
        }
        if (tree == null || tree.getRootNode().isNull()) {
            throw new ParseFailedException(language, "Parser returned no tree for " + language.displayName());
        }
        return tree;
    }

    private TSParser parser(Language language) {
        return parsers.get().computeIfAbsent(language, lang -> {
            var parser = new TSParser();
            if (!parser.setLanguage(grammar(lang))) {
                logger.error("Failed to set language on TSParser for {}", lang.displayName());
            }
            return parser;
        });
    }

    TSLanguage grammar(Language language) {
        return grammars.computeIfAbsent(language, ParserRuntime::createGrammar);
    }

    private static TSLanguage createGrammar(Language language) {
        return switch (language) {
            case PYTHON -> new TreeSitterPython();
            case CSHARP -> new TreeSitterCSharp();
        };
    }

    /**
     * Copies the named nodes of {@code tree} into an index-addressed {@link SyntaxTree} and records the first
     * {@code ERROR} or missing node.
     */
    public static SyntaxTree toSyntaxTree(TSTree tree, String text) {
        var builder = SyntaxTree.builder(text);
        var root = tree.getRootNode();
        int rootIndex = open(builder, root, SyntaxTree.NO_NODE, null);
        copyChildren(builder, root, rootIndex);
        builder.close(rootIndex);
        return builder.build();
    }

    private static void copyChildren(SyntaxTree.Builder builder, TSNode node, int parentIndex) {
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            var child = node.getChild(i);
            if (child.isNull()) {
                continue;
            }
            if (child.isMissing() || ERROR_NODE_TYPE.equals(child.getType())) {
                markError(builder, child);
            }
            if (child.isNamed()) {
                int index = open(builder, child, parentIndex, node.getFieldNameForChild(i));
                copyChildren(builder, child, index);
                builder.close(index);
            } else if (child.getChildCount() > 0) {
                // anonymous wrappers: lift their named children to the nearest named ancestor
                copyChildren(builder, child, parentIndex);
            }
        }
    }

    private static int open(SyntaxTree.Builder builder, TSNode node, int parent, @Nullable String fieldName) {
        var start = node.getStartPoint();
        var end = node.getEndPoint();
        return builder.open(
                parent,
                node.getType(),
                fieldName,
                node.getStartByte(),
                node.getEndByte(),
                start.getRow(),
                start.getColumn(),
                end.getRow(),
                end.getColumn());
    }

    private static void markError(SyntaxTree.Builder builder, TSNode node) {
        var start = node.getStartPoint();
        var end = node.getEndPoint();
        var from = builder.position(node.getStartByte(), start.getRow(), start.getColumn());
        var to = builder.position(node.getEndByte(), end.getRow(), end.getColumn());
        builder.markError(IrRange.of(from.line(), from.column(), to.line(), to.column()));
    }
}
