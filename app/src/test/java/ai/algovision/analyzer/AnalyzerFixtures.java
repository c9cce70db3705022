package ai.algovision.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.algovision.ir.Cfg;
import ai.algovision.ir.CfgEdge;
import ai.algovision.ir.CfgNode;
import ai.algovision.ir.IrDocument;
import ai.algovision.ir.IrInvariants;
import ai.algovision.ir.OutlineNode;
import ai.algovision.treesitter.ParserRuntime;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/** Parses real source through tree-sitter and offers lookups over the resulting IR. */
public final class AnalyzerFixtures {
    private static final ParserRuntime RUNTIME = new ParserRuntime();

    private AnalyzerFixtures() {}

    public static SyntaxTree parse(Language language, String source) {
        return ParserRuntime.toSyntaxTree(RUNTIME.parse(language, source, null), source);
    }

    public static AnalysisResult analyze(LanguageAnalyzer analyzer, String source) {
        return analyze(analyzer, source, AnalyzeOptions.defaults());
    }

    /** Analyzes {@code source} as document {@code doc} and asserts the IR is well formed. */
    public static AnalysisResult analyze(LanguageAnalyzer analyzer, String source, AnalyzeOptions options) {
        var tree = parse(analyzer.language(), source);
        var result = analyzer.analyze(
                new AnalysisContext(tree, "doc", analyzer.language(), options, CancellationToken.none()));
        assertEquals(List.of(), IrInvariants.check(result.ir()), "IR invariants");
        return result;
    }

    public static OutlineNode outline(IrDocument ir, String name) {
        return ir.outline().stream()
                .filter(n -> n.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No outline node named " + name + " in " + ir.outline()));
    }

    public static Cfg cfgOf(IrDocument ir, String functionName) {
        var id = outline(ir, functionName).id();
        return ir.cfgs().stream()
                .filter(c -> c.funcId().equals(id))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No cfg for " + id));
    }

    /** The single node whose label is exactly {@code label}. */
    public static CfgNode node(Cfg cfg, String label) {
        var matches = cfg.nodes().stream().filter(n -> label.equals(labelOf(n))).toList();
        assertEquals(1, matches.size(), "nodes labelled '" + label + "' in " + cfg.nodes());
        return matches.get(0);
    }

    public static List<CfgEdge> edgesFrom(Cfg cfg, CfgNode from) {
        return cfg.edges().stream().filter(e -> e.from().equals(from.id())).toList();
    }

    public static boolean hasEdge(Cfg cfg, CfgNode from, CfgNode to, @Nullable String label) {
        return cfg.edges().stream()
                .anyMatch(e -> e.from().equals(from.id())
                        && e.to().equals(to.id())
                        && Objects.equals(e.label(), label));
    }

    public static CfgNode end(Cfg cfg) {
        return cfg.nodes().stream()
                .filter(n -> n instanceof CfgNode.End)
                .findFirst()
                .orElseThrow();
    }

    public static <T extends CfgNode> List<T> nodesOfType(Cfg cfg, Class<T> type) {
        return cfg.nodes().stream().filter(type::isInstance).map(type::cast).toList();
    }

    public static String labelOf(CfgNode node) {
        if (node instanceof CfgNode.Stmt stmt) {
            return stmt.label();
        }
        if (node instanceof CfgNode.Cond cond) {
            return cond.label();
        }
        if (node instanceof CfgNode.Switch sw) {
            return sw.label();
        }
        return node instanceof CfgNode.Start ? "start" : "end";
    }
}
