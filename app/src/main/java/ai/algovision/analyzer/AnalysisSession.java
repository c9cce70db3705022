package ai.algovision.analyzer;

import ai.algovision.analyzer.cfg.CfgBuilder;
import ai.algovision.ir.CallEdge;
import ai.algovision.ir.CallKind;
import ai.algovision.ir.Cfg;
import ai.algovision.ir.ClassInfo;
import ai.algovision.ir.Diagnostic;
import ai.algovision.ir.ImportEntry;
import ai.algovision.ir.IrBuilder;
import ai.algovision.ir.IrRange;
import ai.algovision.ir.OutlineKind;
import ai.algovision.ir.OutlineNode;
import ai.algovision.ir.Visibility;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Per-analysis state shared by the language visitors: the IR builder, the node budget, the side table from syntax
 * node index to outline node, the class accumulator and the diagnostics collected so far.
 */
public final class AnalysisSession {
    private static final Logger logger = LogManager.getLogger(AnalysisSession.class);

    /** Outline node plus {@code start} and {@code end}. */
    public static final int CALLABLE_RESERVATION = 3;

    private static final Pattern GENERIC_ARGUMENTS = Pattern.compile("<[^<>]*>");
    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    private final AnalysisContext context;
    private final SyntaxTree tree;
    private final IrBuilder builder = new IrBuilder();
    private final NodeBudget budget;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<Integer, OutlineNode> outlineBySyntaxNode = new HashMap<>();
    private final Map<String, OutlineNode> outlineById = new HashMap<>();
    private final Map<String, ClassEntry> classes = new LinkedHashMap<>();
    private final OutlineNode module;

    private static final class ClassEntry {
        private final OutlineNode node;
        private final List<String> bases;
        private final List<String> methods = new ArrayList<>();

        private ClassEntry(OutlineNode node, List<String> bases) {
            this.node = node;
            this.bases = bases;
        }
    }

    public AnalysisSession(AnalysisContext context) {
        this.context = context;
        this.tree = context.tree();
        this.budget = new NodeBudget(context.options().effectiveMaxNodes());
        budget.tryReserve(1);
        var moduleName = context.docId().isBlank() ? "module" : context.docId();
        this.module = builder.addOutlineNode(OutlineKind.MODULE, moduleName, null, IrRange.wholeText(context.text()));
        outlineBySyntaxNode.put(tree.root(), module);
        outlineById.put(module.id(), module);
    }

    public SyntaxTree tree() {
        return tree;
    }

    public AnalysisContext context() {
        return context;
    }

    public NodeBudget budget() {
        return budget;
    }

    public OutlineNode module() {
        return module;
    }

    public boolean isCancelled() {
        return context.cancellation().isCancelled();
    }

    /**
     * Emits an outline node for the declaration at {@code syntaxNode} if {@code reservation} nodes still fit.
     *
     * @return the new node, or null when the budget is capped (the declaration is then counted as skipped)
     */
    public @Nullable OutlineNode declare(
            int syntaxNode,
            OutlineKind kind,
            String name,
            OutlineNode parent,
            @Nullable List<String> params,
            @Nullable Visibility visibility,
            @Nullable List<String> genericParams) {
        int reservation = kind.isCallable() ? CALLABLE_RESERVATION : 1;
        if (!budget.tryReserve(reservation)) {
            budget.skip(1);
            logger.trace("Skipping {} {} at line {}: node cap reached", kind.wireName(), name, tree.startLine(syntaxNode));
            return null;
        }
        var node = builder.addOutlineNode(
                kind, name, parent.id(), tree.range(syntaxNode), params, visibility, genericParams);
        outlineBySyntaxNode.put(syntaxNode, node);
        outlineById.put(node.id(), node);
        return node;
    }

    public @Nullable OutlineNode outlineOf(int syntaxNode) {
        return outlineBySyntaxNode.get(syntaxNode);
    }

    /** Nearest strict ancestor of {@code syntaxNode} that produced an outline node; the module at worst. */
    public OutlineNode enclosingDeclaration(int syntaxNode) {
        int current = tree.parent(syntaxNode);
        while (current != SyntaxTree.NO_NODE) {
            var node = outlineBySyntaxNode.get(current);
            if (node != null) {
                return node;
            }
            current = tree.parent(current);
        }
        return module;
    }

    public @Nullable OutlineNode enclosingCallable(int syntaxNode) {
        int current = tree.parent(syntaxNode);
        while (current != SyntaxTree.NO_NODE) {
            var node = outlineBySyntaxNode.get(current);
            if (node != null && node.kind().isCallable()) {
                return node;
            }
            current = tree.parent(current);
        }
        return null;
    }

    public void registerClass(OutlineNode classNode, List<String> bases) {
        classes.put(classNode.id(), new ClassEntry(classNode, List.copyOf(bases)));
    }

    /** Records {@code method} as a member when {@code owner} is a registered class; otherwise a no-op. */
    public void addMember(OutlineNode owner, OutlineNode method) {
        var entry = classes.get(owner.id());
        if (entry != null) {
            entry.methods.add(method.id());
        }
    }

    public CfgBuilder newCfg(OutlineNode callable) {
        return new CfgBuilder(callable.id(), budget);
    }

    public void addCfg(Cfg cfg) {
        builder.addCfg(cfg);
    }

    public void addImport(String name, @Nullable String alias) {
        var trimmed = name.strip();
        if (trimmed.isEmpty()) {
            return;
        }
        builder.addImport(
                alias == null || alias.isBlank() ? ImportEntry.of(trimmed) : ImportEntry.aliased(trimmed, alias.strip()));
    }

    /**
     * Records a call from the enclosing function or method. Calls at module or class level, and callees that do not
     * end in an identifier, are dropped.
     */
    public void addCall(int callNode, String calleeExpression) {
        var caller = enclosingCallable(callNode);
        if (caller == null) {
            return;
        }
        var expression = stripGenericArguments(calleeExpression.strip());
        int dot = expression.lastIndexOf('.');
        var lastSegment = (dot >= 0 ? expression.substring(dot + 1) : expression).strip();
        if (!IDENTIFIER.matcher(lastSegment).matches()) {
            logger.trace("Dropping call with non-identifier callee '{}'", calleeExpression);
            return;
        }
        var kind = expression.indexOf('.') >= 0 ? CallKind.MEMBER : CallKind.DIRECT;
        builder.addCall(new CallEdge(caller.id(), lastSegment, kind));
    }

    static String stripGenericArguments(String expression) {
        var current = expression;
        while (true) {
            var stripped = GENERIC_ARGUMENTS.matcher(current).replaceAll("");
            if (stripped.equals(current)) {
                return stripped;
            }
            current = stripped;
        }
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /** Reports every node of the given types as an unsupported construct. */
    public void reportUnsupported(Set<String> types) {
        for (int node : tree.descendantsOfType(tree.root(), types)) {
            report(Diagnostic.unsupported(tree.type(node), tree.range(node)));
        }
    }

    public AnalysisResult finish() {
        if (context.options().classDiagramEnabled()) {
            for (var entry : classes.values()) {
                builder.addClass(new ClassInfo(entry.node.id(), entry.node.name(), entry.methods, entry.bases));
            }
        }
        var result = new ArrayList<>(diagnostics);
        if (budget.isCapped()) {
            result.add(budget.toDiagnostic());
        }
        var ir = builder.build();
        logger.debug(
                "Built IR for {}: {} outline nodes, {} cfgs, {} calls, {} diagnostics",
                context.docId(),
                ir.outline().size(),
                ir.cfgs().size(),
                ir.calls().size(),
                result.size());
        return new AnalysisResult(ir, result);
    }
}
