package ai.algovision.analyzer.csharp;

import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_BODY;
import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_FUNCTION;
import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_NAME;
import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_PARAMETERS;
import static ai.algovision.analyzer.csharp.CSharpTreeSitterNodeTypes.*;

import ai.algovision.analyzer.AnalysisContext;
import ai.algovision.analyzer.AnalysisResult;
import ai.algovision.analyzer.AnalysisSession;
import ai.algovision.analyzer.Language;
import ai.algovision.analyzer.LanguageAnalyzer;
import ai.algovision.analyzer.SyntaxTree;
import ai.algovision.analyzer.cfg.CfgBuilder;
import ai.algovision.ir.OutlineKind;
import ai.algovision.ir.OutlineNode;
import ai.algovision.ir.Visibility;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Builds outline, CFGs, calls, classes and imports for C# sources. */
public final class CSharpAnalyzer implements LanguageAnalyzer {
    private static final Logger logger = LogManager.getLogger(CSharpAnalyzer.class);

    private static final Map<String, OutlineKind> DECLARATION_KINDS = Map.ofEntries(
            Map.entry(NAMESPACE_DECLARATION, OutlineKind.NAMESPACE),
            Map.entry(FILE_SCOPED_NAMESPACE_DECLARATION, OutlineKind.NAMESPACE),
            Map.entry(CLASS_DECLARATION, OutlineKind.CLASS),
            Map.entry(INTERFACE_DECLARATION, OutlineKind.CLASS),
            Map.entry(RECORD_DECLARATION, OutlineKind.CLASS),
            Map.entry(STRUCT_DECLARATION, OutlineKind.STRUCT),
            Map.entry(RECORD_STRUCT_DECLARATION, OutlineKind.STRUCT),
            Map.entry(METHOD_DECLARATION, OutlineKind.METHOD),
            Map.entry(CONSTRUCTOR_DECLARATION, OutlineKind.METHOD),
            Map.entry(LOCAL_FUNCTION_STATEMENT, OutlineKind.FUNCTION));

    private static final Map<OutlineKind, String> FALLBACK_NAMES = Map.of(
            OutlineKind.NAMESPACE, "namespace",
            OutlineKind.CLASS, "Class",
            OutlineKind.STRUCT, "Struct",
            OutlineKind.METHOD, "Method",
            OutlineKind.FUNCTION, "function");

    private static final Set<String> BASE_TYPES = Set.of(IDENTIFIER, QUALIFIED_NAME, GENERIC_NAME);
    private static final Set<String> MODIFIER_TYPES = Set.of(MODIFIER);
    private static final Set<String> USING_TYPES = Set.of(USING_DIRECTIVE);
    private static final Set<String> CALL_TYPES = Set.of(INVOCATION_EXPRESSION);
    private static final Set<String> UNSUPPORTED_TYPES = Set.of(SWITCH_EXPRESSION);

    private static final Pattern PUBLIC = Pattern.compile("\\bpublic\\b");
    private static final Pattern PROTECTED_INTERNAL = Pattern.compile("\\bprotected\\s+internal\\b");
    private static final Pattern PROTECTED = Pattern.compile("\\bprotected\\b");
    private static final Pattern INTERNAL = Pattern.compile("\\binternal\\b");
    private static final Pattern PRIVATE = Pattern.compile("\\bprivate\\b");
    private static final Pattern USING_PREFIX = Pattern.compile("^(global\\s+)?using\\s+(static\\s+)?");

    @Override
    public Language language() {
        return Language.CSHARP;
    }

    @Override
    public AnalysisResult analyze(AnalysisContext context) {
        var session = new AnalysisSession(context);
        var tree = session.tree();
        walk(session, tree.root(), session.module());
        if (session.isCancelled()) {
            logger.debug("Analysis of {} cancelled during declaration walk", context.docId());
            return session.finish();
        }
        collectUsings(session);
        if (context.options().callGraphEnabled()) {
            for (int call : tree.descendantsOfType(tree.root(), CALL_TYPES)) {
                int function = tree.childByField(call, FIELD_FUNCTION);
                if (function != SyntaxTree.NO_NODE) {
                    session.addCall(call, tree.text(function));
                }
            }
        }
        session.reportUnsupported(UNSUPPORTED_TYPES);
        return session.finish();
    }

    private void walk(AnalysisSession session, int node, OutlineNode parent) {
        var tree = session.tree();
        for (int child : tree.children(node)) {
            if (session.isCancelled()) {
                return;
            }
            var kind = DECLARATION_KINDS.get(tree.type(child));
            if (kind == null) {
                walk(session, child, parent);
            } else if (kind.isCallable()) {
                visitCallable(session, child, kind, parent);
            } else {
                visitContainer(session, child, kind, parent);
            }
        }
    }

    private void visitContainer(AnalysisSession session, int node, OutlineKind kind, OutlineNode parent) {
        var tree = session.tree();
        var name = nameOf(tree, node, kind);
        var visibility = kind == OutlineKind.NAMESPACE ? null : visibility(tree, node);
        var generics = kind == OutlineKind.NAMESPACE ? null : typeParameters(tree, node);
        var declared = session.declare(node, kind, name, parent, null, visibility, generics);
        if (declared == null) {
            walk(session, node, parent);
            return;
        }
        if (kind != OutlineKind.NAMESPACE) {
            session.registerClass(declared, bases(tree, node));
        }
        walk(session, node, declared);
    }

    private void visitCallable(AnalysisSession session, int node, OutlineKind kind, OutlineNode parent) {
        var tree = session.tree();
        var name = nameOf(tree, node, kind);
        var declared = session.declare(
                node, kind, name, parent, parameters(tree, node), visibility(tree, node), typeParameters(tree, node));
        if (declared == null) {
            walk(session, node, parent);
            return;
        }
        session.addMember(parent, declared);

        var cfg = session.newCfg(declared);
        int body = tree.childByField(node, FIELD_BODY);
        List<CfgBuilder.Exit> exits;
        if (body == SyntaxTree.NO_NODE) {
            exits = cfg.entry();
        } else if (tree.isType(body, ARROW_EXPRESSION_CLAUSE)) {
            var id = cfg.stmt(tree.text(body), tree.range(body), cfg.entry());
            exits = id == null ? cfg.entry() : List.of(new CfgBuilder.Exit(id, null));
        } else {
            exits = new CSharpFlowLowering(tree, cfg).lowerBlock(body, cfg.entry());
        }
        session.addCfg(cfg.build(exits, name, tree.range(node)));

        walk(session, node, declared);
    }

    private static String nameOf(SyntaxTree tree, int node, OutlineKind kind) {
        int name = tree.childByField(node, FIELD_NAME);
        var text = name == SyntaxTree.NO_NODE ? "" : tree.text(name).strip();
        return text.isEmpty() ? FALLBACK_NAMES.get(kind) : text;
    }

    /**
     * Visibility from the declaration's modifiers, or from its header text when the grammar exposes none. Priority is
     * public, protected internal (reported as protected), protected, internal, private.
     */
    static @Nullable Visibility visibility(SyntaxTree tree, int node) {
        var modifiers = tree.childrenOfType(node, MODIFIER_TYPES);
        String header;
        if (!modifiers.isEmpty()) {
            header = modifiers.stream().map(tree::text).collect(Collectors.joining(" "));
        } else {
            int name = tree.childByField(node, FIELD_NAME);
            if (name == SyntaxTree.NO_NODE) {
                return null;
            }
            header = tree.textBetween(node, name);
        }
        if (PUBLIC.matcher(header).find()) {
            return Visibility.PUBLIC;
        }
        if (PROTECTED_INTERNAL.matcher(header).find() || PROTECTED.matcher(header).find()) {
            return Visibility.PROTECTED;
        }
        if (INTERNAL.matcher(header).find()) {
            return Visibility.INTERNAL;
        }
        if (PRIVATE.matcher(header).find()) {
            return Visibility.PRIVATE;
        }
        return null;
    }

    private static List<String> parameters(SyntaxTree tree, int node) {
        int list = tree.childByField(node, FIELD_PARAMETERS);
        if (list == SyntaxTree.NO_NODE) {
            return List.of();
        }
        var names = new LinkedHashSet<String>();
        for (int parameter : tree.childrenOfType(list, Set.of(PARAMETER))) {
            int name = tree.childByField(parameter, FIELD_NAME);
            if (name != SyntaxTree.NO_NODE) {
                names.add(tree.text(name));
            }
        }
        return new ArrayList<>(names);
    }

    private static @Nullable List<String> typeParameters(SyntaxTree tree, int node) {
        int list = tree.childByField(node, FIELD_TYPE_PARAMETERS);
        if (list == SyntaxTree.NO_NODE) {
            list = tree.firstChildOfType(node, Set.of(TYPE_PARAMETER_LIST));
        }
        if (list == SyntaxTree.NO_NODE) {
            return null;
        }
        var names = new ArrayList<String>();
        for (int parameter : tree.childrenOfType(list, Set.of(TYPE_PARAMETER))) {
            int name = tree.childByField(parameter, FIELD_NAME);
            names.add(tree.text(name == SyntaxTree.NO_NODE ? parameter : name).strip());
        }
        return names.isEmpty() ? null : names;
    }

    private static List<String> bases(SyntaxTree tree, int node) {
        int baseList = tree.firstChildOfType(node, Set.of(BASE_LIST));
        if (baseList == SyntaxTree.NO_NODE) {
            return List.of();
        }
        return tree.childrenOfType(baseList, BASE_TYPES).stream().map(tree::text).toList();
    }

    private static void collectUsings(AnalysisSession session) {
        var tree = session.tree();
        for (int directive : tree.descendantsOfType(tree.root(), USING_TYPES)) {
            var clause = USING_PREFIX.matcher(tree.text(directive).strip()).replaceFirst("");
            if (clause.endsWith(";")) {
                clause = clause.substring(0, clause.length() - 1);
            }
            int equals = clause.indexOf('=');
            if (equals >= 0) {
                session.addImport(clause.substring(equals + 1), clause.substring(0, equals));
            } else {
                session.addImport(clause, null);
            }
        }
    }
}
