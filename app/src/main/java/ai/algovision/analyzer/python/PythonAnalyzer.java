package ai.algovision.analyzer.python;

import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_BODY;
import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_FUNCTION;
import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_NAME;
import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_PARAMETERS;
import static ai.algovision.analyzer.python.PythonTreeSitterNodeTypes.*;

import ai.algovision.analyzer.AnalysisContext;
import ai.algovision.analyzer.AnalysisResult;
import ai.algovision.analyzer.AnalysisSession;
import ai.algovision.analyzer.Language;
import ai.algovision.analyzer.LanguageAnalyzer;
import ai.algovision.analyzer.SyntaxTree;
import ai.algovision.ir.OutlineKind;
import ai.algovision.ir.OutlineNode;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Builds outline, CFGs, calls, classes and imports for Python sources. */
public final class PythonAnalyzer implements LanguageAnalyzer {
    private static final Logger logger = LogManager.getLogger(PythonAnalyzer.class);

    private static final Set<String> BASE_TYPES = Set.of(IDENTIFIER, ATTRIBUTE, DOTTED_NAME);
    private static final Set<String> IMPORT_TYPES = Set.of(IMPORT_STATEMENT, IMPORT_FROM_STATEMENT);
    private static final Set<String> CALL_TYPES = Set.of(CALL);
    private static final Set<String> UNSUPPORTED_TYPES = Set.of(MATCH_STATEMENT);

    private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();
    private static final Pattern AS = Pattern.compile("\\s+as\\s+");
    private static final Pattern FROM_IMPORT = Pattern.compile("^from\\s+(\\S+)\\s+import\\s+(.*)$", Pattern.DOTALL);
    private static final Pattern LINE_CONTINUATION = Pattern.compile("\\\\\\r?\\n");

    @Override
    public Language language() {
        return Language.PYTHON;
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
        collectImports(session);
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
            var type = tree.type(child);
            if (CLASS_DEFINITION.equals(type)) {
                visitClass(session, child, parent);
            } else if (FUNCTION_DEFINITION.equals(type)) {
                visitFunction(session, child, parent);
            } else {
                walk(session, child, parent);
            }
        }
    }

    private void visitClass(AnalysisSession session, int node, OutlineNode parent) {
        var tree = session.tree();
        var name = nameOf(tree, node, "Class");
        var classNode = session.declare(node, OutlineKind.CLASS, name, parent, null, null, null);
        if (classNode == null) {
            walk(session, node, parent);
            return;
        }
        session.registerClass(classNode, bases(tree, node));
        walk(session, node, classNode);
    }

    private void visitFunction(AnalysisSession session, int node, OutlineNode parent) {
        var tree = session.tree();
        var name = nameOf(tree, node, "function");
        var kind = parent.kind() == OutlineKind.CLASS ? OutlineKind.METHOD : OutlineKind.FUNCTION;
        var function = session.declare(node, kind, name, parent, parameters(tree, node), null, null);
        if (function == null) {
            walk(session, node, parent);
            return;
        }
        session.addMember(parent, function);

        var cfg = session.newCfg(function);
        var exits = new PythonFlowLowering(tree, cfg).lowerBlock(tree.childByField(node, FIELD_BODY), cfg.entry());
        session.addCfg(cfg.build(exits, name, tree.range(node)));

        walk(session, node, function);
    }

    private static String nameOf(SyntaxTree tree, int node, String fallback) {
        int name = tree.childByField(node, FIELD_NAME);
        var text = name == SyntaxTree.NO_NODE ? "" : tree.text(name).strip();
        return text.isEmpty() ? fallback : text;
    }

    static List<String> parameters(SyntaxTree tree, int function) {
        int parameters = tree.childByField(function, FIELD_PARAMETERS);
        if (parameters == SyntaxTree.NO_NODE) {
            return List.of();
        }
        var names = new LinkedHashSet<String>();
        for (int parameter : tree.children(parameters)) {
            switch (tree.type(parameter)) {
                case IDENTIFIER, LIST_SPLAT_PATTERN, DICTIONARY_SPLAT_PATTERN -> names.add(tree.text(parameter));
                case DEFAULT_PARAMETER, TYPED_DEFAULT_PARAMETER -> {
                    int name = tree.childByField(parameter, FIELD_NAME);
                    if (name != SyntaxTree.NO_NODE) {
                        names.add(tree.text(name));
                    }
                }
                case TYPED_PARAMETER -> {
                    if (tree.childCount(parameter) > 0) {
                        names.add(tree.text(tree.child(parameter, 0)));
                    }
                }
                default -> {
                    // separators and comments carry no name
                }
            }
        }
        return new ArrayList<>(names);
    }

    private static List<String> bases(SyntaxTree tree, int classNode) {
        int superclasses = tree.childByField(classNode, FIELD_SUPERCLASSES);
        if (superclasses == SyntaxTree.NO_NODE) {
            return List.of();
        }
        return tree.childrenOfType(superclasses, BASE_TYPES).stream()
                .map(tree::text)
                .toList();
    }

    private static void collectImports(AnalysisSession session) {
        var tree = session.tree();
        for (int statement : tree.descendantsOfType(tree.root(), IMPORT_TYPES)) {
            var text = LINE_CONTINUATION.matcher(tree.text(statement)).replaceAll(" ").strip();
            if (tree.isType(statement, IMPORT_STATEMENT)) {
                for (var clause : COMMA.split(text.substring("import".length()))) {
                    addClause(session, "", clause);
                }
                continue;
            }
            var matcher = FROM_IMPORT.matcher(text);
            if (!matcher.matches()) {
                logger.debug("Unrecognized import statement: {}", text);
                continue;
            }
            var module = matcher.group(1);
            var members = matcher.group(2).replace("(", " ").replace(")", " ");
            for (var clause : COMMA.split(members)) {
                addClause(session, module, clause);
            }
        }
    }

    private static void addClause(AnalysisSession session, String module, String clause) {
        var parts = AS.split(clause.strip(), 2);
        var member = parts[0].strip();
        if (member.isEmpty()) {
            return;
        }
        String name;
        if (module.isEmpty()) {
            name = member;
        } else if (module.endsWith(".")) {
            name = module + member;
        } else {
            name = module + "." + member;
        }
        session.addImport(name, parts.length > 1 ? parts[1] : null);
    }
}
