package ai.algovision.analyzer.python;

import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_ALTERNATIVE;
import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_BODY;
import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_CONSEQUENCE;
import static ai.algovision.analyzer.python.PythonTreeSitterNodeTypes.*;

import ai.algovision.analyzer.SyntaxTree;
import ai.algovision.analyzer.cfg.CfgBuilder;
import ai.algovision.analyzer.cfg.CfgBuilder.Exit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** Lowers Python statements into a {@link CfgBuilder}. */
final class PythonFlowLowering {
    private static final Set<String> BLOCK_TYPES = Set.of(BLOCK);
    private static final Set<String> HANDLER_TYPES = Set.of(EXCEPT_CLAUSE, EXCEPT_GROUP_CLAUSE);
    private static final Set<String> DECLARATION_TYPES =
            Set.of(FUNCTION_DEFINITION, CLASS_DEFINITION, DECORATED_DEFINITION);

    private final SyntaxTree tree;
    private final CfgBuilder cfg;

    PythonFlowLowering(SyntaxTree tree, CfgBuilder cfg) {
        this.tree = tree;
        this.cfg = cfg;
    }

    List<Exit> lowerBlock(int block, List<Exit> incoming) {
        if (block == SyntaxTree.NO_NODE) {
            return incoming;
        }
        if (!tree.isType(block, BLOCK)) {
            return lower(block, incoming);
        }
        var exits = incoming;
        for (int statement : tree.children(block)) {
            if (!tree.isType(statement, COMMENT)) {
                exits = lower(statement, exits);
            }
        }
        return exits;
    }

    List<Exit> lower(int node, List<Exit> incoming) {
        if (cfg.isTruncated()) {
            cfg.skip();
            return incoming;
        }
        var type = tree.type(node);
        switch (type) {
            case BLOCK:
                return lowerBlock(node, incoming);
            case IF_STATEMENT:
                return lowerIf(node, incoming);
            case WHILE_STATEMENT:
            case FOR_STATEMENT:
                return lowerLoop(node, incoming);
            case TRY_STATEMENT:
                return lowerTry(node, incoming);
            case WITH_STATEMENT:
                return lowerWith(node, incoming);
            case RETURN_STATEMENT:
            case RAISE_STATEMENT:
                return lowerTerminal(node, incoming);
            case BREAK_STATEMENT:
                return lowerBreak(node, incoming);
            case CONTINUE_STATEMENT:
                return lowerContinue(node, incoming);
            default:
                var label = DECLARATION_TYPES.contains(type) ? declarationHeader(node) : tree.text(node);
                return sequential(cfg.stmt(label, tree.range(node), incoming), incoming);
        }
    }

    private List<Exit> lowerIf(int node, List<Exit> incoming) {
        int consequence = tree.childByField(node, FIELD_CONSEQUENCE);
        var condId = cfg.cond(header(node, consequence), tree.range(node), incoming);
        if (condId == null) {
            return incoming;
        }
        var exits = new ArrayList<>(lowerBlock(consequence, List.of(new Exit(condId, "true"))));
        List<Exit> falseExits = List.of(new Exit(condId, "false"));
        for (int alternative : tree.childrenByField(node, FIELD_ALTERNATIVE)) {
            if (tree.isType(alternative, ELIF_CLAUSE)) {
                int elifBody = tree.childByField(alternative, FIELD_CONSEQUENCE);
                var elifId = cfg.cond(header(alternative, elifBody), tree.range(alternative), falseExits);
                if (elifId == null) {
                    break;
                }
                exits.addAll(lowerBlock(elifBody, List.of(new Exit(elifId, "true"))));
                falseExits = List.of(new Exit(elifId, "false"));
            } else if (tree.isType(alternative, ELSE_CLAUSE)) {
                falseExits = lowerBlock(bodyOf(alternative), falseExits);
            }
        }
        exits.addAll(falseExits);
        return exits;
    }

    private List<Exit> lowerLoop(int node, List<Exit> incoming) {
        int body = tree.childByField(node, FIELD_BODY);
        var testId = cfg.cond(header(node, body), tree.range(node), incoming);
        if (testId == null) {
            return incoming;
        }
        cfg.enterLoop(testId);
        var bodyExits = lowerBlock(body, List.of(new Exit(testId, "true")));
        var scope = cfg.exitScope();
        cfg.connect(bodyExits, testId);

        List<Exit> exits = List.of(new Exit(testId, "false"));
        int elseClause = tree.childByField(node, FIELD_ALTERNATIVE);
        if (elseClause != SyntaxTree.NO_NODE) {
            exits = lowerBlock(bodyOf(elseClause), exits);
        }
        var result = new ArrayList<>(exits);
        result.addAll(scope.breaks());
        return result;
    }

    private List<Exit> lowerTry(int node, List<Exit> incoming) {
        var tryId = cfg.stmt("try", tree.range(node), incoming);
        if (tryId == null) {
            return incoming;
        }
        var exits = lowerBlock(tree.childByField(node, FIELD_BODY), List.of(new Exit(tryId, null)));
        var handlerExits = new ArrayList<Exit>();
        int elseClause = SyntaxTree.NO_NODE;
        int finallyClause = SyntaxTree.NO_NODE;
        for (int clause : tree.children(node)) {
            if (tree.isType(clause, HANDLER_TYPES)) {
                int block = tree.firstChildOfType(clause, BLOCK_TYPES);
                var handlerId = cfg.stmt(header(clause, block), tree.range(clause), List.of(new Exit(tryId, "except")));
                if (handlerId != null) {
                    handlerExits.addAll(lowerBlock(block, List.of(new Exit(handlerId, null))));
                }
            } else if (tree.isType(clause, ELSE_CLAUSE)) {
                elseClause = clause;
            } else if (tree.isType(clause, FINALLY_CLAUSE)) {
                finallyClause = clause;
            }
        }
        if (elseClause != SyntaxTree.NO_NODE) {
            exits = lowerBlock(bodyOf(elseClause), exits);
        }
        var joined = new ArrayList<>(exits);
        joined.addAll(handlerExits);
        if (finallyClause == SyntaxTree.NO_NODE) {
            return joined;
        }
        var finallyId = cfg.stmt("finally", tree.range(finallyClause), joined);
        if (finallyId == null) {
            return joined;
        }
        return lowerBlock(tree.firstChildOfType(finallyClause, BLOCK_TYPES), List.of(new Exit(finallyId, null)));
    }

    private List<Exit> lowerWith(int node, List<Exit> incoming) {
        int body = tree.childByField(node, FIELD_BODY);
        var headerId = cfg.stmt(header(node, body), tree.range(node), incoming);
        if (headerId == null) {
            return incoming;
        }
        return lowerBlock(body, List.of(new Exit(headerId, null)));
    }

    private List<Exit> lowerTerminal(int node, List<Exit> incoming) {
        var id = cfg.stmt(tree.text(node), tree.range(node), incoming);
        if (id == null) {
            return incoming;
        }
        cfg.edgeToEnd(id);
        return List.of();
    }

    private List<Exit> lowerBreak(int node, List<Exit> incoming) {
        var id = cfg.stmt(tree.text(node), tree.range(node), incoming);
        if (id == null) {
            return incoming;
        }
        var exit = new Exit(id, null);
        return cfg.addBreak(exit) ? List.of() : List.of(exit);
    }

    private List<Exit> lowerContinue(int node, List<Exit> incoming) {
        var id = cfg.stmt(tree.text(node), tree.range(node), incoming);
        if (id == null) {
            return incoming;
        }
        var exit = new Exit(id, null);
        return cfg.addContinue(exit) ? List.of() : List.of(exit);
    }

    private static List<Exit> sequential(@Nullable String id, List<Exit> incoming) {
        return id == null ? incoming : List.of(new Exit(id, null));
    }

    private int bodyOf(int clause) {
        int body = tree.childByField(clause, FIELD_BODY);
        return body != SyntaxTree.NO_NODE ? body : tree.firstChildOfType(clause, BLOCK_TYPES);
    }

    /** Header of a compound statement: its text up to the body, without the trailing colon. */
    private String header(int node, int body) {
        var text = tree.textBetween(node, body).strip();
        return text.endsWith(":") ? text.substring(0, text.length() - 1) : text;
    }

    private String declarationHeader(int node) {
        int definition = tree.isType(node, DECORATED_DEFINITION)
                ? tree.childByField(node, FIELD_DEFINITION)
                : node;
        if (definition == SyntaxTree.NO_NODE) {
            return tree.text(node);
        }
        return header(definition, tree.childByField(definition, FIELD_BODY));
    }
}
