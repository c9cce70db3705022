package ai.algovision.analyzer.csharp;

import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_ALTERNATIVE;
import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_BODY;
import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_CONDITION;
import static ai.algovision.analyzer.CommonTreeSitterNodeTypes.FIELD_CONSEQUENCE;
import static ai.algovision.analyzer.csharp.CSharpTreeSitterNodeTypes.*;

import ai.algovision.analyzer.SyntaxTree;
import ai.algovision.analyzer.cfg.CfgBuilder;
import ai.algovision.analyzer.cfg.CfgBuilder.Exit;
import ai.algovision.analyzer.cfg.FlowScope;
import ai.algovision.ir.CfgEdge;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Lowers C# statements into a {@link CfgBuilder}. */
final class CSharpFlowLowering {
    private static final Set<String> BLOCK_TYPES = Set.of(BLOCK);
    private static final Set<String> HEADER_BODY_TYPES =
            Set.of(USING_STATEMENT, LOCK_STATEMENT, FIXED_STATEMENT, CHECKED_STATEMENT, UNSAFE_STATEMENT);
    private static final Set<String> LABEL_TYPES =
            Set.of(CASE_SWITCH_LABEL, CASE_PATTERN_SWITCH_LABEL, DEFAULT_SWITCH_LABEL);

    private static final Pattern GOTO_CASE = Pattern.compile("^goto\\s+case\\s+(.+?)\\s*;?$", Pattern.DOTALL);
    private static final Pattern GOTO_DEFAULT = Pattern.compile("^goto\\s+default\\s*;?$");
    private static final Pattern YIELD_BREAK = Pattern.compile("^yield\\s+break\\b");
    private static final Pattern DEFAULT_LABEL = Pattern.compile("(^|[\\s:;])default\\s*:");

    private final SyntaxTree tree;
    private final CfgBuilder cfg;

    CSharpFlowLowering(SyntaxTree tree, CfgBuilder cfg) {
        this.tree = tree;
        this.cfg = cfg;
    }

    static boolean isStatement(SyntaxTree tree, int node) {
        var type = tree.type(node);
        return type.endsWith("_statement") || BLOCK.equals(type);
    }

    List<Exit> lowerBlock(int block, List<Exit> incoming) {
        if (block == SyntaxTree.NO_NODE) {
            return incoming;
        }
        if (!tree.isType(block, BLOCK)) {
            return lower(block, incoming);
        }
        return lowerSequence(tree.children(block), incoming);
    }

    private List<Exit> lowerSequence(List<Integer> statements, List<Exit> incoming) {
        var exits = incoming;
        for (int statement : statements) {
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
            case FOREACH_STATEMENT:
                return lowerLoop(node, incoming);
            case DO_STATEMENT:
                return lowerDo(node, incoming);
            case FOR_STATEMENT:
                return lowerFor(node, incoming);
            case SWITCH_STATEMENT:
                return lowerSwitch(node, incoming);
            case TRY_STATEMENT:
                return lowerTry(node, incoming);
            case RETURN_STATEMENT:
            case THROW_STATEMENT:
                return lowerTerminal(node, incoming);
            case YIELD_STATEMENT:
                return YIELD_BREAK.matcher(tree.text(node)).find()
                        ? lowerTerminal(node, incoming)
                        : simple(tree.text(node), node, incoming);
            case BREAK_STATEMENT:
                return lowerBreak(node, incoming);
            case CONTINUE_STATEMENT:
                return lowerContinue(node, incoming);
            case GOTO_STATEMENT:
                return lowerGoto(node, incoming);
            case LABELED_STATEMENT:
                return lowerLabeled(node, incoming);
            case LOCAL_FUNCTION_STATEMENT:
                return simple(tree.textBetween(node, tree.childByField(node, FIELD_BODY)), node, incoming);
            default:
                if (HEADER_BODY_TYPES.contains(type)) {
                    return lowerHeaderBody(node, incoming);
                }
                return simple(tree.text(node), node, incoming);
        }
    }

    private List<Exit> simple(String label, int node, List<Exit> incoming) {
        var id = cfg.stmt(label, tree.range(node), incoming);
        return id == null ? incoming : List.of(new Exit(id, null));
    }

    private List<Exit> lowerIf(int node, List<Exit> incoming) {
        int consequence = tree.childByField(node, FIELD_CONSEQUENCE);
        var condId = cfg.cond(header(node, consequence), tree.range(node), incoming);
        if (condId == null) {
            return incoming;
        }
        var exits = new ArrayList<>(lowerBlock(consequence, List.of(new Exit(condId, CfgEdge.TRUE))));
        List<Exit> falseExits = List.of(new Exit(condId, CfgEdge.FALSE));
        int alternative = tree.childByField(node, FIELD_ALTERNATIVE);
        if (alternative != SyntaxTree.NO_NODE) {
            falseExits = lower(alternative, falseExits);
        }
        exits.addAll(falseExits);
        return exits;
    }

    /** {@code while} and {@code foreach}: test first, body on true, exit on false. */
    private List<Exit> lowerLoop(int node, List<Exit> incoming) {
        int body = tree.childByField(node, FIELD_BODY);
        var testId = cfg.cond(header(node, body), tree.range(node), incoming);
        if (testId == null) {
            return incoming;
        }
        cfg.enterLoop(testId);
        var bodyExits = lowerBlock(body, List.of(new Exit(testId, CfgEdge.TRUE)));
        var scope = cfg.exitScope();
        cfg.connect(bodyExits, testId);
        var exits = new ArrayList<Exit>();
        exits.add(new Exit(testId, CfgEdge.FALSE));
        exits.addAll(scope.breaks());
        return exits;
    }

    private List<Exit> lowerDo(int node, List<Exit> incoming) {
        int body = tree.childByField(node, FIELD_BODY);
        int condition = tree.childByField(node, FIELD_CONDITION);
        int mark = cfg.mark();
        cfg.enterLoop(null);
        var bodyExits = lowerBlock(body, incoming);
        var scope = cfg.exitScope();
        var testIncoming = new ArrayList<>(bodyExits);
        testIncoming.addAll(scope.continues());
        var label = "while (" + (condition == SyntaxTree.NO_NODE ? "" : tree.text(condition)) + ")";
        var testRange = condition == SyntaxTree.NO_NODE ? tree.range(node) : tree.range(condition);
        var testId = cfg.cond(label, testRange, testIncoming);
        if (testId == null) {
            testIncoming.addAll(scope.breaks());
            return testIncoming;
        }
        var entry = cfg.firstNodeSince(mark);
        cfg.edge(testId, entry == null ? testId : entry, CfgEdge.TRUE);
        return withBreaks(new Exit(testId, CfgEdge.FALSE), scope);
    }

    private List<Exit> lowerFor(int node, List<Exit> incoming) {
        var exits = incoming;
        var initializers = tree.childrenByField(node, FIELD_INITIALIZER);
        if (!initializers.isEmpty()) {
            var initId = cfg.stmt(joinTexts(initializers), tree.range(initializers.get(0)), exits);
            if (initId == null) {
                return incoming;
            }
            exits = List.of(new Exit(initId, null));
        }
        int condition = tree.childByField(node, FIELD_CONDITION);
        var testLabel = condition == SyntaxTree.NO_NODE ? "true" : tree.text(condition);
        var testRange = condition == SyntaxTree.NO_NODE ? tree.range(node) : tree.range(condition);
        var testId = cfg.cond(testLabel, testRange, exits);
        if (testId == null) {
            return exits;
        }
        var updates = tree.childrenByField(node, FIELD_UPDATE);
        int body = tree.childByField(node, FIELD_BODY);
        if (updates.isEmpty()) {
            cfg.enterLoop(testId);
            var bodyExits = lowerBlock(body, List.of(new Exit(testId, CfgEdge.TRUE)));
            var scope = cfg.exitScope();
            cfg.connect(bodyExits, testId);
            return withBreaks(new Exit(testId, CfgEdge.FALSE), scope);
        }

        // continue targets the update, which does not exist until the body is lowered
        cfg.enterLoop(null);
        var bodyExits = lowerBlock(body, List.of(new Exit(testId, CfgEdge.TRUE)));
        var scope = cfg.exitScope();
        var updateIncoming = new ArrayList<>(bodyExits);
        updateIncoming.addAll(scope.continues());
        var updateId = cfg.stmt(joinTexts(updates), tree.range(updates.get(0)), updateIncoming);
        if (updateId == null) {
            cfg.connect(updateIncoming, testId);
        } else {
            cfg.edge(updateId, testId, null);
        }
        return withBreaks(new Exit(testId, CfgEdge.FALSE), scope);
    }

    private static List<Exit> withBreaks(Exit exit, FlowScope scope) {
        var exits = new ArrayList<Exit>();
        exits.add(exit);
        exits.addAll(scope.breaks());
        return exits;
    }

    private List<Exit> lowerSwitch(int node, List<Exit> incoming) {
        int body = tree.childByField(node, FIELD_BODY);
        if (body == SyntaxTree.NO_NODE) {
            body = tree.firstChildOfType(node, Set.of(SWITCH_BODY));
        }
        var sections = body == SyntaxTree.NO_NODE
                ? List.<Integer>of()
                : tree.childrenOfType(body, Set.of(SWITCH_SECTION));
        var groups = groupSections(sections);

        // case value -> first group declaring it; default -> first default group
        Map<String, Integer> caseGroups = new LinkedHashMap<>();
        int defaultGroup = -1;
        for (int i = 0; i < groups.size(); i++) {
            for (var value : groups.get(i).cases()) {
                caseGroups.putIfAbsent(value, i);
            }
            if (groups.get(i).hasDefault() && defaultGroup < 0) {
                defaultGroup = i;
            }
        }

        var switchId =
                cfg.switchNode(header(node, body), new ArrayList<>(caseGroups.keySet()), tree.range(node), incoming);
        if (switchId == null) {
            return incoming;
        }

        var scope = cfg.enterSwitch();
        var exits = new ArrayList<Exit>();
        for (int i = 0; i < groups.size(); i++) {
            var sectionIncoming = new ArrayList<Exit>();
            for (var entry : caseGroups.entrySet()) {
                if (entry.getValue() == i) {
                    sectionIncoming.add(new Exit(switchId, CfgEdge.caseLabel(entry.getKey())));
                }
            }
            if (i == defaultGroup) {
                sectionIncoming.add(new Exit(switchId, CfgEdge.DEFAULT));
            }
            int mark = cfg.mark();
            exits.addAll(lowerSequence(groups.get(i).statements(), sectionIncoming));
            var entryId = cfg.firstNodeSince(mark);
            if (entryId != null) {
                for (var entry : caseGroups.entrySet()) {
                    if (entry.getValue() == i) {
                        scope.addCaseEntry(entry.getKey(), entryId);
                    }
                }
                if (i == defaultGroup) {
                    scope.setDefaultEntry(entryId);
                }
            }
        }
        if (defaultGroup < 0) {
            exits.add(new Exit(switchId, CfgEdge.DEFAULT));
        }
        cfg.exitScope();

        for (var pending : scope.gotos()) {
            var target = pending.caseValue() == null ? scope.defaultEntry() : scope.caseEntry(pending.caseValue());
            if (target != null) {
                cfg.edge(pending.from(), target, null);
            } else {
                exits.add(new Exit(pending.from(), null));
            }
        }
        exits.addAll(scope.breaks());
        return exits;
    }

    /** Labels sharing one statement list; stacked labels may arrive as sections without statements. */
    private record SectionGroup(List<String> cases, boolean hasDefault, List<Integer> statements) {}

    private List<SectionGroup> groupSections(List<Integer> sections) {
        var groups = new ArrayList<SectionGroup>();
        var cases = new ArrayList<String>();
        boolean hasDefault = false;
        for (int section : sections) {
            var statements = sectionStatements(section);
            var labels = sectionLabels(section, statements);
            cases.addAll(labels.cases());
            hasDefault |= labels.hasDefault();
            if (!statements.isEmpty()) {
                groups.add(new SectionGroup(List.copyOf(cases), hasDefault, statements));
                cases.clear();
                hasDefault = false;
            }
        }
        if (!cases.isEmpty() || hasDefault) {
            groups.add(new SectionGroup(List.copyOf(cases), hasDefault, List.of()));
        }
        return groups;
    }

    private record SectionLabels(List<String> cases, boolean hasDefault) {}

    private SectionLabels sectionLabels(int section, List<Integer> statements) {
        var cases = new ArrayList<String>();
        boolean hasDefault = false;
        var labelNodes = tree.childrenOfType(section, LABEL_TYPES);
        if (!labelNodes.isEmpty()) {
            for (int label : labelNodes) {
                if (tree.isType(label, DEFAULT_SWITCH_LABEL)) {
                    hasDefault = true;
                } else {
                    var values = labelValueNodes(label, List.of());
                    cases.add(values.isEmpty() ? caseValue(tree.text(label)) : normalize(tree.text(values.get(0))));
                }
            }
            return new SectionLabels(cases, hasDefault);
        }

        // labels inlined into the section: values are the named children ahead of the statements
        int firstStatement = statements.isEmpty() ? SyntaxTree.NO_NODE : statements.get(0);
        var header = tree.textBetween(section, firstStatement);
        var rest = new StringBuilder();
        int cursor = 0;
        for (int value : labelValueNodes(section, statements)) {
            var text = tree.text(value);
            int at = header.indexOf(text, cursor);
            if (at < 0) {
                continue;
            }
            cases.add(normalize(text));
            rest.append(header, cursor, at).append(' ');
            cursor = at + text.length();
        }
        rest.append(header.substring(cursor));
        hasDefault = DEFAULT_LABEL.matcher(rest).find();
        return new SectionLabels(cases, hasDefault);
    }

    private List<Integer> labelValueNodes(int parent, List<Integer> statements) {
        var values = new ArrayList<Integer>();
        for (int child : tree.children(parent)) {
            if (statements.contains(child)) {
                break;
            }
            if (!tree.isType(child, COMMENT) && !tree.isType(child, WHEN_CLAUSE) && !isStatement(tree, child)) {
                values.add(child);
            }
        }
        return values;
    }

    private static String caseValue(String labelText) {
        var text = labelText.strip();
        if (text.startsWith("case")) {
            text = text.substring(4);
        }
        if (text.endsWith(":")) {
            text = text.substring(0, text.length() - 1);
        }
        return normalize(text);
    }

    private static String normalize(String text) {
        return text.strip().replaceAll("\\s+", " ");
    }

    private List<Integer> sectionStatements(int section) {
        var statements = new ArrayList<Integer>();
        for (int child : tree.children(section)) {
            if (isStatement(tree, child)) {
                statements.add(child);
            }
        }
        return statements;
    }

    private List<Exit> lowerTry(int node, List<Exit> incoming) {
        var tryId = cfg.stmt("try", tree.range(node), incoming);
        if (tryId == null) {
            return incoming;
        }
        var exits = new ArrayList<>(lowerBlock(tree.childByField(node, FIELD_BODY), List.of(new Exit(tryId, null))));
        int finallyClause = SyntaxTree.NO_NODE;
        for (int clause : tree.children(node)) {
            if (tree.isType(clause, CATCH_CLAUSE)) {
                int block = tree.childByField(clause, FIELD_BODY);
                if (block == SyntaxTree.NO_NODE) {
                    block = tree.firstChildOfType(clause, BLOCK_TYPES);
                }
                var handlerId = cfg.stmt(header(clause, block), tree.range(clause), List.of(new Exit(tryId, "catch")));
                if (handlerId != null) {
                    exits.addAll(lowerBlock(block, List.of(new Exit(handlerId, null))));
                }
            } else if (tree.isType(clause, FINALLY_CLAUSE)) {
                finallyClause = clause;
            }
        }
        if (finallyClause == SyntaxTree.NO_NODE) {
            return exits;
        }
        var finallyId = cfg.stmt("finally", tree.range(finallyClause), exits);
        if (finallyId == null) {
            return exits;
        }
        return lowerBlock(tree.firstChildOfType(finallyClause, BLOCK_TYPES), List.of(new Exit(finallyId, null)));
    }

    private List<Exit> lowerHeaderBody(int node, List<Exit> incoming) {
        int body = tree.childByField(node, FIELD_BODY);
        if (body == SyntaxTree.NO_NODE) {
            body = lastStatementChild(node);
        }
        var headerId = cfg.stmt(header(node, body), tree.range(node), incoming);
        if (headerId == null) {
            return incoming;
        }
        return lowerBlock(body, List.of(new Exit(headerId, null)));
    }

    private int lastStatementChild(int node) {
        int result = SyntaxTree.NO_NODE;
        for (int child : tree.children(node)) {
            if (isStatement(tree, child)) {
                result = child;
            }
        }
        return result;
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

    private List<Exit> lowerGoto(int node, List<Exit> incoming) {
        var text = tree.text(node).strip();
        var id = cfg.stmt(text, tree.range(node), incoming);
        if (id == null) {
            return incoming;
        }
        var scope = cfg.nearestSwitch();
        if (scope != null) {
            var caseMatcher = GOTO_CASE.matcher(text);
            if (caseMatcher.matches()) {
                scope.addGoto(new FlowScope.PendingGoto(id, caseValue(caseMatcher.group(1))));
                return List.of();
            }
            if (GOTO_DEFAULT.matcher(text).matches()) {
                scope.addGoto(new FlowScope.PendingGoto(id, null));
                return List.of();
            }
        }
        return List.of(new Exit(id, null));
    }

    private List<Exit> lowerLabeled(int node, List<Exit> incoming) {
        int statement = lastStatementChild(node);
        return statement == SyntaxTree.NO_NODE ? simple(tree.text(node), node, incoming) : lower(statement, incoming);
    }

    private String joinTexts(List<Integer> nodes) {
        return nodes.stream().map(tree::text).collect(Collectors.joining(", "));
    }

    /** Header of a compound statement: its text up to the body. */
    private String header(int node, int body) {
        return tree.textBetween(node, body).strip();
    }

}
