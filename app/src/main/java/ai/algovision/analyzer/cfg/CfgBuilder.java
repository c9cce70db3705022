package ai.algovision.analyzer.cfg;

import ai.algovision.analyzer.NodeBudget;
import ai.algovision.ir.Cfg;
import ai.algovision.ir.CfgEdge;
import ai.algovision.ir.CfgNode;
import ai.algovision.ir.IrRange;
import ai.algovision.ir.Labels;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Builds the control-flow graph of one function.
 *
 * <p>Lowering works on pending exits: each statement is given the exits that flow into it and returns the exits that
 * leave it. Every node is charged to the shared {@link NodeBudget}; once a node does not fit, the node factories return
 * null, the builder is truncated, and {@link #build} joins the dangling exits to {@code end} through a single
 * placeholder statement.
 */
public final class CfgBuilder {
    private static final Logger logger = LogManager.getLogger(CfgBuilder.class);

    public static final String TRUNCATION_LABEL = "… truncated (node cap reached)";

    /** An edge waiting for its target. */
    public record Exit(String from, @Nullable String label) {}

    private final String funcId;
    private final NodeBudget budget;
    private final String startId;
    private final String endId;
    private final List<CfgNode> nodes = new ArrayList<>();
    private final List<CfgEdge> edges = new ArrayList<>();
    private final Deque<FlowScope> scopes = new ArrayDeque<>();
    private int sequence;
    private boolean truncated;

    /** The caller has already reserved the start and end nodes. */
    public CfgBuilder(String funcId, NodeBudget budget) {
        this.funcId = funcId;
        this.budget = budget;
        this.startId = funcId + ":start";
        this.endId = funcId + ":end";
        nodes.add(new CfgNode.Start(startId));
    }

    public List<Exit> entry() {
        return List.of(new Exit(startId, null));
    }

    public String endId() {
        return endId;
    }

    public boolean isTruncated() {
        return truncated;
    }

    /** Counts a statement dropped after truncation. */
    public void skip() {
        budget.skip(1);
    }

    public @Nullable String stmt(String label, @Nullable IrRange range, List<Exit> incoming) {
        var id = nextId();
        if (id == null) {
            return null;
        }
        nodes.add(new CfgNode.Stmt(id, Labels.normalize(label), range));
        connect(incoming, id);
        return id;
    }

    public @Nullable String cond(String label, @Nullable IrRange range, List<Exit> incoming) {
        var id = nextId();
        if (id == null) {
            return null;
        }
        nodes.add(new CfgNode.Cond(id, Labels.normalize(label), range));
        connect(incoming, id);
        return id;
    }

    /** The caller must later give the node exactly one edge per case plus one {@code default} edge. */
    public @Nullable String switchNode(String label, List<String> cases, @Nullable IrRange range, List<Exit> incoming) {
        var id = nextId();
        if (id == null) {
            return null;
        }
        nodes.add(new CfgNode.Switch(id, Labels.normalize(label), cases, range));
        connect(incoming, id);
        return id;
    }

    public void connect(List<Exit> exits, String target) {
        for (var exit : exits) {
            edges.add(new CfgEdge(exit.from(), target, exit.label()));
        }
    }

    public void edge(String from, String to, @Nullable String label) {
        edges.add(new CfgEdge(from, to, label));
    }

    public void edgeToEnd(String from) {
        edge(from, endId, null);
    }

    /** Position marker for {@link #firstNodeSince}. */
    public int mark() {
        return nodes.size();
    }

    /** Id of the first node created after {@code mark}, or null if none was. */
    public @Nullable String firstNodeSince(int mark) {
        return mark < nodes.size() ? nodes.get(mark).id() : null;
    }

    /** @param continueTarget node {@code continue} jumps to; null to collect continues on the scope instead */
    public void enterLoop(@Nullable String continueTarget) {
        scopes.push(FlowScope.loop(continueTarget));
    }

    public FlowScope enterSwitch() {
        var scope = FlowScope.switchScope();
        scopes.push(scope);
        return scope;
    }

    public FlowScope exitScope() {
        return scopes.pop();
    }

    /** @return false when there is no enclosing loop or switch */
    public boolean addBreak(Exit exit) {
        var scope = scopes.peek();
        if (scope == null) {
            return false;
        }
        scope.breaks().add(exit);
        return true;
    }

    /**
     * Routes {@code exit} to the nearest loop's continue target, or parks it on the loop when the target is created
     * after the body.
     *
     * @return false when there is no enclosing loop
     */
    public boolean addContinue(Exit exit) {
        for (var scope : scopes) {
            if (scope.isSwitch()) {
                continue;
            }
            var target = scope.continueTarget();
            if (target != null) {
                edge(exit.from(), target, exit.label());
            } else {
                scope.continues().add(exit);
            }
            return true;
        }
        return false;
    }

    public @Nullable FlowScope nearestSwitch() {
        for (var scope : scopes) {
            if (scope.isSwitch()) {
                return scope;
            }
        }
        return null;
    }

    /**
     * Completes the graph: adds the {@code "{name} body"} skeleton when nothing was lowered, the truncation placeholder
     * when the budget ran out, and the {@code end} node.
     */
    public Cfg build(List<Exit> exits, String name, IrRange declarationRange) {
        var pending = exits;
        if (nodes.size() == 1 && !truncated) {
            if (budget.tryReserve(1)) {
                var bodyId = funcId + ":body";
                nodes.add(new CfgNode.Stmt(bodyId, Labels.normalize(name + " body"), declarationRange));
                connect(pending, bodyId);
                pending = List.of(new Exit(bodyId, null));
            } else {
                truncated = true;
                budget.skip(1);
            }
        }
        if (truncated && budget.claimPlaceholder()) {
            var placeholderId = funcId + ":truncated";
            nodes.add(new CfgNode.Stmt(placeholderId, TRUNCATION_LABEL, null));
            connect(pending, placeholderId);
            pending = List.of(new Exit(placeholderId, null));
            logger.debug("Truncated CFG of {} after {} nodes", funcId, nodes.size());
        }
        connect(pending, endId);
        nodes.add(new CfgNode.End(endId));
        return new Cfg(funcId, nodes, edges);
    }

    private @Nullable String nextId() {
        if (truncated || !budget.tryReserve(1)) {
            truncated = true;
            budget.skip(1);
            return null;
        }
        return funcId + ":n" + sequence++;
    }
}
