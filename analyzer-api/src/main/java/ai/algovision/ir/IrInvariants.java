package ai.algovision.ir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks every {@link IrDocument} must pass. Returns human-readable violations; an empty list means the
 * document is well formed.
 */
public final class IrInvariants {

    private IrInvariants() {}

    public static List<String> check(IrDocument ir) {
        var violations = new ArrayList<String>();
        var outlineIds = new HashSet<String>();
        for (var node : ir.outline()) {
            if (!outlineIds.add(node.id())) {
                violations.add("duplicate outline id " + node.id());
            }
        }
        for (var node : ir.outline()) {
            if (node.parentId() != null && !outlineIds.contains(node.parentId())) {
                violations.add("outline node " + node.id() + " has unknown parent " + node.parentId());
            }
        }
        for (var cfg : ir.cfgs()) {
            if (!outlineIds.contains(cfg.funcId())) {
                violations.add("cfg for unknown function " + cfg.funcId());
            }
            checkCfg(cfg, violations);
        }
        for (var call : ir.calls()) {
            if (call.calleeName().isEmpty() || call.calleeName().contains(".")) {
                violations.add("call from " + call.callerId() + " has non-bare callee '" + call.calleeName() + "'");
            }
            if (!outlineIds.contains(call.callerId())) {
                violations.add("call from unknown caller " + call.callerId());
            }
        }
        return violations;
    }

    private static void checkCfg(Cfg cfg, List<String> violations) {
        var prefix = "cfg " + cfg.funcId() + ": ";
        var nodesById = new HashMap<String, CfgNode>();
        int starts = 0;
        int ends = 0;
        for (var node : cfg.nodes()) {
            if (nodesById.put(node.id(), node) != null) {
                violations.add(prefix + "duplicate node id " + node.id());
            }
            if (node instanceof CfgNode.Start) {
                starts++;
            } else if (node instanceof CfgNode.End) {
                ends++;
            }
        }
        if (starts != 1) {
            violations.add(prefix + "expected exactly one start node, found " + starts);
        }
        if (ends != 1) {
            violations.add(prefix + "expected exactly one end node, found " + ends);
        }

        Map<String, List<CfgEdge>> outgoing = new HashMap<>();
        for (var edge : cfg.edges()) {
            var from = nodesById.get(edge.from());
            var to = nodesById.get(edge.to());
            if (from == null || to == null) {
                violations.add(prefix + "edge " + edge.from() + " -> " + edge.to() + " references a missing node");
                continue;
            }
            if (to instanceof CfgNode.Start) {
                violations.add(prefix + "start node has incoming edge from " + edge.from());
            }
            if (from instanceof CfgNode.End) {
                violations.add(prefix + "end node has outgoing edge to " + edge.to());
            }
            outgoing.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
        }

        for (var node : cfg.nodes()) {
            var edges = outgoing.getOrDefault(node.id(), List.of());
            if (node instanceof CfgNode.Cond) {
                var labels = edges.stream().map(CfgEdge::label).toList();
                if (labels.size() != 2 || !labels.contains(CfgEdge.TRUE) || !labels.contains(CfgEdge.FALSE)) {
                    violations.add(prefix + "cond " + node.id() + " must have exactly true/false edges, has " + labels);
                }
            } else if (node instanceof CfgNode.Switch sw) {
                Set<String> expected = new LinkedHashSet<>();
                sw.cases().forEach(c -> expected.add(CfgEdge.caseLabel(c)));
                expected.add(CfgEdge.DEFAULT);
                var labels = edges.stream().map(CfgEdge::label).toList();
                if (labels.size() != expected.size() || !new HashSet<>(labels).equals(expected)) {
                    violations.add(prefix + "switch " + node.id() + " edges " + labels + " do not match " + expected);
                }
            }
        }
    }
}
