package ai.algovision.ir;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public final class IrInvariantsTest {

    private static final IrRange RANGE = IrRange.of(1, 1, 2, 1);
    private static final OutlineNode MODULE =
            new OutlineNode("m:doc@1#1", OutlineKind.MODULE, "doc", null, RANGE, null, null, null);
    private static final OutlineNode FUNC =
            new OutlineNode("f:run@1#1", OutlineKind.FUNCTION, "run", MODULE.id(), RANGE, List.of(), null, null);

    @Test
    void testWellFormedDocumentPasses() {
        var cfg = new Cfg(
                FUNC.id(),
                List.of(
                        new CfgNode.Start("s"),
                        new CfgNode.Cond("c", "x", null),
                        new CfgNode.Stmt("a", "a()", null),
                        new CfgNode.End("e")),
                List.of(
                        new CfgEdge("s", "c", null),
                        new CfgEdge("c", "a", CfgEdge.TRUE),
                        new CfgEdge("c", "e", CfgEdge.FALSE),
                        new CfgEdge("a", "e", null)));
        var ir = new IrDocument(
                List.of(MODULE, FUNC),
                List.of(cfg),
                List.of(new CallEdge(FUNC.id(), "print", CallKind.DIRECT)),
                List.of(),
                List.of());
        assertEquals(List.of(), IrInvariants.check(ir));
    }

    @Test
    void testCondWithSingleEdgeIsReported() {
        var cfg = new Cfg(
                FUNC.id(),
                List.of(new CfgNode.Start("s"), new CfgNode.Cond("c", "x", null), new CfgNode.End("e")),
                List.of(new CfgEdge("s", "c", null), new CfgEdge("c", "e", CfgEdge.TRUE)));
        var violations = IrInvariants.check(new IrDocument(List.of(MODULE, FUNC), List.of(cfg), List.of(), List.of(),
                List.of()));
        assertEquals(1, violations.size(), violations.toString());
        assertTrue(violations.get(0).contains("true/false"));
    }

    @Test
    void testSwitchEdgesMustMatchCasesPlusDefault() {
        var good = new Cfg(
                FUNC.id(),
                List.of(
                        new CfgNode.Start("s"),
                        new CfgNode.Switch("w", "switch (x)", List.of("1", "2"), null),
                        new CfgNode.End("e")),
                List.of(
                        new CfgEdge("s", "w", null),
                        new CfgEdge("w", "e", CfgEdge.caseLabel("1")),
                        new CfgEdge("w", "e", CfgEdge.caseLabel("2")),
                        new CfgEdge("w", "e", CfgEdge.DEFAULT)));
        assertEquals(List.of(), IrInvariants.check(doc(good)));

        var duplicated = new Cfg(
                FUNC.id(),
                good.nodes(),
                List.of(
                        new CfgEdge("s", "w", null),
                        new CfgEdge("w", "e", CfgEdge.caseLabel("1")),
                        new CfgEdge("w", "e", CfgEdge.caseLabel("1")),
                        new CfgEdge("w", "e", CfgEdge.DEFAULT)));
        assertFalse(IrInvariants.check(doc(duplicated)).isEmpty());
    }

    @Test
    void testStructuralViolationsAreReported() {
        var cfg = new Cfg(
                "f:missing@9#1",
                List.of(new CfgNode.Start("s"), new CfgNode.Start("s2"), new CfgNode.End("e")),
                List.of(new CfgEdge("e", "s", null), new CfgEdge("s", "nowhere", null)));
        var orphan = new OutlineNode("c:X@3#1", OutlineKind.CLASS, "X", "m:gone@1#1", RANGE, null, null, null);
        var ir = new IrDocument(
                List.of(MODULE, orphan),
                List.of(cfg),
                List.of(new CallEdge("f:ghost@1#1", "a.b", CallKind.MEMBER)),
                List.of(),
                List.of());

        var violations = String.join("\n", IrInvariants.check(ir));
        assertTrue(violations.contains("unknown parent"), violations);
        assertTrue(violations.contains("cfg for unknown function"), violations);
        assertTrue(violations.contains("exactly one start"), violations);
        assertTrue(violations.contains("start node has incoming"), violations);
        assertTrue(violations.contains("end node has outgoing"), violations);
        assertTrue(violations.contains("missing node"), violations);
        assertTrue(violations.contains("non-bare callee"), violations);
        assertTrue(violations.contains("unknown caller"), violations);
    }

    private static IrDocument doc(Cfg cfg) {
        return new IrDocument(List.of(MODULE, FUNC), List.of(cfg), List.of(), List.of(), List.of());
    }
}
