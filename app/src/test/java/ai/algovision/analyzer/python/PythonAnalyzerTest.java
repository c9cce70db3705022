package ai.algovision.analyzer.python;

import static ai.algovision.analyzer.AnalyzerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import ai.algovision.analyzer.AnalyzeOptions;
import ai.algovision.analyzer.Language;
import ai.algovision.analyzer.cfg.CfgBuilder;
import ai.algovision.ir.CallEdge;
import ai.algovision.ir.CallKind;
import ai.algovision.ir.CfgEdge;
import ai.algovision.ir.CfgNode;
import ai.algovision.ir.Diagnostic;
import ai.algovision.ir.DiagnosticCode;
import ai.algovision.ir.ImportEntry;
import ai.algovision.ir.OutlineKind;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

public final class PythonAnalyzerTest {
    private final PythonAnalyzer analyzer = new PythonAnalyzer();

    @Test
    void testClassWithMethodAndBranch() {
        var source =
                """
                class Foo:
                    def bar(self, x, y):
                        if x > y:
                            return x
                        return y
                """;
        var ir = analyze(analyzer, source).ir();

        var module = ir.outline().get(0);
        assertEquals(OutlineKind.MODULE, module.kind());
        assertEquals("doc", module.name());
        assertNull(module.parentId());

        var foo = outline(ir, "Foo");
        assertEquals(OutlineKind.CLASS, foo.kind());
        assertEquals("c:Foo@1#1", foo.id());
        assertEquals(module.id(), foo.parentId());

        var bar = outline(ir, "bar");
        assertEquals(OutlineKind.METHOD, bar.kind());
        assertEquals("f:bar@2#1", bar.id());
        assertEquals(foo.id(), bar.parentId());
        assertEquals(List.of("self", "x", "y"), bar.params());

        var cfg = cfgOf(ir, "bar");
        var cond = node(cfg, "if x > y");
        assertInstanceOf(CfgNode.Cond.class, cond);
        var returnX = node(cfg, "return x");
        var returnY = node(cfg, "return y");
        assertTrue(hasEdge(cfg, cond, returnX, CfgEdge.TRUE));
        assertTrue(hasEdge(cfg, cond, returnY, CfgEdge.FALSE));
        assertTrue(hasEdge(cfg, returnX, end(cfg), null));
        assertTrue(hasEdge(cfg, returnY, end(cfg), null));

        assertEquals(1, ir.classes().size());
        assertEquals(List.of(bar.id()), ir.classes().get(0).methods());
        assertNull(ir.classes().get(0).bases());
    }

    @Test
    void testSingleLineClassAndMethodRecoversOnlyTheClass() {
        var source = "class Foo: def bar(self,x,y): if x>y: return x\n";
        assertTrue(parse(Language.PYTHON, source).hasError());

        var ir = analyze(analyzer, source).ir();
        assertEquals("c:Foo@1#1", outline(ir, "Foo").id());
        assertTrue(ir.outline().stream().noneMatch(n -> n.name().equals("bar")));
    }

    @Test
    void testElifChainAndElse() {
        var source =
                """
                def sign(n):
                    if n > 0:
                        r = 1
                    elif n < 0:
                        r = -1
                    else:
                        r = 0
                    return r
                """;
        var cfg = cfgOf(analyze(analyzer, source).ir(), "sign");
        var first = node(cfg, "if n > 0");
        var second = node(cfg, "elif n < 0");
        var ret = node(cfg, "return r");

        assertTrue(hasEdge(cfg, first, second, CfgEdge.FALSE));
        assertTrue(hasEdge(cfg, second, node(cfg, "r = -1"), CfgEdge.TRUE));
        assertTrue(hasEdge(cfg, second, node(cfg, "r = 0"), CfgEdge.FALSE));
        for (var label : List.of("r = 1", "r = -1", "r = 0")) {
            assertTrue(hasEdge(cfg, node(cfg, label), ret, null), label + " flows to return");
        }
    }

    @Test
    void testLoopWithBreakContinueAndElse() {
        var source =
                """
                def total(items):
                    acc = 0
                    for item in items:
                        if item < 0:
                            continue
                        if item > 100:
                            break
                        acc += item
                    else:
                        print("done")
                    return acc
                """;
        var cfg = cfgOf(analyze(analyzer, source).ir(), "total");
        var loop = node(cfg, "for item in items");
        var cont = node(cfg, "continue");
        var brk = node(cfg, "break");
        var add = node(cfg, "acc += item");
        var done = node(cfg, "print(\"done\")");
        var ret = node(cfg, "return acc");

        assertInstanceOf(CfgNode.Cond.class, loop);
        assertTrue(hasEdge(cfg, cont, loop, null), "continue jumps to the loop test");
        assertTrue(hasEdge(cfg, add, loop, null), "body falls back to the loop test");
        assertTrue(hasEdge(cfg, loop, done, CfgEdge.FALSE), "else runs when the loop is exhausted");
        assertTrue(hasEdge(cfg, brk, ret, null), "break skips the else clause");
        assertTrue(hasEdge(cfg, done, ret, null));
    }

    @Test
    void testWhileLoop() {
        var source =
                """
                def countdown(n):
                    while n > 0:
                        n -= 1
                """;
        var cfg = cfgOf(analyze(analyzer, source).ir(), "countdown");
        var loop = node(cfg, "while n > 0");
        var step = node(cfg, "n -= 1");
        assertTrue(hasEdge(cfg, loop, step, CfgEdge.TRUE));
        assertTrue(hasEdge(cfg, step, loop, null));
        assertTrue(hasEdge(cfg, loop, end(cfg), CfgEdge.FALSE));
    }

    @Test
    void testTryExceptFinally() {
        var source =
                """
                def risky():
                    try:
                        work()
                    except ValueError as e:
                        handle(e)
                    finally:
                        cleanup()
                """;
        var ir = analyze(analyzer, source).ir();
        var cfg = cfgOf(ir, "risky");
        var tryNode = node(cfg, "try");
        var handler = node(cfg, "except ValueError as e");
        var fin = node(cfg, "finally");

        assertTrue(hasEdge(cfg, tryNode, node(cfg, "work()"), null));
        assertTrue(hasEdge(cfg, tryNode, handler, "except"));
        assertTrue(hasEdge(cfg, node(cfg, "work()"), fin, null));
        assertTrue(hasEdge(cfg, node(cfg, "handle(e)"), fin, null));
        assertTrue(hasEdge(cfg, fin, node(cfg, "cleanup()"), null));

        var risky = outline(ir, "risky").id();
        assertEquals(
                List.of(
                        new CallEdge(risky, "work", CallKind.DIRECT),
                        new CallEdge(risky, "handle", CallKind.DIRECT),
                        new CallEdge(risky, "cleanup", CallKind.DIRECT)),
                ir.calls());
    }

    @Test
    void testWithStatementAndNestedFunction() {
        var source =
                """
                def outer(path):
                    with open(path) as f:
                        data = f.read()
                    def inner():
                        return data
                    return inner
                """;
        var ir = analyze(analyzer, source).ir();
        var cfg = cfgOf(ir, "outer");
        var with = node(cfg, "with open(path) as f");
        assertTrue(hasEdge(cfg, with, node(cfg, "data = f.read()"), null));
        assertTrue(hasEdge(cfg, node(cfg, "data = f.read()"), node(cfg, "def inner()"), null));

        var inner = outline(ir, "inner");
        assertEquals(OutlineKind.FUNCTION, inner.kind());
        assertEquals(outline(ir, "outer").id(), inner.parentId());
        assertEquals(List.of(), inner.params());
        assertNotNull(cfgOf(ir, "inner"));
    }

    @Test
    void testParameterShapes() {
        var source =
                """
                def f(a, b=1, *args, c: int, d: str = "x", **kwargs):
                    pass
                """;
        var f = outline(analyze(analyzer, source).ir(), "f");
        assertEquals(List.of("a", "b", "*args", "c", "d", "**kwargs"), f.params());
    }

    @Test
    void testBasesAndDecoratedMembers() {
        var source =
                """
                class Child(Base, mod.Mixin, metaclass=Meta):
                    @property
                    def value(self):
                        return 1

                    @staticmethod
                    def make():
                        return Child()
                """;
        var ir = analyze(analyzer, source).ir();
        var child = ir.classes().get(0);
        assertEquals("Child", child.name());
        assertEquals(List.of("Base", "mod.Mixin"), child.bases());
        assertEquals(
                List.of(outline(ir, "value").id(), outline(ir, "make").id()), child.methods());
        assertEquals(OutlineKind.METHOD, outline(ir, "make").kind());
    }

    @Test
    void testImports() {
        var source =
                """
                import os, sys as system
                from collections import OrderedDict, defaultdict as dd
                from . import sibling
                from ..pkg import (a,
                    b)
                """;
        assertEquals(
                List.of(
                        ImportEntry.of("os"),
                        ImportEntry.aliased("sys", "system"),
                        ImportEntry.of("collections.OrderedDict"),
                        ImportEntry.aliased("collections.defaultdict", "dd"),
                        ImportEntry.of(".sibling"),
                        ImportEntry.of("..pkg.a"),
                        ImportEntry.of("..pkg.b")),
                analyze(analyzer, source).ir().imports());
    }

    @Test
    void testCallsAreAttributedToEnclosingFunction() {
        var source =
                """
                setup()

                class Service:
                    def run(self, items):
                        self.prepare()
                        for item in items:
                            print(item.name.upper())
                        return (lambda: 1)()
                """;
        var ir = analyze(analyzer, source).ir();
        var run = outline(ir, "run").id();
        assertEquals(
                List.of(
                        new CallEdge(run, "prepare", CallKind.MEMBER),
                        new CallEdge(run, "print", CallKind.DIRECT),
                        new CallEdge(run, "upper", CallKind.MEMBER)),
                ir.calls(),
                "module-level calls and non-identifier callees are dropped");
    }

    @Test
    void testOptionsDisableCallsAndClasses() {
        var source =
                """
                class A:
                    def m(self):
                        helper()
                """;
        var result = analyze(analyzer, source, new AnalyzeOptions(null, false, false));
        assertEquals(List.of(), result.ir().calls());
        assertEquals(List.of(), result.ir().classes());
        assertEquals(3, result.ir().outline().size());
    }

    @Test
    void testMatchStatementIsReportedUnsupported() {
        var source =
                """
                def route(cmd):
                    match cmd:
                        case "go":
                            return 1
                    return 0
                """;
        var result = analyze(analyzer, source);
        var unsupported = result.diagnostics().stream()
                .filter(d -> d.code() == DiagnosticCode.UNSUPPORTED_CONSTRUCT)
                .toList();
        assertEquals(1, unsupported.size(), result.diagnostics().toString());
        assertEquals(2, unsupported.get(0).range().startLine());

        var cfg = cfgOf(result.ir(), "route");
        assertEquals(
                1,
                nodesOfType(cfg, CfgNode.Stmt.class).stream()
                        .filter(s -> s.label().startsWith("match cmd:"))
                        .count());
    }

    @Test
    void testNodeCapStopsAtDeclarationBoundary() {
        var source = IntStream.range(0, 20)
                .mapToObj(i -> "def f" + i + "():\n    x = " + i + "\n")
                .collect(Collectors.joining());
        var result = analyze(analyzer, source, AnalyzeOptions.withMaxNodes(10));

        assertTrue(result.ir().nodeCount() <= 11, "node count " + result.ir().nodeCount());
        assertEquals(2, result.ir().cfgs().size());
        var cap = capDiagnostic(result.diagnostics());
        assertEquals(10, cap.details().get("maxNodes"));
        assertEquals(18, cap.details().get("skipped"));
    }

    @Test
    void testNodeCapTruncatesInsideBody() {
        var source = "def long():\n"
                + IntStream.range(0, 30).mapToObj(i -> "    x" + i + " = " + i + "\n").collect(Collectors.joining());
        var result = analyze(analyzer, source, AnalyzeOptions.withMaxNodes(10));

        assertEquals(11, result.ir().nodeCount());
        var cfg = cfgOf(result.ir(), "long");
        var placeholder = node(cfg, CfgBuilder.TRUNCATION_LABEL);
        assertTrue(hasEdge(cfg, placeholder, end(cfg), null));
        assertTrue((int) capDiagnostic(result.diagnostics()).details().get("skipped") > 0);
    }

    @Test
    void testAnalysisIsDeterministic() {
        var source =
                """
                class A:
                    def a(self): pass
                    def b(self): return self.a()
                def c(): pass
                """;
        assertEquals(analyze(analyzer, source).ir(), analyze(analyzer, source).ir());
    }

    @Test
    void testEmptyDocument() {
        var ir = analyze(analyzer, "").ir();
        assertEquals(1, ir.outline().size());
        assertEquals(List.of(), ir.cfgs());
    }

    private static Diagnostic capDiagnostic(List<Diagnostic> diagnostics) {
        return diagnostics.stream()
                .filter(d -> d.code() == DiagnosticCode.NODE_CAP_REACHED)
                .findFirst()
                .orElseThrow(() -> new AssertionError("no cap diagnostic in " + diagnostics));
    }
}
