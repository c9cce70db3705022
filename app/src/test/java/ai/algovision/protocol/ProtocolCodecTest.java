package ai.algovision.protocol;

import static org.junit.jupiter.api.Assertions.*;

import ai.algovision.engine.TextEdit;
import ai.algovision.ir.Diagnostic;
import ai.algovision.ir.IrBuilder;
import ai.algovision.ir.IrRange;
import ai.algovision.ir.OutlineKind;
import java.util.List;
import org.junit.jupiter.api.Test;

public final class ProtocolCodecTest {
    private final ProtocolCodec codec = new ProtocolCodec();

    @Test
    void testDecodesEveryRequestKind() {
        assertEquals(new EngineRequest.Init(), codec.decode("{\"kind\":\"init\"}"));
        assertEquals(
                new EngineRequest.OpenDoc("a.py", "python", "x = 1\n", 3),
                codec.decode("{\"kind\":\"openDoc\",\"docId\":\"a.py\",\"language\":\"python\","
                        + "\"text\":\"x = 1\\n\",\"version\":3}"));
        assertEquals(new EngineRequest.Cancel("r1"), codec.decode("{\"kind\":\"cancel\",\"requestId\":\"r1\"}"));
        assertEquals(new EngineRequest.CloseDoc("a.py"), codec.decode("{\"kind\":\"closeDoc\",\"docId\":\"a.py\"}"));
    }

    @Test
    void testDecodesAnalyzeWithOptions() {
        var request = (EngineRequest.Analyze) codec.decode("{\"kind\":\"analyze\",\"docId\":\"a.py\",\"requestId\":\"r\","
                + "\"options\":{\"maxNodes\":50,\"includeCallGraph\":false},\"extra\":true}");
        assertEquals("r", request.requestId());
        assertEquals(50, request.options().effectiveMaxNodes());
        assertFalse(request.options().callGraphEnabled());
        assertTrue(request.options().classDiagramEnabled());
    }

    @Test
    void testNonPositiveCapStillDecodes() {
        var request = (EngineRequest.Analyze) codec.decode(
                "{\"kind\":\"analyze\",\"docId\":\"a.py\",\"requestId\":\"r\",\"options\":{\"maxNodes\":0}}");
        assertEquals("r", request.requestId());
        assertEquals("maxNodes must be positive, got 0", request.options().validationError());
    }

    @Test
    void testDecodesApplyEdits() {
        var request = (EngineRequest.ApplyEdits) codec.decode("{\"kind\":\"applyEdits\",\"docId\":\"a.py\",\"version\":2,"
                + "\"edits\":[{\"range\":{\"startLine\":1,\"startColumn\":1,\"endLine\":1,\"endColumn\":2},"
                + "\"text\":\"y\"}],\"analyze\":true}");
        assertEquals(List.of(TextEdit.replace(1, 1, 1, 2, "y")), request.edits());
        assertTrue(request.analyzeAfter());
        assertEquals("a.py@2", request.effectiveRequestId());

        var bare = (EngineRequest.ApplyEdits) codec.decode("{\"kind\":\"applyEdits\",\"docId\":\"a.py\",\"version\":3}");
        assertEquals(List.of(), bare.edits());
        assertFalse(bare.analyzeAfter());
    }

    @Test
    void testMalformedLinesAreRejected() {
        assertThrows(ProtocolException.class, () -> codec.decode("{not json"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"kind\":\"explode\"}"));
        assertThrows(ProtocolException.class, () -> codec.decode("{\"docId\":\"a.py\"}"));
        assertThrows(ProtocolException.class, () -> codec.decode("null"));
    }

    @Test
    void testEncodesNotices() throws Exception {
        var cancelled = codec.mapper().readTree(codec.encode(new EngineResponse.Cancelled("r1")));
        assertEquals("cancelled", cancelled.get("kind").asText());
        assertEquals("r1", cancelled.get("requestId").asText());

        var init = codec.mapper().readTree(codec.encode(new EngineResponse.InitDone(42)));
        assertEquals("init:done", init.get("kind").asText());
        assertEquals(42, init.get("coldStartMs").asLong());
    }

    @Test
    void testEncodesResult() throws Exception {
        var builder = new IrBuilder();
        builder.addOutlineNode(OutlineKind.MODULE, "a.py", null, IrRange.of(1, 1, 1, 6));
        var result = new EngineResponse.Result(
                "r1",
                "a.py",
                "python",
                builder.build(),
                List.of(Diagnostic.nodeCapReached(1, 10)),
                new EngineResponse.Perf(1.5, 2.0, 4.0));

        var json = codec.mapper().readTree(codec.encode(result));
        assertEquals("result", json.get("kind").asText());
        assertEquals("module", json.get("ir").get("outline").get(0).get("kind").asText());
        assertFalse(json.get("ir").get("outline").get(0).has("parentId"));
        assertTrue(json.get("ir").get("cfgs").isArray());
        assertEquals("NODE_CAP_REACHED", json.get("diagnostics").get(0).get("code").asText());
        assertEquals(4.0, json.get("perf").get("totalMs").asDouble());
    }
}
