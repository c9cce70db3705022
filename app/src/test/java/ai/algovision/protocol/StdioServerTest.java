package ai.algovision.protocol;

import static org.junit.jupiter.api.Assertions.*;

import ai.algovision.analyzer.AnalyzerRegistry;
import ai.algovision.engine.AnalysisEngine;
import ai.algovision.treesitter.ParserRuntime;
import ai.algovision.util.ExecutorServiceUtil;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

public final class StdioServerTest {

    @Test
    void testServesRequestsAndSkipsMalformedLines() throws Exception {
        var input = String.join(
                "\n",
                "{\"kind\":\"init\"}",
                "",
                "this is not json",
                "{\"kind\":\"openDoc\",\"docId\":\"a.py\",\"language\":\"python\",\"text\":\"def f():\\n    g()\\n\","
                        + "\"version\":1}",
                "{\"kind\":\"analyze\",\"docId\":\"a.py\",\"requestId\":\"r1\"}");
        var bytes = new ByteArrayOutputStream();
        var codec = new ProtocolCodec();
        var server = new StdioServer(codec, new PrintStream(bytes, true, StandardCharsets.UTF_8));
        var executor = ExecutorServiceUtil.newFixedThreadExecutor(2, "stdio-test-");
        try {
            server.serve(
                    new BufferedReader(new StringReader(input)),
                    s -> new AnalysisEngine(new ParserRuntime(), AnalyzerRegistry.defaults(), executor, 2000, s::send));
        } finally {
            executor.shutdownNow();
        }

        var lines = bytes.toString(StandardCharsets.UTF_8).lines().toList();
        assertEquals(2, lines.size(), lines.toString());
        assertEquals("init:done", codec.mapper().readTree(lines.get(0)).get("kind").asText());
        var result = codec.mapper().readTree(lines.get(1));
        assertEquals("result", result.get("kind").asText());
        assertEquals("r1", result.get("requestId").asText());
        assertEquals("g", result.get("ir").get("calls").get(0).get("calleeName").asText());
    }
}
