package ai.algovision.protocol;

import ai.algovision.ir.Diagnostic;
import ai.algovision.ir.IrDocument;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/** Messages the engine sends back, discriminated by {@code kind}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EngineResponse.InitDone.class, name = "init:done"),
    @JsonSubTypes.Type(value = EngineResponse.Result.class, name = "result"),
    @JsonSubTypes.Type(value = EngineResponse.Cancelled.class, name = "cancelled")
})
public sealed interface EngineResponse
        permits EngineResponse.InitDone, EngineResponse.Result, EngineResponse.Cancelled {

    String INIT_REQUEST_ID = "init";

    record InitDone(@JsonProperty("coldStartMs") long coldStartMs) implements EngineResponse {}

    record Result(
            @JsonProperty("requestId") String requestId,
            @JsonProperty("docId") String docId,
            @JsonProperty("language") String language,
            @JsonProperty("ir") IrDocument ir,
            @JsonProperty("diagnostics") List<Diagnostic> diagnostics,
            @JsonProperty("perf") Perf perf)
            implements EngineResponse {

        public Result {
            diagnostics = List.copyOf(diagnostics);
        }

        /** Failure result carrying empty IR and the single diagnostic. */
        public static Result failed(String requestId, String docId, String language, Diagnostic diagnostic, Perf perf) {
            return new Result(requestId, docId, language, IrDocument.empty(), List.of(diagnostic), perf);
        }
    }

    record Cancelled(@JsonProperty("requestId") String requestId) implements EngineResponse {}

    /** Phase timings in milliseconds. */
    record Perf(
            @JsonProperty("parseMs") double parseMs,
            @JsonProperty("irMs") double irMs,
            @JsonProperty("totalMs") double totalMs) {

        public static final Perf ZERO = new Perf(0, 0, 0);
    }
}
