package ai.algovision.protocol;

import ai.algovision.analyzer.AnalyzeOptions;
import ai.algovision.engine.TextEdit;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Messages the caller sends to the engine, discriminated by {@code kind}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EngineRequest.Init.class, name = "init"),
    @JsonSubTypes.Type(value = EngineRequest.OpenDoc.class, name = "openDoc"),
    @JsonSubTypes.Type(value = EngineRequest.ApplyEdits.class, name = "applyEdits"),
    @JsonSubTypes.Type(value = EngineRequest.Analyze.class, name = "analyze"),
    @JsonSubTypes.Type(value = EngineRequest.Cancel.class, name = "cancel"),
    @JsonSubTypes.Type(value = EngineRequest.CloseDoc.class, name = "closeDoc")
})
public sealed interface EngineRequest
        permits EngineRequest.Init,
                EngineRequest.OpenDoc,
                EngineRequest.ApplyEdits,
                EngineRequest.Analyze,
                EngineRequest.Cancel,
                EngineRequest.CloseDoc {

    record Init() implements EngineRequest {}

    record OpenDoc(
            @JsonProperty("docId") String docId,
            @JsonProperty("language") String language,
            @JsonProperty("text") String text,
            @JsonProperty("version") int version)
            implements EngineRequest {}

    /**
     * @param analyze run an analysis once the edits are applied
     * @param requestId id for that analysis; defaults to {@code {docId}@{version}}
     */
    record ApplyEdits(
            @JsonProperty("docId") String docId,
            @JsonProperty("version") int version,
            @JsonProperty("edits") @Nullable List<TextEdit> edits,
            @JsonProperty("analyze") @Nullable Boolean analyze,
            @JsonProperty("options") @Nullable AnalyzeOptions options,
            @JsonProperty("requestId") @Nullable String requestId)
            implements EngineRequest {

        public ApplyEdits {
            edits = edits == null ? List.of() : List.copyOf(edits);
        }

        public boolean analyzeAfter() {
            return analyze != null && analyze;
        }

        public String effectiveRequestId() {
            return requestId != null && !requestId.isBlank() ? requestId : docId + "@" + version;
        }
    }

    record Analyze(
            @JsonProperty("docId") String docId,
            @JsonProperty("requestId") String requestId,
            @JsonProperty("options") @Nullable AnalyzeOptions options)
            implements EngineRequest {}

    record Cancel(@JsonProperty("requestId") String requestId) implements EngineRequest {}

    record CloseDoc(@JsonProperty("docId") String docId) implements EngineRequest {}
}
