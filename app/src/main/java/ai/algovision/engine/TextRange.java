package ai.algovision.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

/** 1-based range of an incoming edit; columns count UTF-16 code units. */
public record TextRange(
        @JsonProperty("startLine") int startLine,
        @JsonProperty("startColumn") int startColumn,
        @JsonProperty("endLine") int endLine,
        @JsonProperty("endColumn") int endColumn) {

    public static TextRange of(int startLine, int startColumn, int endLine, int endColumn) {
        return new TextRange(startLine, startColumn, endLine, endColumn);
    }
}
