package ai.algovision.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Replaces {@code range} with {@code text}. */
public record TextEdit(@JsonProperty("range") TextRange range, @JsonProperty("text") String text) {

    public TextEdit {
        text = text == null ? "" : text;
    }

    public static TextEdit replace(int startLine, int startColumn, int endLine, int endColumn, String text) {
        return new TextEdit(TextRange.of(startLine, startColumn, endLine, endColumn), text);
    }

    public static TextEdit insert(int line, int column, String text) {
        return replace(line, column, line, column, text);
    }
}
