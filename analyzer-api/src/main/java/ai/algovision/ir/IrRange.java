package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A 1-based source range. Columns count UTF-16 code units, matching the text as the caller holds it.
 */
public record IrRange(
        @JsonProperty("startLine") int startLine,
        @JsonProperty("startCol") int startCol,
        @JsonProperty("endLine") int endLine,
        @JsonProperty("endCol") int endCol) {

    public IrRange {
        if (startLine < 1 || startCol < 1 || endLine < 1 || endCol < 1) {
            throw new IllegalArgumentException("Range positions are 1-based: " + startLine + ":" + startCol + "-"
                    + endLine + ":" + endCol);
        }
    }

    public static IrRange of(int startLine, int startCol, int endLine, int endCol) {
        return new IrRange(startLine, startCol, endLine, endCol);
    }

    /** Range covering the whole of {@code text}, from 1:1 to the end of its last line. */
    public static IrRange wholeText(String text) {
        int lastLine = 1;
        int lastLineStart = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lastLine++;
                lastLineStart = i + 1;
            }
        }
        return new IrRange(1, 1, lastLine, text.length() - lastLineStart + 1);
    }

    @JsonIgnore
    public Position start() {
        return new Position(startLine, startCol);
    }

    @JsonIgnore
    public Position end() {
        return new Position(endLine, endCol);
    }

    /** A 1-based (line, column) pair. */
    public record Position(int line, int column) {}
}
