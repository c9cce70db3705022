package ai.algovision.engine;

import ai.algovision.util.TextCanonicalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Translates 1-based line/column edits into character offsets, UTF-8 byte offsets and byte-based tree points.
 *
 * <p>All edits of one batch are resolved against the same text and returned in descending start order, so applying
 * them one after another never shifts the offsets of an edit still to come.
 */
final class EditResolver {

    /** A zero-based row and UTF-8 byte column, as tree-sitter counts them. */
    record BytePoint(int row, int column) {}

    record ResolvedEdit(
            int startIndex,
            int endIndex,
            String text,
            int startByte,
            int oldEndByte,
            int newEndByte,
            BytePoint startPoint,
            BytePoint oldEndPoint,
            BytePoint newEndPoint) {}

    private final String text;
    private final int[] lineStarts;

    EditResolver(String text) {
        this.text = text;
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    List<ResolvedEdit> resolve(List<TextEdit> edits) {
        var resolved = new ArrayList<ResolvedEdit>(edits.size());
        for (var edit : edits) {
            resolved.add(resolve(edit));
        }
        resolved.sort(Comparator.comparingInt(ResolvedEdit::startIndex).reversed());
        return resolved;
    }

    ResolvedEdit resolve(TextEdit edit) {
        var range = edit.range();
        int start = offset(range.startLine(), range.startColumn());
        int end = Math.max(start, offset(range.endLine(), range.endColumn()));
        var startPoint = point(start);
        var oldEndPoint = point(end);
        int startByte = byteOffset(start);
        int oldEndByte = byteOffset(end);
        int newEndByte = startByte + TextCanonicalizer.utf8Length(edit.text(), 0, edit.text().length());
        return new ResolvedEdit(
                start,
                end,
                edit.text(),
                startByte,
                oldEndByte,
                newEndByte,
                startPoint,
                oldEndPoint,
                newEndPoint(startPoint, edit.text()));
    }

    /** Character offset of a 1-based position; lines and columns past the end clamp to the text's extent. */
    int offset(int line, int column) {
        if (line < 1) {
            return 0;
        }
        if (line > lineStarts.length) {
            return text.length();
        }
        int lineStart = lineStarts[line - 1];
        int lineEnd = line < lineStarts.length ? lineStarts[line] - 1 : text.length();
        return Math.min(lineStart + Math.max(0, column - 1), lineEnd);
    }

    int byteOffset(int charIndex) {
        return TextCanonicalizer.utf8Length(text, 0, charIndex);
    }

    private BytePoint point(int charIndex) {
        int row = lineOf(charIndex);
        return new BytePoint(row, TextCanonicalizer.utf8Length(text, lineStarts[row], charIndex));
    }

    private int lineOf(int charIndex) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= charIndex) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    private static BytePoint newEndPoint(BytePoint start, String inserted) {
        int lastNewline = inserted.lastIndexOf('\n');
        if (lastNewline < 0) {
            int insertedBytes = TextCanonicalizer.utf8Length(inserted, 0, inserted.length());
            return new BytePoint(start.row(), start.column() + insertedBytes);
        }
        int newlines = 0;
        for (int i = 0; i < inserted.length(); i++) {
            if (inserted.charAt(i) == '\n') {
                newlines++;
            }
        }
        return new BytePoint(
                start.row() + newlines,
                TextCanonicalizer.utf8Length(inserted, lastNewline + 1, inserted.length()));
    }
}
