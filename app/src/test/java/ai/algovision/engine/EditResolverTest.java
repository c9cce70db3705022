package ai.algovision.engine;

import static org.junit.jupiter.api.Assertions.*;

import ai.algovision.engine.EditResolver.BytePoint;
import java.util.List;
import org.junit.jupiter.api.Test;

public final class EditResolverTest {
    private static final String TEXT = "héllo\nwörld\n";

    @Test
    void testReplacementOnMultibyteLine() {
        var edit = new EditResolver(TEXT).resolve(TextEdit.replace(2, 1, 2, 6, "earth"));

        assertEquals(6, edit.startIndex());
        assertEquals(11, edit.endIndex());
        assertEquals(7, edit.startByte());
        assertEquals(13, edit.oldEndByte());
        assertEquals(12, edit.newEndByte());
        assertEquals(new BytePoint(1, 0), edit.startPoint());
        assertEquals(new BytePoint(1, 6), edit.oldEndPoint());
        assertEquals(new BytePoint(1, 5), edit.newEndPoint());
    }

    @Test
    void testMultiLineInsertion() {
        var edit = new EditResolver(TEXT).resolve(TextEdit.insert(1, 3, "a\nbé"));

        assertEquals(2, edit.startIndex());
        assertEquals(2, edit.endIndex());
        assertEquals(3, edit.startByte(), "h plus the two-byte é");
        assertEquals(3, edit.oldEndByte());
        assertEquals(8, edit.newEndByte());
        assertEquals(new BytePoint(0, 3), edit.startPoint());
        assertEquals(new BytePoint(1, 3), edit.newEndPoint());
    }

    @Test
    void testPositionsClampToText() {
        var resolver = new EditResolver(TEXT);
        assertEquals(5, resolver.offset(1, 99), "column past the line end clamps to the newline");
        assertEquals(TEXT.length(), resolver.offset(9, 1));
        assertEquals(0, resolver.offset(0, 4));
        assertEquals(12, resolver.offset(3, 1));

        var inverted = resolver.resolve(TextEdit.replace(2, 3, 1, 1, "x"));
        assertEquals(inverted.startIndex(), inverted.endIndex(), "an inverted range collapses to an insertion");
    }

    @Test
    void testBatchIsOrderedByDescendingStart() {
        var resolved = new EditResolver(TEXT).resolve(List.of(
                TextEdit.replace(1, 1, 1, 2, "H"), TextEdit.insert(2, 6, "!"), TextEdit.insert(1, 6, "?")));
        assertEquals(List.of(11, 5, 0), resolved.stream().map(EditResolver.ResolvedEdit::startIndex).toList());
    }

    @Test
    void testSurrogatePairsCountFourBytes() {
        var resolver = new EditResolver("a😀b");
        assertEquals(5, resolver.byteOffset(3));
        assertEquals(3, resolver.offset(1, 4));
    }
}
