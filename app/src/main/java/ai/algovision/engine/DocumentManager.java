package ai.algovision.engine;

import ai.algovision.util.TextCanonicalizer;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSInputEdit;
import org.treesitter.TSPoint;

/** Holds the open documents and keeps each one's text and parse tree in step with incoming edits. */
public final class DocumentManager {
    private static final Logger logger = LogManager.getLogger(DocumentManager.class);

    private final Map<String, DocumentState> documents = new ConcurrentHashMap<>();

    /** Opens or re-opens {@code docId}; any previous state and tree are discarded. */
    public DocumentState open(String docId, String languageId, String text, int version) {
        var state = new DocumentState(docId, languageId, TextCanonicalizer.stripUtf8Bom(text), version);
        var previous = documents.put(docId, state);
        logger.debug("{} {} (language {}, version {})", previous == null ? "Opened" : "Re-opened", docId, languageId,
                version);
        return state;
    }

    /**
     * Applies {@code edits} and commits {@code version}. Ignored when the document is unknown or {@code version} is not
     * newer than the stored one.
     *
     * @return true if the edits were applied
     */
    public boolean applyEdits(String docId, int version, List<TextEdit> edits) {
        var state = documents.get(docId);
        if (state == null) {
            logger.debug("Ignoring edits for unknown document {}", docId);
            return false;
        }
        if (version <= state.version()) {
            logger.debug("Ignoring stale edits for {}: version {} <= {}", docId, version, state.version());
            return false;
        }
        if (edits.isEmpty()) {
            state.commitVersion(version);
            return true;
        }

        var text = state.text();
        var buffer = new StringBuilder(text);
        var tree = state.tree();
        for (var edit : new EditResolver(text).resolve(edits)) {
            buffer.replace(edit.startIndex(), edit.endIndex(), edit.text());
            if (tree != null) {
                tree.edit(new TSInputEdit(
                        edit.startByte(),
                        edit.oldEndByte(),
                        edit.newEndByte(),
                        toPoint(edit.startPoint()),
                        toPoint(edit.oldEndPoint()),
                        toPoint(edit.newEndPoint())));
            }
        }
        state.commit(buffer.toString(), version);
        logger.trace("Applied {} edits to {}, now version {}", edits.size(), docId, version);
        return true;
    }

    public void close(String docId) {
        if (documents.remove(docId) != null) {
            logger.debug("Closed {}", docId);
        }
    }

    public @Nullable DocumentState get(String docId) {
        return documents.get(docId);
    }

    private static TSPoint toPoint(EditResolver.BytePoint point) {
        return new TSPoint(point.row(), point.column());
    }
}
