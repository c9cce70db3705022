package ai.algovision.engine;

import org.jetbrains.annotations.Nullable;
import org.treesitter.TSTree;

/**
 * The live state of one open document. Only the document's serial lane touches an instance, so it needs no locking.
 */
public final class DocumentState {
    private final String docId;
    private final String languageId;
    private int version;
    private String text;
    private @Nullable TSTree tree;

    DocumentState(String docId, String languageId, String text, int version) {
        this.docId = docId;
        this.languageId = languageId;
        this.text = text;
        this.version = version;
    }

    public String docId() {
        return docId;
    }

    /** Language as declared by the caller on open; may name a language the engine has no grammar for. */
    public String languageId() {
        return languageId;
    }

    public int version() {
        return version;
    }

    public String text() {
        return text;
    }

    /** Last parse tree, already edited in step with {@link #text()}; null before the first parse. */
    public @Nullable TSTree tree() {
        return tree;
    }

    void setTree(@Nullable TSTree tree) {
        this.tree = tree;
    }

    void commit(String text, int version) {
        this.text = text;
        this.version = version;
    }

    void commitVersion(int version) {
        this.version = version;
    }

    @Override
    public String toString() {
        return "DocumentState[" + docId + "@" + version + ", " + languageId + ", " + text.length() + " chars]";
    }
}
