package ai.algovision.treesitter;

import ai.algovision.analyzer.Language;

/** Thrown when the parser produces no usable tree for a document. */
public class ParseFailedException extends RuntimeException {
    private final Language language;

    public ParseFailedException(Language language, String message) {
        super(message);
        this.language = language;
    }

    public ParseFailedException(Language language, String message, Throwable cause) {
        super(message, cause);
        this.language = language;
    }

    public Language language() {
        return language;
    }
}
