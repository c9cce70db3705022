package ai.algovision.ir;

public enum DiagnosticCode {
    /** The grammar could not parse the text, or the tree contains error nodes. */
    TS_PARSE_ERROR,
    /** Traversal stopped at the configured {@code maxNodes}. */
    NODE_CAP_REACHED,
    /** Recognized syntax that the visitor does not model, e.g. pattern matching. */
    UNSUPPORTED_CONSTRUCT,
    /** Missing analyzer, unknown document or an unexpected failure. */
    INTERNAL,
    CANCELLED
}
