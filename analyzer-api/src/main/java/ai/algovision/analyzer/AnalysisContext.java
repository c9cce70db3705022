package ai.algovision.analyzer;

/**
 * Everything a {@link LanguageAnalyzer} needs for one analysis. The syntax tree is a read-only snapshot; analyzers
 * never see or mutate the live document.
 */
public record AnalysisContext(
        SyntaxTree tree, String docId, Language language, AnalyzeOptions options, CancellationToken cancellation) {

    public String text() {
        return tree.text();
    }
}
