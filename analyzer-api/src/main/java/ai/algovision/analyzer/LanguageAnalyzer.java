package ai.algovision.analyzer;

/**
 * Builds IR for one language from a syntax tree. Implementations are stateless between calls and safe to share across
 * threads; all per-analysis state lives in the call.
 */
public interface LanguageAnalyzer {

    Language language();

    AnalysisResult analyze(AnalysisContext context);
}
