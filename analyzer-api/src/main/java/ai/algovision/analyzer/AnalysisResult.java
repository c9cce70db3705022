package ai.algovision.analyzer;

import ai.algovision.ir.Diagnostic;
import ai.algovision.ir.IrDocument;
import java.util.List;

public record AnalysisResult(IrDocument ir, List<Diagnostic> diagnostics) {

    public AnalysisResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public static AnalysisResult failed(Diagnostic diagnostic) {
        return new AnalysisResult(IrDocument.empty(), List.of(diagnostic));
    }
}
