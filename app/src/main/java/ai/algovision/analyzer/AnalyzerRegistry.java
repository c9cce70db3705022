package ai.algovision.analyzer;

import ai.algovision.analyzer.csharp.CSharpAnalyzer;
import ai.algovision.analyzer.python.PythonAnalyzer;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Maps each {@link Language} to the analyzer that builds its IR. */
public final class AnalyzerRegistry {
    private final Map<Language, LanguageAnalyzer> analyzers = new EnumMap<>(Language.class);

    public AnalyzerRegistry(Collection<? extends LanguageAnalyzer> analyzers) {
        for (var analyzer : analyzers) {
            var previous = this.analyzers.put(analyzer.language(), analyzer);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate analyzer for " + analyzer.language().displayName());
            }
        }
    }

    public static AnalyzerRegistry defaults() {
        return new AnalyzerRegistry(List.of(new PythonAnalyzer(), new CSharpAnalyzer()));
    }

    public Optional<LanguageAnalyzer> find(Language language) {
        return Optional.ofNullable(analyzers.get(language));
    }
}
