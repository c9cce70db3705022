package ai.algovision.analyzer;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Languages the engine has grammars for, keyed by the wire id callers declare on open. */
public enum Language {
    PYTHON("python", "Python", List.of("py", "pyi")),
    CSHARP("csharp", "C#", List.of("cs"));

    private final String id;
    private final String displayName;
    private final List<String> extensions;

    Language(String id, String displayName, List<String> extensions) {
        this.id = id;
        this.displayName = displayName;
        this.extensions = extensions;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public List<String> extensions() {
        return extensions;
    }

    public static Optional<Language> fromId(String id) {
        var normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l.id.equals(normalized) || l.extensions.contains(normalized))
                .findFirst();
    }
}
