package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum OutlineKind {
    MODULE,
    NAMESPACE,
    CLASS,
    STRUCT,
    FUNCTION,
    METHOD;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OutlineKind fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    /** Prefix used in outline IDs: {@code f} for callables, otherwise the kind's first letter. */
    public String idPrefix() {
        return isCallable() ? "f" : wireName().substring(0, 1);
    }

    public boolean isCallable() {
        return this == FUNCTION || this == METHOD;
    }
}
