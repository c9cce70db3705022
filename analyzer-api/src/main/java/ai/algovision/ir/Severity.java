package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Diagnostic severity. Only {@link #ERROR} is treated as blocking by consumers. */
public enum Severity {
    INFO,
    WARN,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    public boolean isBlocking() {
        return this == ERROR;
    }
}
