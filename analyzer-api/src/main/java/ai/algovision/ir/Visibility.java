package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Visibility {
    PUBLIC,
    PROTECTED,
    INTERNAL,
    PRIVATE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Visibility fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
