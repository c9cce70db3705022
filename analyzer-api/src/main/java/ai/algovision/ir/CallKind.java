package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CallKind {
    /** Bare-name call, e.g. {@code helper()}. */
    DIRECT,
    /** Call through a qualifier, e.g. {@code self.helper()} or {@code Console.WriteLine()}. */
    MEMBER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CallKind fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
