package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportEntry(@JsonProperty("name") String name, @JsonProperty("alias") @Nullable String alias) {

    public static ImportEntry of(String name) {
        return new ImportEntry(name, null);
    }

    public static ImportEntry aliased(String name, String alias) {
        return new ImportEntry(name, alias);
    }
}
