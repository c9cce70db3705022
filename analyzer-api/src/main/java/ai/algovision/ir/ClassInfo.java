package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Class-table entry.
 *
 * @param id outline id of the class
 * @param methods outline ids of the methods declared directly in the class
 * @param bases textual base-type names; null when the class declares none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassInfo(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("methods") List<String> methods,
        @JsonProperty("bases") @Nullable List<String> bases) {

    public ClassInfo {
        methods = List.copyOf(methods);
        bases = bases == null || bases.isEmpty() ? null : List.copyOf(bases);
    }
}
