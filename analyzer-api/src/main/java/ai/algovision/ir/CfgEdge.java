package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CfgEdge(
        @JsonProperty("from") String from, @JsonProperty("to") String to, @JsonProperty("label") @Nullable String label) {

    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String DEFAULT = "default";

    public static String caseLabel(String caseValue) {
        return "case: " + caseValue;
    }
}
