package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A node of a per-function control-flow graph. Serialized with a {@code type} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = CfgNode.Start.class, name = "start"),
    @JsonSubTypes.Type(value = CfgNode.End.class, name = "end"),
    @JsonSubTypes.Type(value = CfgNode.Stmt.class, name = "stmt"),
    @JsonSubTypes.Type(value = CfgNode.Cond.class, name = "cond"),
    @JsonSubTypes.Type(value = CfgNode.Switch.class, name = "switch")
})
public sealed interface CfgNode permits CfgNode.Start, CfgNode.End, CfgNode.Stmt, CfgNode.Cond, CfgNode.Switch {
    String id();

    record Start(@JsonProperty("id") String id) implements CfgNode {}

    record End(@JsonProperty("id") String id) implements CfgNode {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Stmt(
            @JsonProperty("id") String id,
            @JsonProperty("label") String label,
            @JsonProperty("range") @Nullable IrRange range)
            implements CfgNode {}

    /** Two-way branch; always has exactly a {@code true} and a {@code false} outgoing edge. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Cond(
            @JsonProperty("id") String id,
            @JsonProperty("label") String label,
            @JsonProperty("range") @Nullable IrRange range)
            implements CfgNode {}

    /** Multi-way branch; one {@code case: X} edge per entry of {@code cases} plus one {@code default} edge. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Switch(
            @JsonProperty("id") String id,
            @JsonProperty("label") String label,
            @JsonProperty("cases") List<String> cases,
            @JsonProperty("range") @Nullable IrRange range)
            implements CfgNode {

        public Switch {
            cases = List.copyOf(cases);
        }
    }
}
