package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A declaration in the outline tree.
 *
 * @param id document-unique identifier, see {@link IrBuilder#addOutlineNode}
 * @param parentId id of the nearest enclosing declaration; null only for the module root
 * @param params parameter names for functions and methods
 * @param genericParams type-parameter names, where the language has them
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutlineNode(
        @JsonProperty("id") String id,
        @JsonProperty("kind") OutlineKind kind,
        @JsonProperty("name") String name,
        @JsonProperty("parentId") @Nullable String parentId,
        @JsonProperty("range") IrRange range,
        @JsonProperty("params") @Nullable List<String> params,
        @JsonProperty("visibility") @Nullable Visibility visibility,
        @JsonProperty("genericParams") @Nullable List<String> genericParams) {

    public OutlineNode {
        params = params == null ? null : List.copyOf(params);
        genericParams = genericParams == null ? null : List.copyOf(genericParams);
    }
}
