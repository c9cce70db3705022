package ai.algovision.analyzer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * Per-request analysis options as they arrive on the wire; absent fields take the engine defaults.
 *
 * @param maxNodes cap on outline plus CFG nodes produced in one traversal
 * @param includeClassDiagram whether the class table is populated
 * @param includeCallGraph whether the call sweep runs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyzeOptions(
        @JsonProperty("maxNodes") @Nullable Integer maxNodes,
        @JsonProperty("includeClassDiagram") @Nullable Boolean includeClassDiagram,
        @JsonProperty("includeCallGraph") @Nullable Boolean includeCallGraph) {

    public static final int DEFAULT_MAX_NODES = 2000;

    private static final AnalyzeOptions DEFAULTS = new AnalyzeOptions(null, null, null);

    public static AnalyzeOptions defaults() {
        return DEFAULTS;
    }

    public static AnalyzeOptions withMaxNodes(int maxNodes) {
        return new AnalyzeOptions(maxNodes, null, null);
    }

    /** Returns these options with {@code maxNodes} filled from {@code defaultMaxNodes} when absent. */
    public AnalyzeOptions withDefaultMaxNodes(int defaultMaxNodes) {
        return maxNodes != null ? this : new AnalyzeOptions(defaultMaxNodes, includeClassDiagram, includeCallGraph);
    }

    /** Why these options cannot be used, or null when they can. */
    public @Nullable String validationError() {
        if (maxNodes != null && maxNodes < 1) {
            return "maxNodes must be positive, got " + maxNodes;
        }
        return null;
    }

    public int effectiveMaxNodes() {
        return maxNodes != null ? maxNodes : DEFAULT_MAX_NODES;
    }

    public boolean classDiagramEnabled() {
        return includeClassDiagram == null || includeClassDiagram;
    }

    public boolean callGraphEnabled() {
        return includeCallGraph == null || includeCallGraph;
    }
}
