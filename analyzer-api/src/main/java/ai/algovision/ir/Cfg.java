package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Control-flow graph of one function or method; {@code funcId} is the owning outline node's id. */
public record Cfg(
        @JsonProperty("funcId") String funcId,
        @JsonProperty("nodes") List<CfgNode> nodes,
        @JsonProperty("edges") List<CfgEdge> edges) {

    public Cfg {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
