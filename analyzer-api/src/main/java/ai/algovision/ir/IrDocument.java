package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The analysis output for one document. All lists are unmodifiable; an instance never changes after it has been built.
 */
public record IrDocument(
        @JsonProperty("outline") List<OutlineNode> outline,
        @JsonProperty("cfgs") List<Cfg> cfgs,
        @JsonProperty("calls") List<CallEdge> calls,
        @JsonProperty("classes") List<ClassInfo> classes,
        @JsonProperty("imports") List<ImportEntry> imports) {

    private static final IrDocument EMPTY = new IrDocument(List.of(), List.of(), List.of(), List.of(), List.of());

    public IrDocument {
        outline = List.copyOf(outline);
        cfgs = List.copyOf(cfgs);
        calls = List.copyOf(calls);
        classes = List.copyOf(classes);
        imports = List.copyOf(imports);
    }

    public static IrDocument empty() {
        return EMPTY;
    }

    /** Outline nodes plus the nodes of every CFG; the quantity bounded by {@code maxNodes}. */
    public int nodeCount() {
        return outline.size() + cfgs.stream().mapToInt(cfg -> cfg.nodes().size()).sum();
    }
}
