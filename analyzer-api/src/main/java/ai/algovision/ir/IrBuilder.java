package ai.algovision.ir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Accumulates IR parts during a single traversal and emits an immutable {@link IrDocument}.
 *
 * <p>Not thread-safe; one builder per analysis.
 */
public final class IrBuilder {
    private final List<OutlineNode> outline = new ArrayList<>();
    private final List<Cfg> cfgs = new ArrayList<>();
    private final List<CallEdge> calls = new ArrayList<>();
    private final List<ClassInfo> classes = new ArrayList<>();
    private final List<ImportEntry> imports = new ArrayList<>();
    private final Map<String, Integer> occurrences = new HashMap<>();

    /**
     * Adds a declaration and assigns its id as {@code {kindPrefix}:{name}@{startLine}#{occurrence}}. The occurrence
     * counter is kept per (kind, start line), so same-line declarations of one kind stay distinct and re-analysis of
     * the same shape yields the same ids.
     */
    public OutlineNode addOutlineNode(
            OutlineKind kind,
            String name,
            @Nullable String parentId,
            IrRange range,
            @Nullable List<String> params,
            @Nullable Visibility visibility,
            @Nullable List<String> genericParams) {
        var safeName = name.isBlank() ? kind.wireName() : name;
        var key = kind.wireName() + ":" + range.startLine();
        int occurrence = occurrences.merge(key, 1, Integer::sum);
        var id = kind.idPrefix() + ":" + safeName + "@" + range.startLine() + "#" + occurrence;
        var node = new OutlineNode(id, kind, safeName, parentId, range, params, visibility, genericParams);
        outline.add(node);
        return node;
    }

    public OutlineNode addOutlineNode(OutlineKind kind, String name, @Nullable String parentId, IrRange range) {
        return addOutlineNode(kind, name, parentId, range, null, null, null);
    }

    public void addCfg(Cfg cfg) {
        cfgs.add(cfg);
    }

    public void addCall(CallEdge call) {
        calls.add(call);
    }

    public void addClass(ClassInfo classInfo) {
        classes.add(classInfo);
    }

    public void addImport(ImportEntry importEntry) {
        imports.add(importEntry);
    }

    public int outlineSize() {
        return outline.size();
    }

    public IrDocument build() {
        return new IrDocument(outline, cfgs, calls, classes, imports);
    }
}
