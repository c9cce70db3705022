package ai.algovision.analyzer.cfg;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A loop or switch being lowered. Collects the exits that leave it through {@code break}, and for switches the section
 * entries and pending {@code goto case} jumps.
 */
public final class FlowScope {
    /** Switch-scope jump awaiting its section; {@code caseValue} is null for {@code goto default}. */
    public record PendingGoto(String from, @Nullable String caseValue) {}

    private final @Nullable String continueTarget;
    private final boolean isSwitch;
    private final List<CfgBuilder.Exit> breaks = new ArrayList<>();
    private final List<CfgBuilder.Exit> continues = new ArrayList<>();
    private final Map<String, String> caseEntries = new HashMap<>();
    private final List<PendingGoto> gotos = new ArrayList<>();
    private @Nullable String defaultEntry;

    private FlowScope(@Nullable String continueTarget, boolean isSwitch) {
        this.continueTarget = continueTarget;
        this.isSwitch = isSwitch;
    }

    static FlowScope loop(@Nullable String continueTarget) {
        return new FlowScope(continueTarget, false);
    }

    static FlowScope switchScope() {
        return new FlowScope(null, true);
    }

    public @Nullable String continueTarget() {
        return continueTarget;
    }

    public boolean isSwitch() {
        return isSwitch;
    }

    public List<CfgBuilder.Exit> breaks() {
        return breaks;
    }

    /** Continues collected while the loop had no continue target yet. */
    public List<CfgBuilder.Exit> continues() {
        return continues;
    }

    public void addCaseEntry(String caseValue, String nodeId) {
        caseEntries.putIfAbsent(caseValue, nodeId);
    }

    public @Nullable String caseEntry(String caseValue) {
        return caseEntries.get(caseValue);
    }

    public void setDefaultEntry(String nodeId) {
        if (defaultEntry == null) {
            defaultEntry = nodeId;
        }
    }

    public @Nullable String defaultEntry() {
        return defaultEntry;
    }

    public void addGoto(PendingGoto pending) {
        gotos.add(pending);
    }

    public List<PendingGoto> gotos() {
        return gotos;
    }
}
