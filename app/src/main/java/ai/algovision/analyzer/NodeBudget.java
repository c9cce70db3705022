package ai.algovision.analyzer;

import ai.algovision.ir.Diagnostic;

/**
 * Counts outline and CFG nodes against {@code maxNodes}. Once a reservation fails the budget stays capped for the rest
 * of the traversal and every further node is counted as skipped.
 */
public final class NodeBudget {
    private final int maxNodes;
    private int used;
    private int skipped;
    private boolean capped;
    private boolean placeholderClaimed;

    public NodeBudget(int maxNodes) {
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be positive, got " + maxNodes);
        }
        this.maxNodes = maxNodes;
    }

    /** Reserves {@code count} nodes, or caps the budget and returns false if they do not fit. */
    public boolean tryReserve(int count) {
        if (capped) {
            return false;
        }
        if (used + count > maxNodes) {
            capped = true;
            return false;
        }
        used += count;
        return true;
    }

    public void skip(int count) {
        skipped += count;
    }

    /** The truncation placeholder is emitted at most once per document and is not charged to the budget. */
    public boolean claimPlaceholder() {
        if (placeholderClaimed) {
            return false;
        }
        placeholderClaimed = true;
        return true;
    }

    public boolean isCapped() {
        return capped;
    }

    public int used() {
        return used;
    }

    public int skipped() {
        return skipped;
    }

    public int maxNodes() {
        return maxNodes;
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.nodeCapReached(skipped, maxNodes);
    }
}
