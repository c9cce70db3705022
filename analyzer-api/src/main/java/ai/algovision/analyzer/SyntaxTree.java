package ai.algovision.analyzer;

import ai.algovision.ir.IrRange;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable arena of named syntax nodes addressed by index.
 *
 * <p>Nodes are stored in pre-order, so a node's subtree occupies the contiguous index range
 * {@code [node, subtreeEnd(node))} and index order is document order. Callers key side tables by index instead of by
 * node identity. Index {@code 0} is the root.
 */
public final class SyntaxTree {
    public static final int NO_NODE = -1;

    private final String text;
    private final byte[] source;
    private final String[] types;
    private final @Nullable String[] fieldNames;
    private final int[] parents;
    private final int[][] children;
    private final int[] subtreeEnds;
    private final int[] startBytes;
    private final int[] endBytes;
    private final int[] startRows;
    private final int[] startColumns;
    private final int[] endRows;
    private final int[] endColumns;
    private final @Nullable IrRange firstErrorRange;

    private SyntaxTree(Builder b) {
        int n = b.types.size();
        this.text = b.text;
        this.source = b.source;
        this.types = b.types.toArray(new String[0]);
        this.fieldNames = b.fieldNames.toArray(new String[0]);
        this.parents = Arrays.copyOf(b.parents, n);
        this.subtreeEnds = Arrays.copyOf(b.subtreeEnds, n);
        this.startBytes = Arrays.copyOf(b.startBytes, n);
        this.endBytes = Arrays.copyOf(b.endBytes, n);
        this.startRows = Arrays.copyOf(b.startRows, n);
        this.startColumns = Arrays.copyOf(b.startColumns, n);
        this.endRows = Arrays.copyOf(b.endRows, n);
        this.endColumns = Arrays.copyOf(b.endColumns, n);
        this.children = new int[n][];
        for (int i = 0; i < n; i++) {
            var list = b.children.get(i);
            children[i] = list.stream().mapToInt(Integer::intValue).toArray();
        }
        this.firstErrorRange = b.firstErrorRange;
    }

    public static Builder builder(String text) {
        return new Builder(text);
    }

    public String text() {
        return text;
    }

    public int root() {
        return 0;
    }

    public int size() {
        return types.length;
    }

    public String type(int node) {
        return types[node];
    }

    public boolean isType(int node, Set<String> candidates) {
        return node != NO_NODE && candidates.contains(types[node]);
    }

    public boolean isType(int node, String candidate) {
        return node != NO_NODE && candidate.equals(types[node]);
    }

    /** Field name under which this node hangs off its parent, or null. */
    public @Nullable String fieldName(int node) {
        return fieldNames[node];
    }

    public int parent(int node) {
        return parents[node];
    }

    public int childCount(int node) {
        return children[node].length;
    }

    public int child(int node, int index) {
        return children[node][index];
    }

    public List<Integer> children(int node) {
        return Arrays.stream(children[node]).boxed().toList();
    }

    /** First named child attached under {@code field}, or {@link #NO_NODE}. */
    public int childByField(int node, String field) {
        for (int c : children[node]) {
            if (field.equals(fieldNames[c])) {
                return c;
            }
        }
        return NO_NODE;
    }

    public List<Integer> childrenByField(int node, String field) {
        var result = new ArrayList<Integer>();
        for (int c : children[node]) {
            if (field.equals(fieldNames[c])) {
                result.add(c);
            }
        }
        return result;
    }

    public int firstChildOfType(int node, Set<String> candidates) {
        for (int c : children[node]) {
            if (candidates.contains(types[c])) {
                return c;
            }
        }
        return NO_NODE;
    }

    public List<Integer> childrenOfType(int node, Set<String> candidates) {
        var result = new ArrayList<Integer>();
        for (int c : children[node]) {
            if (candidates.contains(types[c])) {
                result.add(c);
            }
        }
        return result;
    }

    /** Exclusive end of this node's pre-order subtree range. */
    public int subtreeEnd(int node) {
        return subtreeEnds[node];
    }

    /** All nodes of the given types within {@code node}'s subtree (inclusive), in document order. */
    public List<Integer> descendantsOfType(int node, Set<String> candidates) {
        var result = new ArrayList<Integer>();
        for (int i = node; i < subtreeEnds[node]; i++) {
            if (candidates.contains(types[i])) {
                result.add(i);
            }
        }
        return result;
    }

    public int count(Set<String> candidates, int fromInclusive) {
        int count = 0;
        for (int i = fromInclusive; i < types.length; i++) {
            if (candidates.contains(types[i])) {
                count++;
            }
        }
        return count;
    }

    /** Nearest strict ancestor whose type is in {@code candidates}, or {@link #NO_NODE}. */
    public int ancestorOfType(int node, Set<String> candidates) {
        int current = parents[node];
        while (current != NO_NODE) {
            if (candidates.contains(types[current])) {
                return current;
            }
            current = parents[current];
        }
        return NO_NODE;
    }

    public String text(int node) {
        return slice(startBytes[node], endBytes[node]);
    }

    /** Text from the start of {@code node} up to (excluding) the start of {@code stop}. */
    public String textBetween(int node, int stop) {
        int end = stop == NO_NODE ? endBytes[node] : Math.max(startBytes[node], startBytes[stop]);
        return slice(startBytes[node], end);
    }

    public int startLine(int node) {
        return startRows[node] + 1;
    }

    /** 1-based range with character (not byte) columns. */
    public IrRange range(int node) {
        return IrRange.of(
                startRows[node] + 1,
                charColumn(startBytes[node], startColumns[node]) + 1,
                endRows[node] + 1,
                charColumn(endBytes[node], endColumns[node]) + 1);
    }

    public boolean hasError() {
        return firstErrorRange != null;
    }

    public @Nullable IrRange firstErrorRange() {
        return firstErrorRange;
    }

    private int charColumn(int byteOffset, int byteColumn) {
        int lineStart = byteOffset - byteColumn;
        if (lineStart < 0 || byteOffset > source.length) {
            return byteColumn;
        }
        return new String(source, lineStart, byteColumn, StandardCharsets.UTF_8).length();
    }

    private String slice(int startByte, int endByte) {
        int start = Math.max(0, Math.min(startByte, source.length));
        int end = Math.max(start, Math.min(endByte, source.length));
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Appends nodes in pre-order. Every {@link #open} must be matched by a {@link #close} once the node's children
     * have been added.
     */
    public static final class Builder {
        private final String text;
        private final byte[] source;
        private final List<String> types = new ArrayList<>();
        private final List<@Nullable String> fieldNames = new ArrayList<>();
        private final List<List<Integer>> children = new ArrayList<>();
        private int[] parents = new int[64];
        private int[] subtreeEnds = new int[64];
        private int[] startBytes = new int[64];
        private int[] endBytes = new int[64];
        private int[] startRows = new int[64];
        private int[] startColumns = new int[64];
        private int[] endRows = new int[64];
        private int[] endColumns = new int[64];
        private @Nullable IrRange firstErrorRange;

        private Builder(String text) {
            this.text = text;
            this.source = text.getBytes(StandardCharsets.UTF_8);
        }

        /**
         * @param startColumn byte column of the start point, as tree-sitter reports it
         * @param endColumn byte column of the end point
         * @return the new node's index
         */
        public int open(
                int parent,
                String type,
                @Nullable String fieldName,
                int startByte,
                int endByte,
                int startRow,
                int startColumn,
                int endRow,
                int endColumn) {
            int index = types.size();
            if (index == parents.length) {
                grow();
            }
            types.add(type);
            fieldNames.add(fieldName);
            children.add(new ArrayList<>());
            parents[index] = parent;
            subtreeEnds[index] = index + 1;
            startBytes[index] = startByte;
            endBytes[index] = endByte;
            startRows[index] = startRow;
            startColumns[index] = startColumn;
            endRows[index] = endRow;
            endColumns[index] = endColumn;
            if (parent != NO_NODE) {
                children.get(parent).add(index);
            }
            return index;
        }

        public void close(int node) {
            subtreeEnds[node] = types.size();
        }

        /** Records the first syntax error seen; later calls are ignored. */
        public Builder markError(IrRange range) {
            if (firstErrorRange == null) {
                firstErrorRange = range;
            }
            return this;
        }

        /** Converts a byte point into a 1-based character range endpoint; used for error ranges. */
        public IrRange.Position position(int byteOffset, int row, int byteColumn) {
            int lineStart = Math.max(0, byteOffset - byteColumn);
            int length = Math.max(0, Math.min(byteColumn, source.length - lineStart));
            int column = new String(source, lineStart, length, StandardCharsets.UTF_8).length();
            return new IrRange.Position(row + 1, column + 1);
        }

        public SyntaxTree build() {
            if (types.isEmpty()) {
                throw new IllegalStateException("Syntax tree has no root");
            }
            return new SyntaxTree(this);
        }

        private void grow() {
            int size = parents.length * 2;
            parents = Arrays.copyOf(parents, size);
            subtreeEnds = Arrays.copyOf(subtreeEnds, size);
            startBytes = Arrays.copyOf(startBytes, size);
            endBytes = Arrays.copyOf(endBytes, size);
            startRows = Arrays.copyOf(startRows, size);
            startColumns = Arrays.copyOf(startColumns, size);
            endRows = Arrays.copyOf(endRows, size);
            endColumns = Arrays.copyOf(endColumns, size);
        }
    }
}
