package ai.rtlparser.analyzer.cst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Flat, index-addressed arena holding every node and leaf of a decoded concrete syntax tree.
 * Parents and children are referenced by arena index; {@link TreeNode} and {@link TreeLeaf} are views.
 */
public final class SyntaxTree {

    public static final int NO_PARENT = -1;

    private final List<Entry> entries;
    private final List<List<Integer>> children;
    private final List<Integer> topLevel;
    private final int skippedLines;

    private SyntaxTree(List<Entry> entries, List<List<Integer>> children, List<Integer> topLevel, int skippedLines) {
        this.entries = entries;
        this.children = children;
        this.topLevel = topLevel;
        this.skippedLines = skippedLines;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return entries.size();
    }

    public int skippedLines() {
        return skippedLines;
    }

    /**
     * First top-level node of the dump.
     */
    public TreeNode root() {
        return node(topLevel.get(0));
    }

    public List<TreeNode> topLevelNodes() {
        List<TreeNode> nodes = new ArrayList<>(topLevel.size());
        for (int index : topLevel) {
            nodes.add(node(index));
        }
        return nodes;
    }

    public TreeElement element(int index) {
        Entry entry = entries.get(index);
        if (entry.leaf()) {
            return new TreeLeaf(index, entry.tag(), entry.text(), entry.start(), entry.end());
        }
        return new TreeNode(this, index);
    }

    public TreeNode node(int index) {
        if (isLeaf(index)) {
            throw new IllegalArgumentException("Entry " + index + " is a leaf");
        }
        return new TreeNode(this, index);
    }

    public boolean isLeaf(int index) {
        return entries.get(index).leaf();
    }

    public String tag(int index) {
        return entries.get(index).tag();
    }

    public Optional<Integer> parent(int index) {
        int parent = entries.get(index).parent();
        return parent == NO_PARENT ? Optional.empty() : Optional.of(parent);
    }

    List<Integer> childIndices(int index) {
        return children.get(index);
    }

    private record Entry(boolean leaf, String tag, String text, int start, int end, int parent) {
    }

    /**
     * Appends entries in document order. Children are attached to a parent by index.
     */
    public static final class Builder {

        private final List<Entry> entries = new ArrayList<>();
        private final List<List<Integer>> children = new ArrayList<>();
        private final List<Integer> topLevel = new ArrayList<>();
        private int skippedLines;

        private Builder() {
        }

        public int addNode(int parent, String tag) {
            return append(new Entry(false, tag, "", 0, 0, parent));
        }

        public int addLeaf(int parent, String tag, String text, int start, int end) {
            if (parent == NO_PARENT) {
                throw new IllegalArgumentException("Leaf " + tag + " requires a parent node");
            }
            return append(new Entry(true, tag, text, start, end, parent));
        }

        public Builder skippedLines(int count) {
            this.skippedLines = count;
            return this;
        }

        public boolean hasRoot() {
            return !topLevel.isEmpty();
        }

        public SyntaxTree build() {
            if (topLevel.isEmpty()) {
                throw new TreeDecodeException("Syntax tree has no root node");
            }
            List<List<Integer>> frozen = new ArrayList<>(children.size());
            for (List<Integer> list : children) {
                frozen.add(Collections.unmodifiableList(list));
            }
            return new SyntaxTree(List.copyOf(entries), Collections.unmodifiableList(frozen), List.copyOf(topLevel), skippedLines);
        }

        private int append(Entry entry) {
            int index = entries.size();
            if (entry.parent() != NO_PARENT) {
                if (entries.get(entry.parent()).leaf()) {
                    throw new IllegalArgumentException("Leaf " + entry.parent() + " cannot have children");
                }
                children.get(entry.parent()).add(index);
            } else {
                topLevel.add(index);
            }
            entries.add(entry);
            children.add(new ArrayList<>());
            return index;
        }
    }
}
