package ai.rtlparser.analyzer.cst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Interior node of the concrete syntax tree. Traversals use an explicit stack so deep trees never
 * exhaust the call stack.
 */
public final class TreeNode implements TreeElement {

    private final SyntaxTree tree;
    private final int index;

    TreeNode(SyntaxTree tree, int index) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.index = index;
    }

    @Override
    public int index() {
        return index;
    }

    @Override
    public String tag() {
        return tree.tag(index);
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    public int childCount() {
        return tree.childIndices(index).size();
    }

    public List<TreeElement> children() {
        List<Integer> indices = tree.childIndices(index);
        List<TreeElement> result = new ArrayList<>(indices.size());
        for (int child : indices) {
            result.add(tree.element(child));
        }
        return result;
    }

    public Optional<TreeNode> parent() {
        return tree.parent(index).map(tree::node);
    }

    /**
     * All nodes with the given tag in document order, including this node when it matches.
     */
    public List<TreeNode> findAll(String tag) {
        return findAll(Set.of(tag));
    }

    public List<TreeNode> findAll(Set<String> tags) {
        List<TreeNode> matches = new ArrayList<>();
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(index);
        while (!pending.isEmpty()) {
            int current = pending.pop();
            if (tree.isLeaf(current)) {
                continue;
            }
            if (tags.contains(tree.tag(current))) {
                matches.add(tree.node(current));
            }
            pushChildrenReversed(pending, current);
        }
        return matches;
    }

    public Optional<TreeNode> findFirst(String tag) {
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(index);
        while (!pending.isEmpty()) {
            int current = pending.pop();
            if (tree.isLeaf(current)) {
                continue;
            }
            if (tag.equals(tree.tag(current))) {
                return Optional.of(tree.node(current));
            }
            pushChildrenReversed(pending, current);
        }
        return Optional.empty();
    }

    public boolean contains(String tag) {
        return findFirst(tag).isPresent();
    }

    public List<TreeLeaf> leaves() {
        return leaves(Set.of());
    }

    /**
     * Leaves in document order, not descending into nodes whose tag is in {@code prunedTags}.
     */
    public List<TreeLeaf> leaves(Set<String> prunedTags) {
        List<TreeLeaf> leaves = new ArrayList<>();
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(index);
        while (!pending.isEmpty()) {
            int current = pending.pop();
            if (tree.isLeaf(current)) {
                leaves.add((TreeLeaf) tree.element(current));
                continue;
            }
            if (current != index && prunedTags.contains(tree.tag(current))) {
                continue;
            }
            pushChildrenReversed(pending, current);
        }
        return leaves;
    }

    public Optional<TreeLeaf> firstLeaf() {
        List<TreeLeaf> leaves = leaves();
        return leaves.isEmpty() ? Optional.empty() : Optional.of(leaves.get(0));
    }

    private void pushChildrenReversed(Deque<Integer> pending, int node) {
        List<Integer> indices = tree.childIndices(node);
        for (int i = indices.size() - 1; i >= 0; i--) {
            pending.push(indices.get(i));
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TreeNode that)) {
            return false;
        }
        return index == that.index && tree == that.tree;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(tree), index);
    }

    @Override
    public String toString() {
        return "TreeNode[" + index + ", " + tag() + "]";
    }
}
