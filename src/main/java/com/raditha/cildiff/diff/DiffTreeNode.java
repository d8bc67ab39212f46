package com.raditha.cildiff.diff;

import com.raditha.cildiff.compare.ComparableNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A matched pair of nodes with the changes found directly inside it and the diff nodes of
 * matched pairs nested in it.
 * <p>
 * The parent link is only used to reconstruct the context of a change.
 */
public final class DiffTreeNode {

    private final DiffTree tree;
    private final DiffTreeNode parent;
    private final ComparableNode left;
    private final ComparableNode right;
    private final List<DiffTreeNode> children = new ArrayList<>();
    private final List<Diff> diffs = new ArrayList<>();

    DiffTreeNode(DiffTree tree, DiffTreeNode parent, ComparableNode left, ComparableNode right) {
        this.tree = tree;
        this.parent = parent;
        this.left = left;
        this.right = right;
    }

    /**
     * Record a matched pair below this node.
     *
     * @return the diff node of the pair
     */
    public DiffTreeNode appendChild(ComparableNode left, ComparableNode right) {
        DiffTreeNode child = new DiffTreeNode(tree, this, left, right);
        children.add(child);
        tree.getStats().recordMatchedPair();
        return child;
    }

    /**
     * Record a statement present on one side only.
     */
    public Diff appendDiff(DiffSide side, ComparableNode node, String description) {
        Diff diff = new Diff(side, node, description);
        diffs.add(diff);
        tree.getStats().recordDiff();
        return diff;
    }

    public ComparisonStats getStats() {
        return tree.getStats();
    }

    public DiffTreeNode getParent() {
        return parent;
    }

    public ComparableNode getLeft() {
        return left;
    }

    public ComparableNode getRight() {
        return right;
    }

    public ComparableNode get(DiffSide side) {
        return side == DiffSide.LEFT ? left : right;
    }

    public List<DiffTreeNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<Diff> getDiffs() {
        return Collections.unmodifiableList(diffs);
    }

    /**
     * The nodes of one side from the root down to this node. Absent nodes are skipped.
     */
    public List<ComparableNode> getContext(DiffSide side) {
        List<ComparableNode> context = new ArrayList<>();
        for (DiffTreeNode node = this; node != null; node = node.parent) {
            if (node.get(side) != null) {
                context.add(node.get(side));
            }
        }
        Collections.reverse(context);
        return context;
    }

    /**
     * Whether this node or any descendant carries a change.
     */
    public boolean hasChanges() {
        if (!diffs.isEmpty()) {
            return true;
        }
        for (DiffTreeNode child : children) {
            if (child.hasChanges()) {
                return true;
            }
        }
        return false;
    }
}
