package com.raditha.cildiff.diff;

import com.raditha.cildiff.compare.ComparableNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Result of comparing two policies.
 */
public final class DiffTree {

    private final ComparisonStats stats = new ComparisonStats();
    private final DiffTreeNode root;

    private DiffTree(ComparableNode left, ComparableNode right) {
        this.root = new DiffTreeNode(this, null, left, right);
    }

    /**
     * Create an empty tree rooted at the two given nodes.
     */
    public static DiffTree create(ComparableNode left, ComparableNode right) {
        return new DiffTree(left, right);
    }

    /**
     * Compare two policy roots and return the populated tree.
     */
    public static DiffTree compare(ComparableNode left, ComparableNode right) {
        DiffTree tree = create(left, right);
        ComparableNode.compare(left, right, tree.root);
        return tree;
    }

    public DiffTreeNode getRoot() {
        return root;
    }

    public ComparisonStats getStats() {
        return stats;
    }

    /**
     * Visit every change depth-first: the changes of all child nodes before the node's own.
     */
    public void forEachDiff(BiConsumer<DiffTreeNode, Diff> action) {
        visit(root, action);
    }

    private static void visit(DiffTreeNode node, BiConsumer<DiffTreeNode, Diff> action) {
        for (DiffTreeNode child : node.getChildren()) {
            visit(child, action);
        }
        for (Diff diff : node.getDiffs()) {
            action.accept(node, diff);
        }
    }

    /**
     * All changes in rendering order.
     */
    public List<Diff> getAllDiffs() {
        List<Diff> all = new ArrayList<>();
        forEachDiff((node, diff) -> all.add(diff));
        return all;
    }

    public boolean isEmpty() {
        return !root.hasChanges();
    }
}
