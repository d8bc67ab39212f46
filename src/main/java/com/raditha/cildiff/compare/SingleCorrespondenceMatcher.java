package com.raditha.cildiff.compare;

import com.raditha.cildiff.diff.DiffTreeNode;

/**
 * Matching for uniquely named containers such as blocks, macros and classes.
 * <p>
 * One member on each side is compared recursively as a pair. Subsets that unexpectedly hold
 * several members on a side are handed to the similarity matcher.
 */
public class SingleCorrespondenceMatcher implements SubsetMatcher {

    private final SubsetMatcher fallback;
    private final FlatMatcher flat;

    public SingleCorrespondenceMatcher(SubsetMatcher fallback, FlatMatcher flat) {
        this.fallback = fallback;
        this.flat = flat;
    }

    @Override
    public void compare(NodeSubset left, NodeSubset right, DiffTreeNode diffNode) {
        if (sizeOf(left) > 1 || sizeOf(right) > 1) {
            fallback.compare(left, right, diffNode);
        } else if (left != null && right != null) {
            ComparableNode leftNode = left.getMembers().iterator().next();
            ComparableNode rightNode = right.getMembers().iterator().next();
            ComparableNode.compare(leftNode, rightNode, diffNode.appendChild(leftNode, rightNode));
        } else {
            flat.compare(left, right, diffNode);
        }
    }

    @Override
    public Similarity similarity(NodeSubset left, NodeSubset right) {
        if (sizeOf(left) > 1 || sizeOf(right) > 1) {
            return fallback.similarity(left, right);
        }
        if (left != null && right != null) {
            return ComparableNode.similarity(left.getMembers().iterator().next(), right.getMembers().iterator().next());
        }
        return flat.similarity(left, right);
    }

    private static int sizeOf(NodeSubset subset) {
        return subset != null ? subset.size() : 0;
    }
}
