package com.raditha.cildiff.compare;

import com.raditha.cildiff.diff.DiffTreeNode;

/**
 * Pairing strategy applied to two subsets that share a key but differ in content.
 * Either subset may be absent, but not both.
 */
public interface SubsetMatcher {

    /**
     * Record the differences between the two subsets under {@code diffNode}.
     */
    void compare(NodeSubset left, NodeSubset right, DiffTreeNode diffNode);

    /**
     * Similarity of the two subsets, used to rank pairings of their owners.
     */
    Similarity similarity(NodeSubset left, NodeSubset right);
}
