package com.raditha.cildiff.compare;

import com.raditha.cildiff.diff.DiffSide;
import com.raditha.cildiff.diff.DiffTreeNode;

/**
 * Reports every member without an identical counterpart as an addition or deletion.
 * A statement whose value changed therefore shows up as one deletion plus one addition.
 */
public class FlatMatcher implements SubsetMatcher {

    @Override
    public void compare(NodeSubset left, NodeSubset right, DiffTreeNode diffNode) {
        for (ComparableNode member : NodeSubset.membersOf(left).values()) {
            if (right == null || !right.contains(member.getFullHash())) {
                diffNode.appendDiff(DiffSide.LEFT, member, null);
            }
        }
        for (ComparableNode member : NodeSubset.membersOf(right).values()) {
            if (left == null || !left.contains(member.getFullHash())) {
                diffNode.appendDiff(DiffSide.RIGHT, member, null);
            }
        }
    }

    @Override
    public Similarity similarity(NodeSubset left, NodeSubset right) {
        int common = 0;
        int leftOnly = 0;
        int rightOnly = 0;
        for (ComparableNode member : NodeSubset.membersOf(left).values()) {
            if (right != null && right.contains(member.getFullHash())) {
                common++;
            } else {
                leftOnly++;
            }
        }
        for (ComparableNode member : NodeSubset.membersOf(right).values()) {
            if (left == null || !left.contains(member.getFullHash())) {
                rightOnly++;
            }
        }
        return new Similarity(common, leftOnly, rightOnly);
    }
}
