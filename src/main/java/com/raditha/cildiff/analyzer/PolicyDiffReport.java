package com.raditha.cildiff.analyzer;

import com.raditha.cildiff.diff.Diff;
import com.raditha.cildiff.diff.DiffSide;
import com.raditha.cildiff.diff.DiffTree;

/**
 * Result of comparing two policy files.
 *
 * @param leftSource  display name of the left policy
 * @param rightSource display name of the right policy
 * @param tree        the computed diff tree
 * @param leftNodes   number of statements in the left policy
 * @param rightNodes  number of statements in the right policy
 */
public record PolicyDiffReport(
        String leftSource,
        String rightSource,
        DiffTree tree,
        int leftNodes,
        int rightNodes) {

    public boolean hasDifferences() {
        return !tree.isEmpty();
    }

    /**
     * Number of reported statements present on the given side only.
     */
    public long count(DiffSide side) {
        return tree.getAllDiffs().stream().map(Diff::side).filter(side::equals).count();
    }

    public String getSummary() {
        return String.format("Compared %s (%d statements) with %s (%d statements): %d additions, %d deletions",
                leftSource, leftNodes, rightSource, rightNodes, count(DiffSide.LEFT), count(DiffSide.RIGHT));
    }
}
