package com.raditha.cildiff.compare;

import com.raditha.cildiff.diff.DiffSide;
import com.raditha.cildiff.diff.DiffTreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Greedy similarity-ranked pairing for members without a stable identity, such as optional
 * blocks or conditionals.
 * <p>
 * Identical members are skipped. The remaining members are ranked pairwise by similarity and
 * accepted greedily, each member at most once; this approximates a maximum weight matching.
 * Pairs that share nothing are never accepted, so unrelated members stay additions and
 * deletions. Accepted pairs are compared recursively.
 */
public class SimilarityMatcher implements SubsetMatcher {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityMatcher.class);

    private final FlatMatcher flat;

    public SimilarityMatcher(FlatMatcher flat) {
        this.flat = flat;
    }

    @Override
    public void compare(NodeSubset left, NodeSubset right, DiffTreeNode diffNode) {
        List<ComparableNode> uniqueLeft = unique(left, right);
        List<ComparableNode> uniqueRight = unique(right, left);

        Set<ComparableNode> unmatchedLeft = new LinkedHashSet<>(uniqueLeft);
        Set<ComparableNode> unmatchedRight = new LinkedHashSet<>(uniqueRight);
        if (!uniqueLeft.isEmpty() && !uniqueRight.isEmpty()) {
            for (CandidatePair pair : rank(uniqueLeft, uniqueRight)) {
                if (pair.similarity().common() == 0) {
                    break;
                }
                if (!unmatchedLeft.contains(pair.left()) || !unmatchedRight.contains(pair.right())) {
                    continue;
                }
                logger.debug("Pairing {} with {} at {}", pair.left(), pair.right(), pair.similarity().formatRatio());
                unmatchedLeft.remove(pair.left());
                unmatchedRight.remove(pair.right());
                ComparableNode.compare(pair.left(), pair.right(), diffNode.appendChild(pair.left(), pair.right()));
            }
        }

        for (ComparableNode member : unmatchedLeft) {
            diffNode.appendDiff(DiffSide.LEFT, member, null);
        }
        for (ComparableNode member : unmatchedRight) {
            diffNode.appendDiff(DiffSide.RIGHT, member, null);
        }
    }

    @Override
    public Similarity similarity(NodeSubset left, NodeSubset right) {
        return flat.similarity(left, right);
    }

    /**
     * Every left by right pairing, best first.
     */
    List<CandidatePair> rank(List<ComparableNode> left, List<ComparableNode> right) {
        List<CandidatePair> candidates = new ArrayList<>(left.size() * right.size());
        for (ComparableNode l : left) {
            for (ComparableNode r : right) {
                candidates.add(new CandidatePair(l, r, ComparableNode.similarity(l, r)));
            }
        }
        candidates.sort(CandidatePair.RANKING);
        return candidates;
    }

    /**
     * Members of {@code subset} with no identical member in {@code other}, in digest order.
     */
    private static List<ComparableNode> unique(NodeSubset subset, NodeSubset other) {
        List<ComparableNode> unique = new ArrayList<>();
        for (ComparableNode member : NodeSubset.membersOf(subset).values()) {
            if (other == null || !other.contains(member.getFullHash())) {
                unique.add(member);
            }
        }
        return unique;
    }
}
