package com.raditha.cildiff.compare;

import java.util.Comparator;

/**
 * A possible pairing of one unmatched left member with one unmatched right member.
 *
 * @param left       left member
 * @param right      right member
 * @param similarity similarity of the two members
 */
public record CandidatePair(ComparableNode left, ComparableNode right, Similarity similarity) {

    /**
     * Highest ratio first; ties by ascending left full digest, then ascending right full digest.
     */
    public static final Comparator<CandidatePair> RANKING = Comparator
            .comparingDouble((CandidatePair pair) -> pair.similarity().ratio()).reversed()
            .thenComparing(pair -> pair.left().getFullHash())
            .thenComparing(pair -> pair.right().getFullHash());
}
