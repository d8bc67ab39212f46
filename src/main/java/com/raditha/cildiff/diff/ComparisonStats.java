package com.raditha.cildiff.diff;

/**
 * Counters collected while one diff tree is built.
 */
public class ComparisonStats {

    private int setComparisons;
    private int prunedSets;
    private int subsetComparisons;
    private int matchedPairs;
    private int diffs;

    public void recordSetComparison() {
        setComparisons++;
    }

    /**
     * A set comparison that stopped at equal aggregate digests.
     */
    public void recordPrunedSet() {
        prunedSets++;
    }

    public void recordSubsetComparison() {
        subsetComparisons++;
    }

    void recordMatchedPair() {
        matchedPairs++;
    }

    void recordDiff() {
        diffs++;
    }

    public int getSetComparisons() {
        return setComparisons;
    }

    public int getPrunedSets() {
        return prunedSets;
    }

    public int getSubsetComparisons() {
        return subsetComparisons;
    }

    public int getMatchedPairs() {
        return matchedPairs;
    }

    public int getDiffs() {
        return diffs;
    }

    @Override
    public String toString() {
        return String.format("sets compared=%d, pruned=%d, subsets compared=%d, pairs matched=%d, diffs=%d",
                setComparisons, prunedSets, subsetComparisons, matchedPairs, diffs);
    }
}
