package com.raditha.cildiff.model;

/**
 * How members of one subset are paired across the two trees.
 */
public enum MatchingPolicy {
    /**
     * Members not found by exact full hash on the other side are reported as additions or deletions.
     */
    FLAT,
    /**
     * At most one member per side is expected; the pair is compared recursively.
     */
    SINGLE,
    /**
     * Members are paired greedily by descending similarity.
     */
    SIMILARITY
}
