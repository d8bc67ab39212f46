package com.raditha.cildiff.compare;

import com.raditha.cildiff.model.CilFlavor;

/**
 * Resolves the matcher for a flavor's {@link com.raditha.cildiff.model.MatchingPolicy}.
 */
final class SubsetMatchers {

    private static final FlatMatcher FLAT = new FlatMatcher();
    private static final SimilarityMatcher SIMILARITY = new SimilarityMatcher(FLAT);
    private static final SingleCorrespondenceMatcher SINGLE = new SingleCorrespondenceMatcher(SIMILARITY, FLAT);

    private SubsetMatchers() {
    }

    static SubsetMatcher forFlavor(CilFlavor flavor) {
        return switch (flavor.getMatchingPolicy()) {
            case FLAT -> FLAT;
            case SINGLE -> SINGLE;
            case SIMILARITY -> SIMILARITY;
        };
    }
}
