package com.raditha.cildiff.compare;

/**
 * Counts used to rank candidate pairings: members present on both sides, only on the
 * left and only on the right.
 *
 * @param common members found on both sides
 * @param left   members found only on the left
 * @param right  members found only on the right
 */
public record Similarity(int common, int left, int right) {

    public static final Similarity NONE = new Similarity(0, 0, 0);
    public static final Similarity IDENTICAL = new Similarity(1, 0, 0);

    public Similarity {
        if (common < 0 || left < 0 || right < 0) {
            throw new IllegalArgumentException("Similarity counts cannot be negative");
        }
    }

    public int total() {
        return common + left + right;
    }

    /**
     * Share of common members; 0.0 when nothing was counted.
     */
    public double ratio() {
        int total = total();
        return total == 0 ? 0.0 : (double) common / total;
    }

    public Similarity plus(Similarity other) {
        return new Similarity(common + other.common, left + other.left, right + other.right);
    }

    public String formatRatio() {
        return String.format("%.1f%%", ratio() * 100.0);
    }
}
