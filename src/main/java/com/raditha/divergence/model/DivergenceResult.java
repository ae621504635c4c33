package com.raditha.divergence.model;

/**
 * Outcome of the first-divergence scan.
 *
 * @param found          true when some pair differs after normalization
 * @param index          position of the first differing pair, -1 when none
 * @param pair           the first differing pair, null when none
 * @param lastCommonPair the pair just before it, null when none or at index 0
 * @param comparedPairs  number of pairs normalized and compared
 * @param canonicalA     normalized pipeline-A text of the differing pair
 * @param canonicalB     normalized pipeline-B text of the differing pair
 */
public record DivergenceResult(
        boolean found,
        int index,
        AlignmentPair pair,
        AlignmentPair lastCommonPair,
        int comparedPairs,
        String canonicalA,
        String canonicalB) {

    public static DivergenceResult noDivergence(int comparedPairs) {
        return new DivergenceResult(false, -1, null, null, comparedPairs, null, null);
    }

    public static DivergenceResult divergenceAt(int index, AlignmentPair pair, AlignmentPair lastCommonPair,
            String canonicalA, String canonicalB) {
        return new DivergenceResult(true, index, pair, lastCommonPair, index + 1, canonicalA, canonicalB);
    }

    public boolean hasLastCommonPair() {
        return lastCommonPair != null;
    }
}
