package com.raditha.divergence.model;

/**
 * A pipeline-A pass matched with the pipeline-B pass presumed equivalent.
 *
 * @param a pass from pipeline A
 * @param b pass from pipeline B
 */
public record AlignmentPair(PassRecord a, PassRecord b) {

    public AlignmentPair {
        if (a == null || b == null) {
            throw new IllegalArgumentException("both sides of a pair are required");
        }
    }

    @Override
    public String toString() {
        return "(" + a.sequenceIndex() + "," + b.sequenceIndex() + ") "
                + a.canonicalName() + " -> " + b.canonicalName();
    }
}
