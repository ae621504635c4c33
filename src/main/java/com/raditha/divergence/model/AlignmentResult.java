package com.raditha.divergence.model;

import java.util.List;

/**
 * Output of one alignment run.
 *
 * @param pairs     matched pairs, ordered by both sides
 * @param unmatched pipeline-A passes left unpaired, in pipeline order
 */
public record AlignmentResult(List<AlignmentPair> pairs, List<UnmatchedPass> unmatched) {

    public AlignmentResult {
        pairs = List.copyOf(pairs);
        unmatched = List.copyOf(unmatched);
    }

    public int matchedCount() {
        return pairs.size();
    }

    /**
     * matched / (matched + unmatched), or 0 when nothing was considered.
     */
    public double successRate() {
        int total = pairs.size() + unmatched.size();
        return total == 0 ? 0.0 : (double) pairs.size() / total;
    }
}
