package com.raditha.divergence.alignment;

import com.raditha.divergence.model.AlignmentPair;
import com.raditha.divergence.model.AlignmentResult;
import com.raditha.divergence.model.ExclusionSet;
import com.raditha.divergence.model.NameMapping;
import com.raditha.divergence.model.PassRecord;
import com.raditha.divergence.model.UnmatchReason;
import com.raditha.divergence.model.UnmatchedPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pairs pipeline-A passes with pipeline-B passes in chronological order.
 * <p>
 * Greedy: each A pass, in order, takes the earliest unused B pass with the mapped
 * name that comes after the previous match. Pairs never cross and no B pass is used twice.
 */
public class PassAligner {

    private static final Logger logger = LoggerFactory.getLogger(PassAligner.class);

    /**
     * Align two pass sequences.
     *
     * @param pipelineA  passes of pipeline A in sequence order
     * @param pipelineB  passes of pipeline B in sequence order
     * @param mapping    A name to B name
     * @param exclusions names left out on either side
     * @return pairs in order plus every A pass that found no partner
     */
    public AlignmentResult align(List<PassRecord> pipelineA, List<PassRecord> pipelineB,
            NameMapping mapping, ExclusionSet exclusions) {
        for (String target : mapping.duplicateTargets()) {
            logger.warn("Several pipeline-A passes map to '{}'; each occurrence will be consumed once", target);
        }

        Map<String, List<PassRecord>> positionsByName = indexByName(pipelineB);
        Set<Integer> consumed = new HashSet<>();
        int lastB = -1;

        List<AlignmentPair> pairs = new ArrayList<>();
        List<UnmatchedPass> unmatched = new ArrayList<>();

        for (PassRecord a : pipelineA) {
            if (exclusions.excludesA(a.canonicalName())) {
                unmatched.add(new UnmatchedPass(a, UnmatchReason.EXCLUDED));
                continue;
            }
            Optional<String> target = mapping.targetOf(a.canonicalName());
            if (target.isEmpty()) {
                logger.warn("No mapping for pipeline-A pass {}", a.toDisplayString());
                unmatched.add(new UnmatchedPass(a, UnmatchReason.NO_MAPPING));
                continue;
            }
            if (exclusions.excludesB(target.get())) {
                unmatched.add(new UnmatchedPass(a, UnmatchReason.TARGET_EXCLUDED));
                continue;
            }

            PassRecord b = firstAfter(positionsByName.get(target.get()), lastB, consumed);
            if (b == null) {
                logger.warn("No pipeline-B '{}' after index {} for {}", target.get(), lastB, a.toDisplayString());
                unmatched.add(new UnmatchedPass(a, UnmatchReason.NO_CHRONOLOGICAL_MATCH));
                continue;
            }
            pairs.add(new AlignmentPair(a, b));
            consumed.add(b.sequenceIndex());
            lastB = b.sequenceIndex();
            logger.debug("Aligned {} -> {}", a.toDisplayString(), b.toDisplayString());
        }

        logger.info("Aligned {} of {} pipeline-A passes ({} unmatched)",
                pairs.size(), pipelineA.size(), unmatched.size());
        return new AlignmentResult(pairs, unmatched);
    }

    private static Map<String, List<PassRecord>> indexByName(List<PassRecord> passes) {
        Map<String, List<PassRecord>> index = new HashMap<>();
        for (PassRecord pass : passes) {
            index.computeIfAbsent(pass.canonicalName(), k -> new ArrayList<>()).add(pass);
        }
        return index;
    }

    /**
     * Earliest unused pass with sequence index greater than {@code lastB}.
     * The candidates are in sequence order, so a binary search finds the starting point.
     */
    static PassRecord firstAfter(List<PassRecord> candidates, int lastB, Set<Integer> consumed) {
        if (candidates == null) {
            return null;
        }
        int low = 0;
        int high = candidates.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (candidates.get(mid).sequenceIndex() <= lastB) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        for (int i = low; i < candidates.size(); i++) {
            PassRecord candidate = candidates.get(i);
            if (!consumed.contains(candidate.sequenceIndex())) {
                return candidate;
            }
        }
        return null;
    }
}
