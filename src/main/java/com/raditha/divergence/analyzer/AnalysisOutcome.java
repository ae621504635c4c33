package com.raditha.divergence.analyzer;

import com.raditha.divergence.model.AlignmentResult;
import com.raditha.divergence.model.DivergenceResult;
import com.raditha.divergence.model.NameMapping;
import com.raditha.divergence.model.PassRecord;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything a completed run produced, for reporting.
 */
public record AnalysisOutcome(
        List<PassRecord> pipelineA,
        List<PassRecord> pipelineB,
        NameMapping mapping,
        AlignmentResult alignment,
        DivergenceResult divergence,
        Set<String> ambiguousTargets) {

    public AnalysisOutcome {
        pipelineA = List.copyOf(pipelineA);
        pipelineB = List.copyOf(pipelineB);
        ambiguousTargets = Collections.unmodifiableSet(new LinkedHashSet<>(ambiguousTargets));
    }

    /**
     * Pipeline-B passes that no pair uses.
     */
    public int unusedPipelineBCount() {
        return pipelineB.size() - alignment.matchedCount();
    }
}
