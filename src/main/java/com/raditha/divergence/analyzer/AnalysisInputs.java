package com.raditha.divergence.analyzer;

import java.nio.file.Path;

/**
 * The three files one run reads.
 *
 * @param pipelineA dump of pipeline A
 * @param pipelineB dump of pipeline B
 * @param mapping   JSON name mapping from A names to B names
 */
public record AnalysisInputs(Path pipelineA, Path pipelineB, Path mapping) {

    public AnalysisInputs {
        if (pipelineA == null || pipelineB == null || mapping == null) {
            throw new IllegalArgumentException("all three input paths are required");
        }
    }
}
