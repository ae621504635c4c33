package com.raditha.divergence.config;

import com.raditha.divergence.extraction.HeaderDialect;
import com.raditha.divergence.model.ExclusionSet;

/**
 * Everything a run needs besides its input files.
 *
 * @param normalization normalization switches used by the divergence scan
 * @param exclusions    pass names kept out of alignment
 * @param dialectA      header dialect of the pipeline-A dump
 * @param dialectB      header dialect of the pipeline-B dump
 */
public record AnalyzerConfig(
        NormalizationOptions normalization,
        ExclusionSet exclusions,
        HeaderDialect dialectA,
        HeaderDialect dialectB) {

    public AnalyzerConfig {
        if (normalization == null) {
            throw new IllegalArgumentException("normalization cannot be null");
        }
        if (exclusions == null) {
            exclusions = ExclusionSet.none();
        }
        if (dialectA == null) {
            dialectA = HeaderDialect.LEGACY;
        }
        if (dialectB == null) {
            dialectB = HeaderDialect.NEW_PM;
        }
    }

    /**
     * Legacy dump against new pass manager dump, default normalization, no exclusions.
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(NormalizationOptions.defaults(), ExclusionSet.none(),
                HeaderDialect.LEGACY, HeaderDialect.NEW_PM);
    }
}
