package com.raditha.divergence.report;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Serialized form of {@code divergence_report.json}.
 */
public record DivergenceReport(
        AnalysisInfo analysisInfo,
        Summary summary,
        DivergenceAnalysis divergenceAnalysis,
        MappingDetails mappingDetails,
        boolean success,
        OutputFiles outputFiles) {

    public record AnalysisInfo(LocalDateTime timestamp, String toolVersion, String analysisType) {
    }

    public record Summary(
            int totalPipelineAPasses,
            int totalPipelineBPasses,
            int successfullyMapped,
            int unmatchedPipelineAPasses,
            int unusedPipelineBPasses) {
    }

    /**
     * A pair as it appears in the report; positions are sequence indices in each pipeline.
     */
    public record PairInfo(
            int index,
            String pipelineAPass,
            String pipelineBPass,
            String pipelineAFile,
            String pipelineBFile,
            int pipelineAPosition,
            int pipelineBPosition) {
    }

    public record DivergenceAnalysis(
            boolean divergenceFound,
            String message,
            PairInfo firstDivergentPass,
            PairInfo lastCommonPass,
            int passesComparedBeforeDivergence,
            int totalComparedPasses) {
    }

    public record UnmatchedInfo(String pass, int position, String reason) {
    }

    public record MappingDetails(
            List<PairInfo> successfulMappings,
            List<UnmatchedInfo> unmatchedPasses,
            List<String> ambiguousTargets,
            double mappingSuccessRate) {
    }

    /**
     * @param diffFile null when no divergence was found
     */
    public record OutputFiles(String jsonReport, String diffFile, String mappingFile, String visualizationFile) {
    }
}
