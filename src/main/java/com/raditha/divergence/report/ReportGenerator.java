package com.raditha.divergence.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.divergence.analyzer.AnalysisOutcome;
import com.raditha.divergence.model.AlignmentPair;
import com.raditha.divergence.model.AlignmentResult;
import com.raditha.divergence.model.DivergenceResult;
import com.raditha.divergence.model.UnmatchedPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the analysis artifacts of a run: the JSON report, the mapping actually used,
 * the diff of the first divergent pair and the pipeline visualization.
 */
public class ReportGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ReportGenerator.class);

    public static final String TOOL_VERSION = "1.0.0";
    static final String ANALYSIS_TYPE = "ir_divergence";

    static final String ANALYSIS_DIR = "analysis";
    static final String LOGS_DIR = "logs";
    static final String REPORT_FILE = "divergence_report.json";
    static final String MAPPING_FILE = "pass_mapping_used.json";
    static final String DIFF_FILE = "first_divergence_diff.txt";
    static final String VISUALIZATION_FILE = "pass_mapping_visualization.txt";

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final DiffGenerator diffGenerator;
    private final MappingVisualizer visualizer;

    public ReportGenerator() {
        this(new DiffGenerator(), new MappingVisualizer());
    }

    public ReportGenerator(DiffGenerator diffGenerator, MappingVisualizer visualizer) {
        this.diffGenerator = diffGenerator;
        this.visualizer = visualizer;
    }

    /**
     * Mapping file content: names of the pairs, unmatched names and statistics.
     */
    public record MappingUsed(
            Map<String, String> successfulMappings,
            List<String> unmatchedPasses,
            Statistics statistics) {
    }

    public record Statistics(int totalMappings, int unmatchedPasses, double successRate) {
    }

    /**
     * Write every artifact under {@code outputDir} and return the report that was written.
     */
    public DivergenceReport generate(AnalysisOutcome outcome, Path outputDir) throws IOException {
        Path analysisDir = outputDir.resolve(ANALYSIS_DIR);
        Path logsDir = outputDir.resolve(LOGS_DIR);
        Files.createDirectories(analysisDir);
        Files.createDirectories(logsDir);

        Path reportFile = analysisDir.resolve(REPORT_FILE);
        Path mappingFile = analysisDir.resolve(MAPPING_FILE);
        Path visualizationFile = logsDir.resolve(VISUALIZATION_FILE);
        Path diffFile = null;

        if (outcome.divergence().found()) {
            diffFile = analysisDir.resolve(DIFF_FILE);
            Files.writeString(diffFile, buildDiff(outcome.divergence()));
            logger.info("Saved diff file to: {}", diffFile);
        }

        mapper.writerWithDefaultPrettyPrinter().writeValue(mappingFile.toFile(), buildMappingUsed(outcome.alignment()));
        logger.info("Saved mapping info to: {}", mappingFile);

        Files.writeString(visualizationFile, visualizer.render(outcome));
        logger.info("Generated visualization file: {}", visualizationFile);

        DivergenceReport.OutputFiles outputFiles = new DivergenceReport.OutputFiles(
                reportFile.toString(),
                diffFile != null ? diffFile.toString() : null,
                mappingFile.toString(),
                visualizationFile.toString());
        DivergenceReport report = buildReport(outcome, outputFiles);
        mapper.writerWithDefaultPrettyPrinter().writeValue(reportFile.toFile(), report);
        logger.info("Saved JSON report to: {}", reportFile);
        return report;
    }

    /**
     * Build the report object without touching the file system.
     */
    public DivergenceReport buildReport(AnalysisOutcome outcome, DivergenceReport.OutputFiles outputFiles) {
        AlignmentResult alignment = outcome.alignment();
        DivergenceReport.Summary summary = new DivergenceReport.Summary(
                outcome.pipelineA().size(),
                outcome.pipelineB().size(),
                alignment.matchedCount(),
                alignment.unmatched().size(),
                outcome.unusedPipelineBCount());

        List<DivergenceReport.PairInfo> mappings = new ArrayList<>();
        for (int i = 0; i < alignment.pairs().size(); i++) {
            mappings.add(pairInfo(i, alignment.pairs().get(i)));
        }
        List<DivergenceReport.UnmatchedInfo> unmatched = alignment.unmatched().stream()
                .map(u -> new DivergenceReport.UnmatchedInfo(
                        u.pass().canonicalName(), u.pass().sequenceIndex(), u.reason().name()))
                .toList();
        DivergenceReport.MappingDetails details = new DivergenceReport.MappingDetails(
                mappings, unmatched, List.copyOf(outcome.ambiguousTargets()), alignment.successRate());

        return new DivergenceReport(
                new DivergenceReport.AnalysisInfo(LocalDateTime.now(), TOOL_VERSION, ANALYSIS_TYPE),
                summary,
                buildDivergenceAnalysis(outcome.divergence(), alignment.matchedCount()),
                details,
                true,
                outputFiles);
    }

    private static DivergenceReport.DivergenceAnalysis buildDivergenceAnalysis(DivergenceResult divergence,
            int totalPairs) {
        if (!divergence.found()) {
            return new DivergenceReport.DivergenceAnalysis(false,
                    "No divergence found - all compared passes have identical IR",
                    null, null, totalPairs, totalPairs);
        }
        DivergenceReport.PairInfo lastCommon = divergence.hasLastCommonPair()
                ? pairInfo(divergence.index() - 1, divergence.lastCommonPair())
                : null;
        return new DivergenceReport.DivergenceAnalysis(true,
                "First divergence at pair #" + divergence.index(),
                pairInfo(divergence.index(), divergence.pair()),
                lastCommon,
                divergence.index(),
                totalPairs);
    }

    static DivergenceReport.PairInfo pairInfo(int index, AlignmentPair pair) {
        return new DivergenceReport.PairInfo(
                index,
                pair.a().canonicalName(),
                pair.b().canonicalName(),
                pair.a().artifact() != null ? pair.a().artifact().location() : null,
                pair.b().artifact() != null ? pair.b().artifact().location() : null,
                pair.a().sequenceIndex(),
                pair.b().sequenceIndex());
    }

    static MappingUsed buildMappingUsed(AlignmentResult alignment) {
        Map<String, String> names = new LinkedHashMap<>();
        for (AlignmentPair pair : alignment.pairs()) {
            names.put(pair.a().canonicalName(), pair.b().canonicalName());
        }
        List<String> unmatched = alignment.unmatched().stream()
                .map(UnmatchedPass::pass)
                .map(p -> p.canonicalName())
                .toList();
        return new MappingUsed(names, unmatched,
                new Statistics(alignment.matchedCount(), unmatched.size(), alignment.successRate()));
    }

    String buildDiff(DivergenceResult divergence) {
        String nameA = divergence.pair().a().canonicalName();
        String nameB = divergence.pair().b().canonicalName();

        StringBuilder sb = new StringBuilder();
        sb.append("IR Divergence Diff\n");
        sb.append("==================\n\n");
        sb.append("Pipeline A Pass: ").append(nameA).append("\n");
        sb.append("Pipeline B Pass: ").append(nameB).append("\n");
        sb.append("Generated:       ")
                .append(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("\n\n");
        sb.append("Unified Diff:\n");
        sb.append("-------------\n");
        sb.append(diffGenerator.generateUnifiedDiff(nameA, divergence.canonicalA(), nameB, divergence.canonicalB()));
        sb.append("\n");
        return sb.toString();
    }
}
