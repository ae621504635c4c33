package com.raditha.divergence.analyzer;

import com.raditha.divergence.alignment.MappingLoader;
import com.raditha.divergence.alignment.PassAligner;
import com.raditha.divergence.config.AnalyzerConfig;
import com.raditha.divergence.extraction.ArtifactStorage;
import com.raditha.divergence.extraction.ContentExtractor;
import com.raditha.divergence.extraction.HeaderDialect;
import com.raditha.divergence.extraction.HeaderScanner;
import com.raditha.divergence.extraction.MissingInputException;
import com.raditha.divergence.model.AlignmentResult;
import com.raditha.divergence.model.DivergenceResult;
import com.raditha.divergence.model.HeaderDescriptor;
import com.raditha.divergence.model.NameMapping;
import com.raditha.divergence.model.PassRecord;
import com.raditha.divergence.normalization.IRNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs one analysis: load the mapping, extract both pipelines, align them and
 * look for the first divergence.
 */
public class DivergenceAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(DivergenceAnalyzer.class);

    private final AnalyzerConfig config;
    private final ArtifactStorage storageA;
    private final ArtifactStorage storageB;
    private final MappingLoader mappingLoader;
    private final PassAligner aligner;
    private final IRNormalizer normalizer;

    public DivergenceAnalyzer(AnalyzerConfig config, ArtifactStorage storageA, ArtifactStorage storageB) {
        this(config, storageA, storageB, new MappingLoader(), new PassAligner(), new IRNormalizer());
    }

    public DivergenceAnalyzer(AnalyzerConfig config, ArtifactStorage storageA, ArtifactStorage storageB,
            MappingLoader mappingLoader, PassAligner aligner, IRNormalizer normalizer) {
        this.config = config;
        this.storageA = storageA;
        this.storageB = storageB;
        this.mappingLoader = mappingLoader;
        this.aligner = aligner;
        this.normalizer = normalizer;
    }

    /**
     * @throws MissingInputException if a dump or the mapping does not exist
     * @throws com.raditha.divergence.alignment.MalformedMappingException if the mapping is invalid
     * @throws com.raditha.divergence.extraction.StorageFaultException if a block cannot be stored or read
     * @throws IOException if a dump cannot be read
     */
    public AnalysisOutcome analyze(AnalysisInputs inputs) throws IOException {
        requireFile(inputs.pipelineA(), "Pipeline A dump");
        requireFile(inputs.pipelineB(), "Pipeline B dump");
        requireFile(inputs.mapping(), "Mapping file");

        NameMapping mapping = mappingLoader.load(inputs.mapping());
        Set<String> ambiguous = new LinkedHashSet<>(mapping.duplicateTargets());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<PassRecord> pipelineA;
        List<PassRecord> pipelineB;
        try {
            CompletableFuture<List<PassRecord>> futureA = CompletableFuture.supplyAsync(
                    () -> extractPipeline(inputs.pipelineA(), config.dialectA(), storageA), executor);
            CompletableFuture<List<PassRecord>> futureB = CompletableFuture.supplyAsync(
                    () -> extractPipeline(inputs.pipelineB(), config.dialectB(), storageB), executor);
            pipelineA = await(futureA);
            pipelineB = await(futureB);
        } finally {
            executor.shutdown();
        }
        logger.info("Pipeline A: {} passes, pipeline B: {} passes", pipelineA.size(), pipelineB.size());

        AlignmentResult alignment = aligner.align(pipelineA, pipelineB, mapping, config.exclusions());
        DivergenceResult divergence = new DivergenceScanner(storageA, storageB, normalizer)
                .findFirstDivergence(alignment.pairs(), config.normalization());

        return new AnalysisOutcome(pipelineA, pipelineB, mapping, alignment, divergence, ambiguous);
    }

    private static void requireFile(Path path, String what) {
        if (!Files.isRegularFile(path)) {
            throw new MissingInputException(what + " not found: " + path);
        }
    }

    private static List<PassRecord> extractPipeline(Path dump, HeaderDialect dialect, ArtifactStorage storage) {
        try {
            List<String> lines = Files.readAllLines(dump, StandardCharsets.UTF_8);
            List<HeaderDescriptor> headers = new HeaderScanner(dialect).scanHeaders(lines);
            logger.info("Found {} {} headers in {}", headers.size(), dialect.toCliString(), dump);
            return new ContentExtractor(storage).extract(lines, headers);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + dump + ": " + e.getMessage(), e);
        }
    }

    private static List<PassRecord> await(CompletableFuture<List<PassRecord>> future) throws IOException {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}
