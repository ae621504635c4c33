package com.raditha.divergence.analyzer;

import com.raditha.divergence.config.NormalizationOptions;
import com.raditha.divergence.extraction.ArtifactStorage;
import com.raditha.divergence.model.AlignmentPair;
import com.raditha.divergence.model.DivergenceResult;
import com.raditha.divergence.normalization.IRNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Walks aligned pairs in order and stops at the first pair whose normalized texts differ.
 * Pairs after that one are never read.
 */
public class DivergenceScanner {

    private static final Logger logger = LoggerFactory.getLogger(DivergenceScanner.class);

    private final ArtifactStorage storageA;
    private final ArtifactStorage storageB;
    private final IRNormalizer normalizer;

    public DivergenceScanner(ArtifactStorage storage, IRNormalizer normalizer) {
        this(storage, storage, normalizer);
    }

    public DivergenceScanner(ArtifactStorage storageA, ArtifactStorage storageB, IRNormalizer normalizer) {
        if (storageA == null || storageB == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        this.storageA = storageA;
        this.storageB = storageB;
        this.normalizer = normalizer;
    }

    /**
     * @return the first divergence, or a result with {@code found == false} when every pair matches
     * @throws com.raditha.divergence.extraction.StorageFaultException if an artifact cannot be read
     */
    public DivergenceResult findFirstDivergence(List<AlignmentPair> pairs, NormalizationOptions options) {
        for (int i = 0; i < pairs.size(); i++) {
            AlignmentPair pair = pairs.get(i);
            String canonicalA = normalizer.normalize(storageA.read(pair.a().artifact()), options);
            String canonicalB = normalizer.normalize(storageB.read(pair.b().artifact()), options);

            if (!canonicalA.equals(canonicalB)) {
                AlignmentPair lastCommon = i > 0 ? pairs.get(i - 1) : null;
                logger.info("First divergence at pair {}: {}", i, pair);
                return DivergenceResult.divergenceAt(i, pair, lastCommon, canonicalA, canonicalB);
            }
            logger.debug("Pair {} matches: {}", i, pair);
        }
        logger.info("No divergence in {} aligned pairs", pairs.size());
        return DivergenceResult.noDivergence(pairs.size());
    }
}
