package com.raditha.divergence.alignment;

import com.raditha.divergence.model.AlignmentPair;
import com.raditha.divergence.model.AlignmentResult;
import com.raditha.divergence.model.ExclusionSet;
import com.raditha.divergence.model.NameMapping;
import com.raditha.divergence.model.PassRecord;
import net.jqwik.api.*;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PassAlignerPropertiesTest {

    private static final Map<String, String> MAPPING = Map.of(
            "a", "A", "b", "B", "c", "C", "d", "A");

    private final PassAligner aligner = new PassAligner();

    @Property
    void pairsAreMonotonicAndNeverReuseB(@ForAll("names") List<String> namesA, @ForAll("targets") List<String> namesB) {
        AlignmentResult result = align(namesA, namesB);

        int lastA = -1;
        int lastB = -1;
        Set<Integer> usedB = new HashSet<>();
        for (AlignmentPair pair : result.pairs()) {
            assertTrue(pair.a().sequenceIndex() > lastA);
            assertTrue(pair.b().sequenceIndex() > lastB);
            assertTrue(usedB.add(pair.b().sequenceIndex()));
            assertEquals(MAPPING.get(pair.a().canonicalName()), pair.b().canonicalName());
            lastA = pair.a().sequenceIndex();
            lastB = pair.b().sequenceIndex();
        }
    }

    @Property
    void everyPassIsPairedOrReported(@ForAll("names") List<String> namesA, @ForAll("targets") List<String> namesB) {
        AlignmentResult result = align(namesA, namesB);
        assertEquals(namesA.size(), result.pairs().size() + result.unmatched().size());
    }

    @Property
    void alignmentIsDeterministic(@ForAll("names") List<String> namesA, @ForAll("targets") List<String> namesB) {
        assertEquals(align(namesA, namesB), align(namesA, namesB));
    }

    @Provide
    Arbitrary<List<String>> names() {
        return Arbitraries.of("a", "b", "c", "d", "e").list().ofMaxSize(15);
    }

    @Provide
    Arbitrary<List<String>> targets() {
        return Arbitraries.of("A", "B", "C", "Z").list().ofMaxSize(15);
    }

    private AlignmentResult align(List<String> namesA, List<String> namesB) {
        List<PassRecord> a = PassAlignerTest.passes(namesA.toArray(new String[0]));
        List<PassRecord> b = PassAlignerTest.passes(namesB.toArray(new String[0]));
        return aligner.align(a, b, NameMapping.of(MAPPING), ExclusionSet.none());
    }
}
