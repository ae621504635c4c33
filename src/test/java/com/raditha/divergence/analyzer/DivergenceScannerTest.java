package com.raditha.divergence.analyzer;

import com.raditha.divergence.config.NormalizationOptions;
import com.raditha.divergence.extraction.ArtifactStorage;
import com.raditha.divergence.extraction.InMemoryArtifactStorage;
import com.raditha.divergence.extraction.StorageFaultException;
import com.raditha.divergence.model.AlignmentPair;
import com.raditha.divergence.model.ArtifactHandle;
import com.raditha.divergence.model.DivergenceResult;
import com.raditha.divergence.model.PassRecord;
import com.raditha.divergence.model.PassScope;
import com.raditha.divergence.normalization.IRNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DivergenceScannerTest {

    private InMemoryArtifactStorage storageA;
    private InMemoryArtifactStorage storageB;
    private DivergenceScanner scanner;

    @BeforeEach
    void setUp() {
        storageA = new InMemoryArtifactStorage("a");
        storageB = new InMemoryArtifactStorage("b");
        scanner = new DivergenceScanner(storageA, storageB, new IRNormalizer());
    }

    private PassRecord record(InMemoryArtifactStorage storage, String name, int index, String content) {
        ArtifactHandle handle = storage.write(String.format("%03d_%s.ll", index, name),
                content.getBytes(StandardCharsets.UTF_8));
        return new PassRecord(name, index, PassScope.UNKNOWN, null, handle);
    }

    @Test
    void testFindsFirstDifferingPair() {
        List<AlignmentPair> pairs = List.of(
                new AlignmentPair(record(storageA, "InstCombine", 0, "%x = add i32 1, 2\n"),
                        record(storageB, "instcombine", 0, "  %v = add i32 1, 2\n")),
                new AlignmentPair(record(storageA, "early-cse", 1, "ret i32 3\n"),
                        record(storageB, "early-cse", 2, "ret i32 4\n")));

        DivergenceResult result = scanner.findFirstDivergence(pairs, NormalizationOptions.defaults());

        assertTrue(result.found());
        assertEquals(1, result.index());
        assertSame(pairs.get(1), result.pair());
        assertSame(pairs.get(0), result.lastCommonPair());
        assertEquals("ret i32 3", result.canonicalA());
        assertEquals("ret i32 4", result.canonicalB());
        assertEquals(2, result.comparedPairs());
    }

    @Test
    void testDivergenceAtFirstPairHasNoLastCommon() {
        List<AlignmentPair> pairs = List.of(new AlignmentPair(
                record(storageA, "gvn", 0, "ret void\n"), record(storageB, "GVNPass", 0, "unreachable\n")));

        DivergenceResult result = scanner.findFirstDivergence(pairs, NormalizationOptions.defaults());

        assertTrue(result.found());
        assertEquals(0, result.index());
        assertFalse(result.hasLastCommonPair());
    }

    @Test
    void testNoDivergence() {
        List<AlignmentPair> pairs = List.of(new AlignmentPair(
                record(storageA, "gvn", 0, "ret void ; a\n"), record(storageB, "GVNPass", 0, "ret void ; a\n")));

        DivergenceResult result = scanner.findFirstDivergence(pairs, NormalizationOptions.defaults());

        assertFalse(result.found());
        assertEquals(-1, result.index());
        assertNull(result.pair());
        assertEquals(1, result.comparedPairs());
    }

    @Test
    void testEmptyPairList() {
        DivergenceResult result = scanner.findFirstDivergence(List.of(), NormalizationOptions.defaults());
        assertFalse(result.found());
        assertEquals(0, result.comparedPairs());
    }

    @Test
    void testStopsReadingAfterFirstDivergence() {
        List<AlignmentPair> pairs = new ArrayList<>();
        pairs.add(new AlignmentPair(record(storageA, "p0", 0, "x\n"), record(storageB, "p0", 0, "y\n")));
        pairs.add(new AlignmentPair(record(storageA, "p1", 1, "z\n"), record(storageB, "p1", 1, "z\n")));

        ArtifactStorage spyA = spy(storageA);
        ArtifactStorage spyB = spy(storageB);
        new DivergenceScanner(spyA, spyB, new IRNormalizer())
                .findFirstDivergence(pairs, NormalizationOptions.defaults());

        verify(spyA, times(1)).read(any());
        verify(spyB, times(1)).read(any());
        verify(spyA, never()).read(pairs.get(1).a().artifact());
    }

    @Test
    void testStorageFaultPropagates() {
        ArtifactStorage broken = mock(ArtifactStorage.class);
        when(broken.read(any())).thenThrow(new StorageFaultException("unreadable", null));
        List<AlignmentPair> pairs = List.of(new AlignmentPair(
                record(storageA, "gvn", 0, "ret void\n"), record(storageB, "GVNPass", 0, "ret void\n")));

        DivergenceScanner brokenScanner = new DivergenceScanner(broken, new IRNormalizer());
        assertThrows(StorageFaultException.class,
                () -> brokenScanner.findFirstDivergence(pairs, NormalizationOptions.defaults()));
    }

    @Test
    void testRawComparisonSeesNameDifferences() {
        List<AlignmentPair> pairs = List.of(new AlignmentPair(
                record(storageA, "gvn", 0, "%x = add i32 1, 2\n"), record(storageB, "GVNPass", 0, "%y = add i32 1, 2\n")));

        assertFalse(scanner.findFirstDivergence(pairs, NormalizationOptions.defaults()).found());
        assertTrue(scanner.findFirstDivergence(pairs, NormalizationOptions.none()).found());
    }
}
