package com.raditha.divergence.model;

import java.util.List;
import java.util.Set;

/**
 * Pass names that take no part in alignment, one set per pipeline.
 *
 * @param excludeA names excluded from pipeline A
 * @param excludeB names excluded from pipeline B
 */
public record ExclusionSet(Set<String> excludeA, Set<String> excludeB) {

    public ExclusionSet {
        excludeA = excludeA == null ? Set.of() : Set.copyOf(excludeA);
        excludeB = excludeB == null ? Set.of() : Set.copyOf(excludeB);
    }

    public static ExclusionSet none() {
        return new ExclusionSet(Set.of(), Set.of());
    }

    public static ExclusionSet of(List<String> excludeA, List<String> excludeB) {
        return new ExclusionSet(Set.copyOf(excludeA), Set.copyOf(excludeB));
    }

    public boolean excludesA(String name) {
        return excludeA.contains(name);
    }

    public boolean excludesB(String name) {
        return excludeB.contains(name);
    }
}
