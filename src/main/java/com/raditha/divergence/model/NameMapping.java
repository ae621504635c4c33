package com.raditha.divergence.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pipeline-A pass name to pipeline-B pass name. Read-only for the run.
 * Several A names may point at the same B name.
 */
public final class NameMapping {

    private final Map<String, String> entries;

    public NameMapping(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static NameMapping of(Map<String, String> entries) {
        return new NameMapping(entries);
    }

    /**
     * @return the B name, empty when there is none or it is blank
     */
    public Optional<String> targetOf(String pipelineAName) {
        return Optional.ofNullable(entries.get(pipelineAName)).filter(target -> !target.isBlank());
    }

    public int size() {
        return entries.size();
    }

    public Map<String, String> asMap() {
        return entries;
    }

    /**
     * B names that more than one A name maps to, in first-seen order.
     */
    public Set<String> duplicateTargets() {
        Map<String, Integer> counts = new HashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String target : entries.values()) {
            if (!target.isBlank() && counts.merge(target, 1, Integer::sum) > 1) {
                duplicates.add(target);
            }
        }
        return duplicates;
    }
}
