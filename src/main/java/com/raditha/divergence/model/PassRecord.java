package com.raditha.divergence.model;

/**
 * One pass snapshot extracted from a pipeline dump.
 *
 * @param canonicalName name from the header banner
 * @param sequenceIndex 0-based position in discovery order
 * @param scope         scope declared by the banner
 * @param target        function name when the scope is {@link PassScope#FUNCTION}
 * @param artifact      handle of the extracted text
 */
public record PassRecord(
        String canonicalName,
        int sequenceIndex,
        PassScope scope,
        String target,
        ArtifactHandle artifact) {

    public PassRecord {
        if (canonicalName == null) {
            throw new IllegalArgumentException("canonicalName cannot be null");
        }
        if (sequenceIndex < 0) {
            throw new IllegalArgumentException("sequenceIndex must be >= 0");
        }
        if (scope == null) {
            scope = PassScope.UNKNOWN;
        }
    }

    /**
     * Format as "#3 early-cse" for logs and summaries.
     */
    public String toDisplayString() {
        return "#" + sequenceIndex + " " + canonicalName;
    }
}
