package com.raditha.divergence.model;

/**
 * A recognized pass header banner.
 *
 * @param canonicalName name used for mapping and alignment
 * @param scope         scope declared by the banner
 * @param target        function name for {@link PassScope#FUNCTION}, otherwise null
 * @param lineNumber    1-based line of the banner in the dump
 * @param originalLine  banner line with trailing whitespace removed
 */
public record HeaderDescriptor(
        String canonicalName,
        PassScope scope,
        String target,
        int lineNumber,
        String originalLine) {

    public HeaderDescriptor {
        if (canonicalName == null) {
            throw new IllegalArgumentException("canonicalName cannot be null");
        }
        if (scope == null) {
            scope = PassScope.UNKNOWN;
        }
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be >= 1");
        }
    }
}
