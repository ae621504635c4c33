package com.raditha.divergence.extraction;

import com.raditha.divergence.model.PassScope;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds file-system safe artifact names such as {@code 007_early-cse_main.ll}.
 */
public final class ArtifactNames {

    static final int MAX_LENGTH = 100;
    static final String EXTENSION = ".ll";

    private static final Pattern HOSTILE = Pattern.compile("[<>:\"/\\\\|?*,()\\[\\]]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern UNDERSCORES = Pattern.compile("_+");

    private ArtifactNames() {
    }

    /**
     * Artifact name for the pass at {@code ordinal}. The target only appears for function scope.
     */
    public static String forPass(int ordinal, String canonicalName, PassScope scope, String target) {
        List<String> parts = new ArrayList<>();
        parts.add(String.format("%03d", ordinal));
        String name = sanitize(canonicalName);
        if (!name.isEmpty()) {
            parts.add(name);
        }
        if (scope == PassScope.FUNCTION && target != null) {
            String cleanTarget = sanitize(target);
            if (!cleanTarget.isEmpty()) {
                parts.add(cleanTarget);
            }
        }
        return String.join("_", parts) + EXTENSION;
    }

    /**
     * Replace hostile characters and whitespace runs with one underscore,
     * trim underscores at both ends and cut to {@value #MAX_LENGTH} characters.
     */
    public static String sanitize(String name) {
        String clean = HOSTILE.matcher(name).replaceAll("_");
        clean = WHITESPACE.matcher(clean).replaceAll("_");
        clean = UNDERSCORES.matcher(clean).replaceAll("_");
        clean = trimUnderscores(clean);
        if (clean.length() > MAX_LENGTH) {
            clean = clean.substring(0, MAX_LENGTH);
        }
        return clean;
    }

    private static String trimUnderscores(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(start, end);
    }
}
