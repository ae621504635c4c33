package com.raditha.divergence.report;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs between the canonical texts of a divergent pair.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff with three context lines.
     *
     * @param originalName label of the pipeline-A side, shown as {@code a/<name>}
     * @param original     pipeline-A text
     * @param revisedName  label of the pipeline-B side, shown as {@code b/<name>}
     * @param revised      pipeline-B text
     * @return unified diff, empty when the texts are equal
     */
    public String generateUnifiedDiff(String originalName, String original, String revisedName, String revised) {
        return generateUnifiedDiff(originalName, original, revisedName, revised, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String originalName, String original, String revisedName, String revised,
            int contextLines) {
        List<String> originalLines = toLines(original);
        List<String> revisedLines = toLines(revised);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + originalName,
                "b/" + revisedName,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> toLines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\n", -1));
    }
}
