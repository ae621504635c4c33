package com.raditha.divergence.normalization;

/**
 * Line counts before and after normalization, for debug output.
 */
public record NormalizationStats(int originalLines, int normalizedLines) {

    public static NormalizationStats of(String original, String normalized) {
        return new NormalizationStats(countLines(original), countLines(normalized));
    }

    public int linesRemoved() {
        return originalLines - normalizedLines;
    }

    public double reductionPercent() {
        return originalLines > 0 ? linesRemoved() * 100.0 / originalLines : 0.0;
    }

    private static int countLines(String text) {
        return text.isEmpty() ? 0 : (int) text.lines().count();
    }
}
