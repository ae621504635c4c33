package com.raditha.divergence.config;

/**
 * Independent switches for IR text normalization.
 *
 * @param dropBlankLines     drop lines that are blank in the input
 * @param dropMetadata       drop metadata lines (first non-blank character is {@code !})
 * @param stripComments      remove {@code ;} comment suffixes
 * @param stripDebugInfo     remove {@code , !dbg !N} attachments
 * @param renameTemporaries  rename {@code %value} tokens to {@code %temp_N} in first-seen order
 * @param renameLabels       rename block labels and every reference to them to {@code label_N}
 * @param collapseWhitespace collapse whitespace runs to one space and trim each line
 */
public record NormalizationOptions(
        boolean dropBlankLines,
        boolean dropMetadata,
        boolean stripComments,
        boolean stripDebugInfo,
        boolean renameTemporaries,
        boolean renameLabels,
        boolean collapseWhitespace) {

    /**
     * Everything on except comment stripping.
     */
    public static NormalizationOptions defaults() {
        return new NormalizationOptions(true, true, false, true, true, true, true);
    }

    /**
     * Raw comparison: no rewriting at all.
     */
    public static NormalizationOptions none() {
        return new NormalizationOptions(false, false, false, false, false, false, false);
    }

    public NormalizationOptions withStripComments(boolean value) {
        return new NormalizationOptions(dropBlankLines, dropMetadata, value, stripDebugInfo,
                renameTemporaries, renameLabels, collapseWhitespace);
    }

    public NormalizationOptions withRenameTemporaries(boolean value) {
        return new NormalizationOptions(dropBlankLines, dropMetadata, stripComments, stripDebugInfo,
                value, renameLabels, collapseWhitespace);
    }

    public NormalizationOptions withRenameLabels(boolean value) {
        return new NormalizationOptions(dropBlankLines, dropMetadata, stripComments, stripDebugInfo,
                renameTemporaries, value, collapseWhitespace);
    }

    public NormalizationOptions withDropMetadata(boolean value) {
        return new NormalizationOptions(dropBlankLines, value, stripComments, stripDebugInfo,
                renameTemporaries, renameLabels, collapseWhitespace);
    }
}
