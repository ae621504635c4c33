package com.raditha.divergence.config;

import com.raditha.divergence.extraction.HeaderDialect;

/**
 * Command-line values that take precedence over the YAML configuration.
 * The boolean switches can only turn a normalization off (or, for comments, on);
 * a null dialect means "use the configured one".
 */
public record CliOverrides(
        boolean noRenameTemporaries,
        boolean noRenameLabels,
        boolean keepMetadata,
        boolean stripComments,
        HeaderDialect dialectA,
        HeaderDialect dialectB) {

    public static CliOverrides none() {
        return new CliOverrides(false, false, false, false, null, null);
    }
}
