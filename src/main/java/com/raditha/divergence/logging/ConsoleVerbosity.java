package com.raditha.divergence.logging;

import ch.qos.logback.classic.Level;

/**
 * How much of the run log reaches the console. The run log file always gets everything.
 */
public enum ConsoleVerbosity {
    QUIET(Level.WARN),
    NORMAL(Level.INFO),
    VERBOSE(Level.DEBUG);

    private final Level threshold;

    ConsoleVerbosity(Level threshold) {
        this.threshold = threshold;
    }

    public Level threshold() {
        return threshold;
    }

    public static ConsoleVerbosity of(boolean verbose, boolean quiet) {
        if (verbose && quiet) {
            throw new IllegalArgumentException("Cannot use both --verbose and --quiet");
        }
        if (verbose) {
            return VERBOSE;
        }
        return quiet ? QUIET : NORMAL;
    }
}
