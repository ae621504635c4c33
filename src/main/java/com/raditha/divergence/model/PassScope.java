package com.raditha.divergence.model;

/**
 * What a pass snapshot covers, as stated by its header banner.
 */
public enum PassScope {
    /** Whole-module snapshot. */
    MODULE,

    /** Single function snapshot; the header names the function. */
    FUNCTION,

    /** The banner does not say (legacy dumps never do). */
    UNKNOWN
}
