package com.raditha.divergence.model;

/**
 * Why a pipeline-A pass ended up without a counterpart.
 */
public enum UnmatchReason {
    /** The pass itself is in the pipeline-A exclusion list. */
    EXCLUDED,

    /** The mapping has no entry for the pass name. */
    NO_MAPPING,

    /** The mapped pipeline-B name is in the pipeline-B exclusion list. */
    TARGET_EXCLUDED,

    /** No unused pipeline-B pass with the mapped name follows the previous match. */
    NO_CHRONOLOGICAL_MATCH
}
