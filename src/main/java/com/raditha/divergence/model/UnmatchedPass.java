package com.raditha.divergence.model;

/**
 * A pipeline-A pass the aligner could not pair.
 */
public record UnmatchedPass(PassRecord pass, UnmatchReason reason) {
}
