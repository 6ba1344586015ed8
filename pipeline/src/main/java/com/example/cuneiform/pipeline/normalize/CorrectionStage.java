package com.example.cuneiform.pipeline.normalize;

/**
 * Points in the normaliser where record-specific corrections are applied.
 */
public enum CorrectionStage {
    /** Before the per-line bracket balance check. */
    UNMATCHED_BRACKETS,
    /** After the enclosure reordering swaps. */
    ENCLOSURE_ORDER,
    /** After every pass that turns lone placeholders into the missing marker. */
    PLACEHOLDERS
}
