package com.example.cuneiform.pipeline.normalize;

import com.example.cuneiform.pipeline.Diagnostics;

import java.util.Objects;

/**
 * Per-record state handed to every rewrite rule.
 */
public record RewriteContext(String recordId, Diagnostics diagnostics, RecordCorrections corrections) {

    public RewriteContext {
        recordId = recordId == null ? "" : recordId;
        Objects.requireNonNull(diagnostics, "diagnostics");
        Objects.requireNonNull(corrections, "corrections");
    }

    public static RewriteContext of(String recordId, Diagnostics diagnostics) {
        return new RewriteContext(recordId, diagnostics, RecordCorrections.none());
    }

    public void report(String message) {
        diagnostics.report(recordId, message);
    }

    public void trace(String message) {
        diagnostics.trace(recordId, message);
    }

    public String correct(CorrectionStage stage, String text) {
        return corrections.apply(stage, recordId, text);
    }
}
