package com.example.cuneiform.pipeline.cdl;

import com.example.cuneiform.pipeline.GlyphPipelineException;

/**
 * Raised when an annotation tree contains a node that cannot be mapped onto one of the known
 * node kinds.
 */
public class CdlFormatException extends GlyphPipelineException {
    public CdlFormatException(String message) {
        super(message);
    }
}
