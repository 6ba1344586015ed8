package com.example.cuneiform.pipeline;

/**
 * Exception thrown when a record or a lookup table cannot be processed at all.
 */
public class GlyphPipelineException extends RuntimeException {
    public GlyphPipelineException(String message) {
        super(message);
    }

    public GlyphPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
