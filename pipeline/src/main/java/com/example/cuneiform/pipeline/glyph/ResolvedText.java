package com.example.cuneiform.pipeline.glyph;

/**
 * Parallel renderings of one record: resolved transliteration, sign names and glyphs.
 */
public record ResolvedText(String transliteration, String signNames, String glyphs) {
}
