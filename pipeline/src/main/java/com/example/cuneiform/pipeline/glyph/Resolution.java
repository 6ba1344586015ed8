package com.example.cuneiform.pipeline.glyph;

import com.example.cuneiform.pipeline.SpecialToken;

/**
 * One resolved morpheme: the reading as displayed in the transliteration, its sign name and its
 * glyph. Any of the three may be {@code <unk>}.
 */
public record Resolution(String morpheme, String signName, String glyph) {

    public static final Resolution UNKNOWN =
            new Resolution(SpecialToken.UNKNOWN, SpecialToken.UNKNOWN, SpecialToken.UNKNOWN);

    static Resolution passThrough(String token) {
        return new Resolution(token, token, token);
    }

    public boolean isUnknown() {
        return SpecialToken.UNKNOWN.equals(glyph);
    }
}
