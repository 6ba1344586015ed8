package com.example.cuneiform.pipeline.glyph;

/**
 * Categories of resolution failures tracked by {@link ResolutionStatistics}.
 */
public enum UnresolvedKind {
    SIGN_NAME("UNKNOWN SIGN NAMES"),
    NUMERAL("UNKNOWN NUMERALS"),
    OTHER("UNKNOWN OTHER"),
    NAME_NOT_IN_TABLE("SIGN NAMES MISSING FROM " + SignLookup.GLYPHS_FILE),
    NAME_WITHOUT_GLYPH("SIGN NAMES WITHOUT GLYPH");

    private final String title;

    UnresolvedKind(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }
}
