package com.example.cuneiform.pipeline.glyph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MorphemeSegmenterTest {

    private final MorphemeSegmenter segmenter = new MorphemeSegmenter();

    @Test
    void splitsOnHyphens() {
        assertEquals(List.of("lugal", "la", "ka"), segmenter.segment("lugal-la-ka"));
    }

    @Test
    void spellsOutNumeralsBeforeSplitting() {
        assertEquals(List.of("7(diš)", "bi"), segmenter.segment("7-bi"));
        assertEquals(List.of("1(u)", "1(diš)"), segmenter.segment("11"));
        assertEquals(List.of("1(gešʾu)", "5(geš₂)", "kam"), segmenter.segment("900-kam"));
        assertEquals(List.of("1/3(iku)"), segmenter.segment("1/4"));
    }

    @Test
    void keepsDeterminativesAsTheirOwnMorphemes() {
        assertEquals(List.of("uri₅", "{ki}"), segmenter.segment("uri₅{ki}"));
        assertEquals(List.of("{d}", "en", "lil₂"), segmenter.segment("{d}en-lil₂"));
        assertEquals(List.of("{giš}", "tukul", "{meš}"), segmenter.segment("{giš}tukul{meš}"));
    }

    @Test
    void doesNotSplitInsideParentheses() {
        assertEquals(List.of("kurₓ(|A-B|)", "ta"), segmenter.segment("kurₓ(|A-B|)-ta"));
        assertEquals(List.of("sanga(ŠID)"), segmenter.segment("sanga(ŠID)"));
    }

    @Test
    void dropsEmptyPieces() {
        assertEquals(List.of("a", "b"), segmenter.segment("-a--b-"));
        assertEquals(List.of(), segmenter.segment(""));
    }

    @Test
    void numeralTableLeavesOtherWordformsAlone() {
        assertEquals("13", NumeralReadings.expand("13"));
        assertEquals("3(u) 6(diš)", NumeralReadings.expand("36"));
        assertEquals("6(u)-še₃", NumeralReadings.expand("60-še₃"));
        assertEquals("lugal-7", NumeralReadings.expand("lugal-7"));
    }
}
