package com.example.cuneiform.pipeline.glyph;

import java.util.Map;
import java.util.Optional;

/**
 * Spelled readings of bare numerals as they appear in transliterations.
 */
public final class NumeralReadings {

    private static final Map<String, String> READINGS = Map.ofEntries(
            Map.entry("1/2", "1/2(diš)"),
            Map.entry("1/3", "1/3(diš)"),
            Map.entry("1/4", "1/3(iku)"),
            Map.entry("2/3", "2/3(diš)"),
            Map.entry("5/6", "5/6(diš)"),
            Map.entry("1", "1(diš)"),
            Map.entry("2", "2(diš)"),
            Map.entry("3", "3(diš)"),
            Map.entry("4", "4(diš)"),
            Map.entry("5", "5(diš)"),
            Map.entry("6", "6(diš)"),
            Map.entry("7", "7(diš)"),
            Map.entry("8", "8(diš)"),
            Map.entry("9", "9(diš)"),
            Map.entry("10", "1(u)"),
            Map.entry("11", "1(u) 1(diš)"),
            Map.entry("12", "1(u) 2(diš)"),
            Map.entry("14", "1(u) 4(diš)"),
            Map.entry("18", "1(u) 8(diš)"),
            Map.entry("20", "2(u)"),
            Map.entry("21", "2(u) 1(diš)"),
            Map.entry("23", "2(u) 3(diš)"),
            Map.entry("24", "2(u) 4(diš)"),
            Map.entry("25", "2(u) 5(diš)"),
            Map.entry("30", "3(u)"),
            Map.entry("36", "3(u) 6(diš)"),
            Map.entry("40", "4(u)"),
            Map.entry("50", "5(u)"),
            Map.entry("60", "6(u)"),
            Map.entry("600", "1(gešʾu)"),
            Map.entry("900", "1(gešʾu) 5(geš₂)"),
            Map.entry("3600", "1(šarʾu@c)"),
            Map.entry("36000", "1(šar₂)"));

    private NumeralReadings() {
    }

    public static Optional<String> readingOf(String numeral) {
        return Optional.ofNullable(READINGS.get(numeral));
    }

    /**
     * Spells out a wordform that is a bare numeral or a numeral followed by a hyphenated suffix.
     * Anything else is returned unchanged.
     */
    public static String expand(String wordform) {
        String whole = READINGS.get(wordform);
        if (whole != null) {
            return whole;
        }
        int hyphen = wordform.indexOf('-');
        if (hyphen >= 0) {
            String head = READINGS.get(wordform.substring(0, hyphen));
            if (head != null) {
                return head + "-" + wordform.substring(hyphen + 1);
            }
        }
        return wordform;
    }
}
