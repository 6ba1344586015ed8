package com.example.cuneiform.pipeline.glyph;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a normalized wordform into morphemes. Determinatives in braces stay single morphemes with
 * their braces, hyphens inside a parenthetical sign name do not split.
 */
public final class MorphemeSegmenter {

    private static final Pattern DETERMINATIVE = Pattern.compile("\\{.*?\\}");
    private static final Pattern HYPHEN_OUTSIDE_PARENTHESES = Pattern.compile("-(?![^(]*\\))");

    public List<String> segment(String wordform) {
        String expanded = NumeralReadings.expand(wordform);

        List<String> morphemes = new ArrayList<>();
        for (String piece : splitKeepingDeterminatives(expanded)) {
            for (String part : piece.split(" ")) {
                for (String morpheme : HYPHEN_OUTSIDE_PARENTHESES.split(part, -1)) {
                    if (!morpheme.isEmpty()) {
                        morphemes.add(morpheme);
                    }
                }
            }
        }
        return morphemes;
    }

    private static List<String> splitKeepingDeterminatives(String text) {
        List<String> pieces = new ArrayList<>();
        Matcher matcher = DETERMINATIVE.matcher(text);
        int start = 0;
        while (matcher.find()) {
            pieces.add(text.substring(start, matcher.start()));
            pieces.add(matcher.group());
            start = matcher.end();
        }
        pieces.add(text.substring(start));
        return pieces;
    }
}
