package com.example.cuneiform.pipeline.cdl;

import java.util.List;

/**
 * Restores square brackets that the lemma text lost next to numerals, parentheses or vertical bars.
 * The break flags of the lemma's graphemes give the bracket sequence the text should carry; when
 * the literal text disagrees, a few repairs are tried in turn. This is a heuristic: a handful of
 * lemmas still come out unbalanced and are reported by the normaliser later on.
 */
public final class BracketRepair {

    private BracketRepair() {
    }

    /**
     * Builds the bracket sequence implied by the break flags, nested graphemes first.
     */
    public static String idealSequence(List<Grapheme> graphemes) {
        StringBuilder builder = new StringBuilder();
        for (Grapheme grapheme : graphemes) {
            for (Grapheme part : grapheme.parts()) {
                appendFlags(builder, part);
            }
            appendFlags(builder, grapheme);
        }
        return builder.toString();
    }

    /**
     * Projects a text onto its square brackets.
     */
    public static String actualSequence(String text) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[' || c == ']') {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    public static String repair(String text, String ideal) {
        if (ideal.isEmpty()) {
            return text;
        }
        String actual = actualSequence(text);
        if (ideal.equals(actual)) {
            return text;
        }

        // open-and-shut, e.g. "abc]-def-[ghi" missing its outer pair
        if (ideal.startsWith("[") && ideal.endsWith("]")) {
            String wrapped = text;
            if (!actual.startsWith("[")) {
                wrapped = "[" + wrapped;
            }
            if (!actual.endsWith("]")) {
                wrapped = wrapped + "]";
            }
            if (ideal.equals(actualSequence(wrapped))) {
                return wrapped;
            }
            return "[" + stripBrackets(text) + "]";
        }

        String repaired = text;
        if (ideal.startsWith("]") && !actual.startsWith("]")) {
            int open = repaired.indexOf('[');
            repaired = open < 0
                    ? repaired + "]"
                    : repaired.substring(0, open) + "]" + repaired.substring(open);
        }
        if (ideal.endsWith("[") && !actual.endsWith("[")) {
            int close = repaired.indexOf(']');
            repaired = close < 0
                    ? "[" + repaired
                    : repaired.substring(0, close) + "[" + repaired.substring(close);
        }
        if (ideal.equals(actualSequence(repaired))) {
            return repaired;
        }

        String stripped = stripBrackets(repaired);
        if (ideal.contains("[]")) {
            stripped = "[" + stripped + "]";
        }
        if (ideal.startsWith("[")) {
            stripped = "[" + stripped;
        }
        if (ideal.endsWith("]")) {
            stripped = stripped + "]";
        }
        return stripped;
    }

    private static void appendFlags(StringBuilder builder, Grapheme grapheme) {
        if (grapheme.breakStart()) {
            builder.append('[');
        }
        if (grapheme.breakEnd()) {
            builder.append(']');
        }
    }

    private static String stripBrackets(String text) {
        return text.replace("[", "").replace("]", "");
    }
}
