package com.example.cuneiform.pipeline.corpus;

import com.example.cuneiform.pipeline.glyph.ResolvedText;

import java.util.regex.Pattern;

/**
 * Final clean-up of resolved text before it is written.
 */
final class OutputFormatter {

    private static final Pattern SPACES_AROUND_NEWLINE = Pattern.compile(" *\n *");
    private static final Pattern ELLIPSIS_RUN = Pattern.compile("( *\\.{3,} *)+");

    private OutputFormatter() {
    }

    static ResolvedText format(ResolvedText resolved) {
        String transliteration = SPACES_AROUND_NEWLINE.matcher(resolved.transliteration()).replaceAll("\n")
                .replace("-{", "{")
                .replace("}-", "}");
        transliteration = collapseEllipses(transliteration);
        String signNames = collapseEllipses(resolved.signNames());
        String glyphs = collapseEllipses(resolved.glyphs()).replace(" ", "");
        return new ResolvedText(transliteration, signNames, glyphs);
    }

    private static String collapseEllipses(String text) {
        return ELLIPSIS_RUN.matcher(text).replaceAll("...");
    }
}
