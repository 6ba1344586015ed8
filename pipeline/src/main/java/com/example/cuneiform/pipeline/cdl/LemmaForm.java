package com.example.cuneiform.pipeline.cdl;

import java.util.List;

/**
 * Structured form description of a lemma: surface form, language tag and grapheme break flags.
 */
public record LemmaForm(String form, String language, List<Grapheme> graphemes) {

    public static final LemmaForm EMPTY = new LemmaForm("", "", List.of());

    public LemmaForm {
        form = form == null ? "" : form;
        language = language == null ? "" : language;
        graphemes = graphemes == null ? List.of() : List.copyOf(graphemes);
    }
}
