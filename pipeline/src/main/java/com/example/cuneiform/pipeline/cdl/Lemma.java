package com.example.cuneiform.pipeline.cdl;

/**
 * A single word occurrence.
 */
public record Lemma(String id, String fragment, LemmaForm form) implements CdlNode {

    public Lemma {
        id = id == null ? "" : id;
        fragment = fragment == null ? "" : fragment;
        form = form == null ? LemmaForm.EMPTY : form;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LEMMA;
    }

    /** Literal text of the lemma: the fragment when present, else the surface form. */
    public String literalText() {
        return fragment.isEmpty() ? form.form() : fragment;
    }

    public String language() {
        return form.language();
    }
}
