package com.example.cuneiform.pipeline.cdl;

import java.util.List;

/**
 * Break flags of one grapheme in a lemma's form description, together with the flags of the
 * graphemes nested in its sequence or group.
 */
public record Grapheme(boolean breakStart, boolean breakEnd, List<Grapheme> parts) {

    public Grapheme {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }
}
