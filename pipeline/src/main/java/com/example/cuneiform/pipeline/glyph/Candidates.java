package com.example.cuneiform.pipeline.glyph;

import java.util.List;

/**
 * Display form of a morpheme together with the sign names it could stand for.
 */
public record Candidates(String display, List<String> signNames) {

    public Candidates {
        signNames = List.copyOf(signNames);
    }

    static Candidates none(String display) {
        return new Candidates(display, List.of());
    }

    public boolean isUnique() {
        return signNames.size() == 1;
    }
}
