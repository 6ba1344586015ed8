package com.example.cuneiform.pipeline.corpus;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops records repeating the transliteration of an earlier record, then records repeating the
 * glyph string of an earlier survivor. The first occurrence is kept in both passes.
 */
public final class RecordDeduplicator {

    public Result deduplicate(List<ProcessedRecord> records) {
        List<ProcessedRecord> byTransliteration = new ArrayList<>();
        Set<String> transliterations = new HashSet<>();
        for (ProcessedRecord record : records) {
            if (transliterations.add(record.transliteration())) {
                byTransliteration.add(record);
            }
        }

        List<ProcessedRecord> byGlyphs = new ArrayList<>();
        Set<String> glyphs = new HashSet<>();
        for (ProcessedRecord record : byTransliteration) {
            if (glyphs.add(record.glyphs())) {
                byGlyphs.add(record);
            }
        }
        return new Result(byGlyphs,
                records.size() - byTransliteration.size(),
                byTransliteration.size() - byGlyphs.size());
    }

    public record Result(List<ProcessedRecord> records, int duplicateTransliterations, int duplicateGlyphs) {

        public Result {
            records = List.copyOf(records);
        }
    }
}
