package com.example.cuneiform.pipeline.corpus;

import com.google.gson.JsonObject;

/**
 * Output row of the pipeline.
 */
public record ProcessedRecord(String id, String languages, String transliteration, String signNames, String glyphs) {

    public JsonObject toJson() {
        JsonObject object = new JsonObject();
        object.addProperty("id", id);
        object.addProperty("langs", languages);
        object.addProperty("transliteration", transliteration);
        object.addProperty("glyph_names", signNames);
        object.addProperty("glyphs", glyphs);
        return object;
    }
}
