package com.example.cuneiform.pipeline.glyph;

import com.example.cuneiform.pipeline.GlyphPipelineException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignLookupTest {

    @TempDir
    Path tempDir;

    @Test
    void jsonTablesSurviveWriteAndLoad() throws Exception {
        SignLookup lookup = SignLookupFixtures.sample();
        Path directory = tempDir.resolve("lookups");
        lookup.writeJson(directory);

        assertTrue(Files.exists(directory.resolve(SignLookup.READINGS_FILE)));
        assertTrue(Files.exists(directory.resolve(SignLookup.GLYPHS_FILE)));

        SignLookup loaded = SignLookup.load(directory);
        assertEquals(lookup.readingToSignNames(), loaded.readingToSignNames());
        assertEquals(lookup.signNameToGlyph(), loaded.signNameToGlyph());
    }

    @Test
    void readsTablesFromJson() throws Exception {
        SignLookup lookup = SignLookup.readJson(
                new StringReader("{\"ka\": [\"KA\"], \"du\": [\"DU\", \"KAK\"]}"),
                new StringReader("{\"KA\": \"𒅗\", \"DU\": \"\"}"));

        assertEquals(List.of("DU", "KAK"), lookup.signNames("du"));
        assertEquals(Optional.of("𒅗"), lookup.glyph("KA"));
        assertEquals(Optional.of(""), lookup.glyph("DU"));
        assertEquals(Optional.empty(), lookup.glyph("KAK"));
        assertEquals(List.of("du"), lookup.readingsOf("KAK"));
        assertEquals(List.of(), lookup.signNames("unknown"));
    }

    @Test
    void malformedJsonIsAnIoError() {
        assertThrows(IOException.class, () -> SignLookup.readJson(
                new StringReader("[1, 2]"), new StringReader("{}")));
    }

    @Test
    void missingLocationIsReported() {
        GlyphPipelineException ex = assertThrows(GlyphPipelineException.class,
                () -> SignLookup.load(tempDir.resolve("absent")));
        assertTrue(ex.getMessage().contains("absent"));
    }
}
