package com.example.cuneiform.pipeline.glyph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignListImporterTest {

    private ByteArrayOutputStream errBuffer;
    private SignListImporter importer;

    @BeforeEach
    void setUp() {
        errBuffer = new ByteArrayOutputStream();
        importer = new SignListImporter(new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void collectsReadingsFromSignsAndForms() throws Exception {
        SignLookup lookup = importer.importSignList(resource("/signlist/sl.json"), null);

        assertEquals(List.of("AN"), lookup.signNames("an"));
        assertEquals(List.of("AN"), lookup.signNames("d"));
        assertEquals(List.of("KA", "KA@t"), lookup.signNames("ka"));
        assertEquals(List.of("KA"), lookup.signNames("du₁₁"));
        assertEquals(List.of("|A&A|~a"), lookup.signNames("ayyaₓ"));
        assertFalse(lookup.hasReading(""));
    }

    @Test
    void aliasesShareTheGlyphOfTheirSign() throws Exception {
        SignLookup lookup = importer.importSignList(resource("/signlist/sl.json"), null);

        assertEquals(Optional.of("𒀭"), lookup.glyph("DINGIR"));
        assertEquals(Optional.of("𒅘"), lookup.glyph("KA@90"));
        assertEquals(Optional.of("𒀀𒀀"), lookup.glyph("|A&A|"));
        assertEquals(Optional.of(""), lookup.glyph("KAxX"));
        assertEquals(Optional.of(""), lookup.glyph("|A&A|~a"));
    }

    @Test
    void firstGlyphWinsAndConflictIsReported() throws Exception {
        SignLookup lookup = importer.importSignList(resource("/signlist/sl.json"), null);

        assertEquals(Optional.of("𒆕"), lookup.glyph("GAG"));
        assertEquals(1, importer.multipleGlyphWarnings());
        String err = errBuffer.toString(StandardCharsets.UTF_8);
        assertTrue(err.contains("GAG"), err);
    }

    @Test
    void supplementaryIndexOverridesReadings() throws Exception {
        SignLookup lookup = importer.importSignList(resource("/signlist/sl.json"),
                resource("/signlist/epsd2-sl.json"));

        assertEquals(List.of("KAK"), lookup.signNames("du₁₁"));
        assertEquals(List.of("GIŠ"), lookup.signNames("ŋeš"));
        assertEquals(List.of("KA", "KA@t"), lookup.signNames("ka"));
    }

    @Test
    void reverseMappingListsReadingsOfASign() throws Exception {
        SignLookup lookup = importer.importSignList(resource("/signlist/sl.json"), null);

        assertEquals(List.of("ka", "dug₄", "du₁₁"), lookup.readingsOf("KA"));
        assertEquals(List.of("an", "diŋir", "d"), lookup.readingsOf("AN"));
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(SignListImporterTest.class.getResource(name).toURI());
    }
}
