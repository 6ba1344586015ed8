package com.example.cuneiform.pipeline.corpus;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlRecordWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesOneObjectPerLine() throws Exception {
        Path output = tempDir.resolve("out").resolve("glyphs.jsonl");
        List<ProcessedRecord> records = List.of(
                new ProcessedRecord("P1", "sux", "<SURFACE>\nlugal", "<SURFACE> \n LUGAL", "<SURFACE>\n𒈗"),
                new ProcessedRecord("P2", "akk", "ka", "KA", "𒅗"));

        new JsonlRecordWriter().write(output, records);

        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        JsonObject first = JsonParser.parseString(lines.get(0)).getAsJsonObject();
        assertEquals("P1", first.get("id").getAsString());
        assertEquals("sux", first.get("langs").getAsString());
        assertEquals("<SURFACE>\nlugal", first.get("transliteration").getAsString());
        assertEquals("<SURFACE> \n LUGAL", first.get("glyph_names").getAsString());
        assertEquals("<SURFACE>\n𒈗", first.get("glyphs").getAsString());
        assertTrue(lines.get(0).contains("<SURFACE>"));
        assertFalse(lines.get(0).contains("\\u003c"));
    }
}
