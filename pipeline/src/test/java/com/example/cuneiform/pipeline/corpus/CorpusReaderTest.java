package com.example.cuneiform.pipeline.corpus;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CorpusReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void directoriesAreWalkedInNameOrder() throws Exception {
        Path nested = Files.createDirectories(tempDir.resolve("b"));
        Files.writeString(nested.resolve("P2.json"), "{}");
        Files.writeString(tempDir.resolve("a.json"), "{}");
        Files.writeString(tempDir.resolve("notes.txt"), "skip");

        List<Path> inputs = new CorpusReader().collectInputs(List.of(tempDir));

        assertEquals(List.of(tempDir.resolve("a.json"), nested.resolve("P2.json")), inputs);
    }

    @Test
    void missingInputIsReported() {
        IOException ex = assertThrows(IOException.class,
                () -> new CorpusReader().collectInputs(List.of(tempDir.resolve("absent"))));

        assertTrue(ex.getMessage().startsWith("Input not found"));
    }

    @Test
    void recordIdDropsExtension() throws Exception {
        TextRecord record = new CorpusReader().read(GlyphPipelineTest.corpusFile("P000005.json"));

        assertEquals("P000005", record.id());
        assertEquals(1, record.nodes().size());
        assertEquals("P9", CorpusReader.recordId(Path.of("dir", "P9.JSON")));
    }
}
