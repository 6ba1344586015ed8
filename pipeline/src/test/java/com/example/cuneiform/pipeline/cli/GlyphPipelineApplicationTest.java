package com.example.cuneiform.pipeline.cli;

import com.example.cuneiform.pipeline.glyph.ObservedReadings;
import com.example.cuneiform.pipeline.glyph.SignLookupFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlyphPipelineApplicationTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private GlyphPipelineApplication application;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        application = new GlyphPipelineApplication(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void printsUsageWithoutArguments() {
        assertEquals(1, application.run(new String[0]));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
    }

    @Test
    void rejectsUnknownOption() {
        assertEquals(1, application.run(new String[]{"--fast", "corpus"}));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown option: --fast"));
    }

    @Test
    void missingInputIsReported() {
        int exitCode = application.run(new String[]{tempDir.resolve("absent").toString()});

        assertEquals(2, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Input not found"));
    }

    @Test
    void missingLookupTablesAreReported() throws Exception {
        Path input = Files.copy(corpusFile("P000001.json"), tempDir.resolve("P000001.json"));

        int exitCode = application.run(new String[]{
                "--lookups", tempDir.resolve("no-lookups").toString(), input.toString()});

        assertEquals(2, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Sign lookup tables not found"));
    }

    @Test
    void writesRecordsAndObservedReadings() throws Exception {
        Path lookups = tempDir.resolve("lookups");
        SignLookupFixtures.sample().writeJson(lookups);
        Path corpus = Files.createDirectories(tempDir.resolve("corpus"));
        Files.copy(corpusFile("P000001.json"), corpus.resolve("P000001.json"));
        Files.copy(corpusFile("P000005.json"), corpus.resolve("P000005.json"));
        Path output = tempDir.resolve("out").resolve("glyphs.jsonl");

        int exitCode = application.run(new String[]{
                "--lookups", lookups.toString(), "--output", output.toString(), corpus.toString()});

        assertEquals(0, exitCode, err.toString(StandardCharsets.UTF_8));
        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"id\":\"P000001\""));

        Path readings = output.getParent().resolve(GlyphPipelineApplication.READINGS_FILE);
        try (Reader reader = Files.newBufferedReader(readings, StandardCharsets.UTF_8)) {
            ObservedReadings observed = ObservedReadings.read(reader);
            assertEquals(1, observed.count(SignLookupFixtures.LUGAL, "lugal"));
        }
        String report = out.toString(StandardCharsets.UTF_8);
        assertTrue(report.contains("Records written: 2"));
        assertTrue(report.contains("Documents read: 2"));
    }

    @Test
    void failedRecordsSetErrorExitCode() throws Exception {
        Path lookups = tempDir.resolve("lookups");
        SignLookupFixtures.sample().writeJson(lookups);
        Path corpus = Files.createDirectories(tempDir.resolve("corpus"));
        Files.copy(corpusFile("P000001.json"), corpus.resolve("P000001.json"));
        Files.copy(corpusFile("P000004.json"), corpus.resolve("P000004.json"));

        int exitCode = application.run(new String[]{
                "--lookups", lookups.toString(),
                "--output", tempDir.resolve("glyphs.jsonl").toString(),
                corpus.toString()});

        assertEquals(3, exitCode);
        String errors = err.toString(StandardCharsets.UTF_8);
        assertTrue(errors.contains("P000004: "));
        assertTrue(errors.contains("Completed with errors (1 records failed)."));
        assertTrue(Files.exists(tempDir.resolve("glyphs.jsonl")));
    }

    @Test
    void malformedDocumentDoesNotStopTheBatch() throws Exception {
        Path lookups = tempDir.resolve("lookups");
        SignLookupFixtures.sample().writeJson(lookups);
        Path corpus = Files.createDirectories(tempDir.resolve("corpus"));
        Files.copy(corpusFile("P000001.json"), corpus.resolve("P000001.json"));
        Files.writeString(corpus.resolve("P000009.json"), "{\"cdl\": [", StandardCharsets.UTF_8);
        Path output = tempDir.resolve("glyphs.jsonl");

        int exitCode = application.run(new String[]{
                "--lookups", lookups.toString(), "--output", output.toString(), corpus.toString()});

        assertEquals(3, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("P000009: Malformed JSON"));
        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains("\"id\":\"P000001\""));
    }

    private static Path corpusFile(String name) throws Exception {
        return Path.of(GlyphPipelineApplicationTest.class.getResource("/corpus/" + name).toURI());
    }
}
