package com.example.cuneiform.pipeline.cli;

import com.example.cuneiform.pipeline.glyph.SignLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignListImporterApplicationTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private SignListImporterApplication application;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        application = new SignListImporterApplication(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void printsUsageWithoutArguments() {
        assertEquals(1, application.run(new String[0]));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
    }

    @Test
    void missingSignListIsReported() {
        int exitCode = application.run(new String[]{tempDir.resolve("sl.json").toString()});

        assertEquals(2, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Sign list not found"));
    }

    @Test
    void malformedSignListFails() throws Exception {
        Path signList = Files.writeString(tempDir.resolve("sl.json"), "{\"signs\": [");

        int exitCode = application.run(new String[]{
                signList.toString(), "--output", tempDir.resolve("lookups").toString()});

        assertEquals(3, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Import failed"));
    }

    @Test
    void writesJsonTablesAndDatabase() throws Exception {
        Path output = tempDir.resolve("lookups");
        Path database = tempDir.resolve("lookups.db");

        int exitCode = application.run(new String[]{
                resource("/signlist/sl.json").toString(),
                "--index", resource("/signlist/epsd2-sl.json").toString(),
                "--output", output.toString(),
                "--database", database.toString()});

        assertEquals(0, exitCode, err.toString(StandardCharsets.UTF_8));
        assertTrue(Files.exists(output.resolve(SignLookup.READINGS_FILE)));
        assertTrue(Files.exists(output.resolve(SignLookup.GLYPHS_FILE)));
        assertTrue(Files.exists(database));

        SignLookup fromJson = SignLookup.load(output);
        SignLookup fromDatabase = SignLookup.load(database);
        assertTrue(fromJson.hasReading("an"));
        assertEquals(fromJson.readingToSignNames(), fromDatabase.readingToSignNames());
        assertEquals(fromJson.signNameToGlyph(), fromDatabase.signNameToGlyph());

        String report = out.toString(StandardCharsets.UTF_8);
        assertTrue(report.contains("Stored "));
        assertTrue(report.contains("Sign names with more than one glyph: 1"));
    }

    private static Path resource(String name) throws Exception {
        return Path.of(SignListImporterApplicationTest.class.getResource(name).toURI());
    }
}
