package com.example.cuneiform.pipeline.glyph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignLookupStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void storesAndLoadsTables() throws Exception {
        SignLookup lookup = SignLookupFixtures.sample();
        Path database = tempDir.resolve("db").resolve("signs.db");
        SignLookupStore store = new SignLookupStore(database);

        int rows = store.write(lookup);
        SignLookup loaded = store.load();

        int expectedRows = 0;
        for (List<String> names : lookup.readingToSignNames().values()) {
            expectedRows += Math.max(1, names.size());
        }
        assertEquals(expectedRows, rows);
        assertEquals(lookup.readingToSignNames(), loaded.readingToSignNames());
        assertEquals(lookup.signNameToGlyph(), loaded.signNameToGlyph());
        assertTrue(loaded.hasReading("empty"));
        assertEquals(List.of(), loaded.signNames("empty"));
    }

    @Test
    void rewritingReplacesPreviousContent() throws Exception {
        Path database = tempDir.resolve("signs.db");
        SignLookupStore store = new SignLookupStore(database);
        store.write(SignLookupFixtures.sample());
        store.write(SignLookupFixtures.sample());

        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + database.toAbsolutePath());
             Statement statement = connection.createStatement();
             ResultSet result = statement.executeQuery("SELECT COUNT(*) FROM sign_glyphs")) {
            assertTrue(result.next());
            assertEquals(SignLookupFixtures.sample().signNameToGlyph().size(), result.getInt(1));
        }
    }

    @Test
    void databaseFileLoadsThroughSignLookup() throws Exception {
        Path database = tempDir.resolve("signs.db");
        new SignLookupStore(database).write(SignLookupFixtures.sample());

        SignLookup loaded = SignLookup.load(database);
        assertEquals(List.of("LUGAL"), loaded.signNames("lugal"));
    }
}
