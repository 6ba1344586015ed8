package com.example.cuneiform.pipeline.glyph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SQLite persistence for {@link SignLookup}. A reading without candidates is kept as a single row
 * with a {@code NULL} sign name so that it still counts as a known reading after loading.
 */
public final class SignLookupStore {

    private final Path databasePath;

    public SignLookupStore(Path databasePath) {
        this.databasePath = Objects.requireNonNull(databasePath, "databasePath");
    }

    public Path databasePath() {
        return databasePath;
    }

    /**
     * Replaces the stored tables with the contents of {@code lookup}.
     *
     * @return number of reading rows written
     */
    public int write(SignLookup lookup) throws IOException, SQLException {
        Path parent = databasePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Connection connection = open()) {
            initialiseDatabase(connection);
            connection.setAutoCommit(false);
            int rows = 0;
            try {
                try (Statement statement = connection.createStatement()) {
                    statement.executeUpdate("DELETE FROM reading_sign_names");
                    statement.executeUpdate("DELETE FROM sign_glyphs");
                }
                String readingSql = "INSERT INTO reading_sign_names (reading, position, sign_name) VALUES (?,?,?)";
                try (PreparedStatement statement = connection.prepareStatement(readingSql)) {
                    for (Map.Entry<String, List<String>> entry : lookup.readingToSignNames().entrySet()) {
                        List<String> names = entry.getValue();
                        if (names.isEmpty()) {
                            statement.setString(1, entry.getKey());
                            statement.setInt(2, 0);
                            statement.setNull(3, Types.VARCHAR);
                            statement.addBatch();
                            rows++;
                            continue;
                        }
                        for (int i = 0; i < names.size(); i++) {
                            statement.setString(1, entry.getKey());
                            statement.setInt(2, i);
                            statement.setString(3, names.get(i));
                            statement.addBatch();
                            rows++;
                        }
                    }
                    statement.executeBatch();
                }
                String glyphSql = "INSERT INTO sign_glyphs (sign_name, glyph) VALUES (?,?)";
                try (PreparedStatement statement = connection.prepareStatement(glyphSql)) {
                    for (Map.Entry<String, String> entry : lookup.signNameToGlyph().entrySet()) {
                        statement.setString(1, entry.getKey());
                        statement.setString(2, entry.getValue());
                        statement.addBatch();
                    }
                    statement.executeBatch();
                }
                connection.commit();
            } catch (SQLException ex) {
                connection.rollback();
                throw ex;
            }
            return rows;
        }
    }

    public SignLookup load() throws SQLException {
        Map<String, List<String>> readingToSignNames = new LinkedHashMap<>();
        Map<String, String> signNameToGlyph = new LinkedHashMap<>();
        try (Connection connection = open()) {
            initialiseDatabase(connection);
            try (Statement statement = connection.createStatement();
                 ResultSet rows = statement.executeQuery(
                         "SELECT reading, sign_name FROM reading_sign_names ORDER BY id")) {
                while (rows.next()) {
                    List<String> names = readingToSignNames.computeIfAbsent(rows.getString(1), key -> new ArrayList<>());
                    String name = rows.getString(2);
                    if (name != null) {
                        names.add(name);
                    }
                }
            }
            try (Statement statement = connection.createStatement();
                 ResultSet rows = statement.executeQuery("SELECT sign_name, glyph FROM sign_glyphs ORDER BY id")) {
                while (rows.next()) {
                    signNameToGlyph.put(rows.getString(1), rows.getString(2));
                }
            }
        }
        return new SignLookup(readingToSignNames, signNameToGlyph);
    }

    private Connection open() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + databasePath.toAbsolutePath());
    }

    private void initialiseDatabase(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("CREATE TABLE IF NOT EXISTS reading_sign_names ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT,"
                    + "reading TEXT NOT NULL,"
                    + "position INTEGER NOT NULL,"
                    + "sign_name TEXT"
                    + ")");
            statement.executeUpdate("CREATE TABLE IF NOT EXISTS sign_glyphs ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT,"
                    + "sign_name TEXT NOT NULL UNIQUE,"
                    + "glyph TEXT NOT NULL"
                    + ")");
            statement.executeUpdate("CREATE INDEX IF NOT EXISTS idx_reading ON reading_sign_names(reading)");
        }
    }
}
