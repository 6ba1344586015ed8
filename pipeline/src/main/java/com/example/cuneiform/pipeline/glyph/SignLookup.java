package com.example.cuneiform.pipeline.glyph;

import com.example.cuneiform.pipeline.GlyphPipelineException;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only sign tables: reading to candidate sign names and sign name to Unicode glyph. The
 * reverse mapping from sign name to readings is derived on construction. Instances are immutable
 * and can be shared between threads.
 */
public final class SignLookup {

    public static final String READINGS_FILE = "morpheme_to_glyph_names.json";
    public static final String GLYPHS_FILE = "glyph_name_to_glyph.json";

    static final String PATH_PROPERTY = "sign.lookup.path";
    static final String PATH_ENVIRONMENT = "SIGN_LOOKUP";
    static final Path DEFAULT_PATH = Path.of("data", "lookups");

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final Map<String, List<String>> readingToSignNames;
    private final Map<String, String> signNameToGlyph;
    private final Map<String, List<String>> signNameToReadings;

    public SignLookup(Map<String, List<String>> readingToSignNames, Map<String, String> signNameToGlyph) {
        Objects.requireNonNull(readingToSignNames, "readingToSignNames");
        Objects.requireNonNull(signNameToGlyph, "signNameToGlyph");

        Map<String, List<String>> readings = new LinkedHashMap<>();
        Map<String, Set<String>> reverse = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : readingToSignNames.entrySet()) {
            List<String> names = List.copyOf(entry.getValue());
            readings.put(entry.getKey(), names);
            for (String name : names) {
                reverse.computeIfAbsent(name, key -> new LinkedHashSet<>()).add(entry.getKey());
            }
        }
        Map<String, List<String>> readingsBySign = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : reverse.entrySet()) {
            readingsBySign.put(entry.getKey(), List.copyOf(entry.getValue()));
        }

        this.readingToSignNames = Collections.unmodifiableMap(readings);
        this.signNameToGlyph = Collections.unmodifiableMap(new LinkedHashMap<>(signNameToGlyph));
        this.signNameToReadings = Collections.unmodifiableMap(readingsBySign);
    }

    /**
     * Loads the tables from the location named by the {@code sign.lookup.path} system property, the
     * {@code SIGN_LOOKUP} environment variable or {@code data/lookups}, in that order.
     */
    public static SignLookup loadDefault() {
        String systemProperty = System.getProperty(PATH_PROPERTY);
        if (systemProperty != null && !systemProperty.isBlank()) {
            return load(Path.of(systemProperty));
        }
        String environment = System.getenv(PATH_ENVIRONMENT);
        if (environment != null && !environment.isBlank()) {
            return load(Path.of(environment));
        }
        if (Files.exists(DEFAULT_PATH)) {
            return load(DEFAULT_PATH);
        }
        throw new GlyphPipelineException("Missing sign lookup tables. Provide a path via system property '"
                + PATH_PROPERTY + "' or environment variable '" + PATH_ENVIRONMENT + "'.");
    }

    /**
     * Loads a directory holding the two JSON tables, or an SQLite database written by
     * {@link SignLookupStore}.
     */
    public static SignLookup load(Path location) {
        Objects.requireNonNull(location, "location");
        try {
            if (Files.isDirectory(location)) {
                return readJson(location.resolve(READINGS_FILE), location.resolve(GLYPHS_FILE));
            }
            if (Files.isRegularFile(location)) {
                return new SignLookupStore(location).load();
            }
        } catch (IOException ex) {
            throw new GlyphPipelineException("Failed to load sign lookup tables from " + location.toAbsolutePath(), ex);
        } catch (SQLException ex) {
            throw new GlyphPipelineException("Failed to query sign lookup database " + location.toAbsolutePath(), ex);
        }
        throw new GlyphPipelineException("Sign lookup tables not found: " + location.toAbsolutePath());
    }

    public static SignLookup readJson(Path readingsFile, Path glyphsFile) throws IOException {
        try (Reader readings = Files.newBufferedReader(readingsFile, StandardCharsets.UTF_8);
             Reader glyphs = Files.newBufferedReader(glyphsFile, StandardCharsets.UTF_8)) {
            return readJson(readings, glyphs);
        }
    }

    public static SignLookup readJson(Reader readings, Reader glyphs) throws IOException {
        try {
            JsonObject readingObject = JsonParser.parseReader(readings).getAsJsonObject();
            JsonObject glyphObject = JsonParser.parseReader(glyphs).getAsJsonObject();

            Map<String, List<String>> readingToSignNames = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : readingObject.entrySet()) {
                List<String> names = new ArrayList<>();
                for (JsonElement name : entry.getValue().getAsJsonArray()) {
                    names.add(name.getAsString());
                }
                readingToSignNames.put(entry.getKey(), names);
            }
            Map<String, String> signNameToGlyph = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : glyphObject.entrySet()) {
                JsonElement value = entry.getValue();
                signNameToGlyph.put(entry.getKey(), value.isJsonNull() ? "" : value.getAsString());
            }
            return new SignLookup(readingToSignNames, signNameToGlyph);
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException ex) {
            throw new IOException("Malformed sign lookup table: " + ex.getMessage(), ex);
        }
    }

    /**
     * Writes the two JSON tables into the directory, creating it when needed.
     */
    public void writeJson(Path directory) throws IOException {
        Files.createDirectories(directory);
        try (Writer writer = Files.newBufferedWriter(directory.resolve(READINGS_FILE), StandardCharsets.UTF_8)) {
            GSON.toJson(readingToSignNames, writer);
        }
        try (Writer writer = Files.newBufferedWriter(directory.resolve(GLYPHS_FILE), StandardCharsets.UTF_8)) {
            GSON.toJson(signNameToGlyph, writer);
        }
    }

    public boolean hasReading(String reading) {
        return readingToSignNames.containsKey(reading);
    }

    /**
     * Candidate sign names of a reading; empty when the reading is unknown.
     */
    public List<String> signNames(String reading) {
        return readingToSignNames.getOrDefault(reading, List.of());
    }

    public boolean isSignName(String name) {
        return signNameToGlyph.containsKey(name);
    }

    /**
     * Glyph of a sign name. An empty string means the sign is known but has no glyph assigned.
     */
    public Optional<String> glyph(String signName) {
        return Optional.ofNullable(signNameToGlyph.get(signName));
    }

    public List<String> readingsOf(String signName) {
        return signNameToReadings.getOrDefault(signName, List.of());
    }

    public Map<String, List<String>> readingToSignNames() {
        return readingToSignNames;
    }

    public Map<String, String> signNameToGlyph() {
        return signNameToGlyph;
    }

    public boolean containsGlyph(String glyph) {
        return !glyph.isEmpty() && signNameToGlyph.containsValue(glyph);
    }
}
