package com.example.cuneiform.pipeline.glyph;

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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Frequency table of the readings each glyph was produced from: glyph to morpheme to count.
 * Not thread-safe; workers keep their own table and merge at the end.
 */
public final class ObservedReadings {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

    private final Map<String, Map<String, Integer>> counts = new LinkedHashMap<>();

    public void record(String glyph, String morpheme) {
        add(glyph, morpheme, 1);
    }

    public int count(String glyph, String morpheme) {
        Map<String, Integer> readings = counts.get(glyph);
        return readings == null ? 0 : readings.getOrDefault(morpheme, 0);
    }

    public Map<String, Integer> readingsOf(String glyph) {
        Map<String, Integer> readings = counts.get(glyph);
        return readings == null ? Map.of() : Collections.unmodifiableMap(readings);
    }

    public Set<String> glyphs() {
        return Collections.unmodifiableSet(counts.keySet());
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public void merge(ObservedReadings other) {
        for (Map.Entry<String, Map<String, Integer>> glyph : other.counts.entrySet()) {
            for (Map.Entry<String, Integer> reading : glyph.getValue().entrySet()) {
                add(glyph.getKey(), reading.getKey(), reading.getValue());
            }
        }
    }

    public JsonObject toJson() {
        JsonObject root = new JsonObject();
        for (Map.Entry<String, Map<String, Integer>> glyph : counts.entrySet()) {
            JsonObject readings = new JsonObject();
            glyph.getValue().forEach(readings::addProperty);
            root.add(glyph.getKey(), readings);
        }
        return root;
    }

    public void write(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(), writer);
        }
    }

    public static ObservedReadings read(Reader reader) throws IOException {
        ObservedReadings result = new ObservedReadings();
        try {
            JsonObject root = JsonParser.parseReader(reader).getAsJsonObject();
            for (Map.Entry<String, JsonElement> glyph : root.entrySet()) {
                for (Map.Entry<String, JsonElement> reading : glyph.getValue().getAsJsonObject().entrySet()) {
                    result.add(glyph.getKey(), reading.getKey(), reading.getValue().getAsInt());
                }
            }
        } catch (JsonParseException | IllegalStateException | NumberFormatException ex) {
            throw new IOException("Malformed observed readings: " + ex.getMessage(), ex);
        }
        return result;
    }

    private void add(String glyph, String morpheme, int amount) {
        counts.computeIfAbsent(glyph, key -> new LinkedHashMap<>()).merge(morpheme, amount, Integer::sum);
    }
}
