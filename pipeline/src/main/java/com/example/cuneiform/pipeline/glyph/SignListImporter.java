package com.example.cuneiform.pipeline.glyph;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds {@link SignLookup} tables from the Oracc sign list JSON export.
 *
 * <p>Every sign and every variant form contributes its name (and alias names) to the glyph table
 * and its values to the reading table. Set semantics keep each name once per reading and each
 * glyph once per name. A name that ends up with more than one glyph is reported on the error
 * stream and keeps the first one seen.</p>
 */
public final class SignListImporter {

    private final PrintStream err;
    private int multipleGlyphWarnings;

    public SignListImporter(PrintStream err) {
        this.err = Objects.requireNonNull(err, "err");
    }

    public SignLookup importSignList(Path signList, Path supplementaryIndex) throws IOException {
        JsonObject signListObject = readObject(signList);
        JsonObject indexObject = supplementaryIndex == null ? null : readObject(supplementaryIndex);
        return build(signListObject, indexObject);
    }

    /**
     * @param signList parsed {@code sl.json} document
     * @param supplementaryIndex optional document of the form {@code {"index": {reading: name}}};
     *                           its entries replace the candidates of the readings they name
     */
    public SignLookup build(JsonObject signList, JsonObject supplementaryIndex) {
        Map<String, Set<String>> readingToNames = new LinkedHashMap<>();
        Map<String, Set<String>> nameToGlyphs = new LinkedHashMap<>();

        JsonObject root = requireObject(signList, "sl:signlist");
        for (JsonElement letter : array(root, "j:letters")) {
            JsonObject letterObject = requireObject(letter.getAsJsonObject(), "sl:letter");
            for (JsonElement sign : array(letterObject, "j:signs")) {
                JsonObject signObject = requireObject(sign.getAsJsonObject(), "sl:sign");
                addEntry(signObject, readingToNames, nameToGlyphs);
                for (JsonElement form : array(signObject, "j:forms")) {
                    JsonObject formObject = requireObject(form.getAsJsonObject(), "sl:form");
                    addEntry(formObject, readingToNames, nameToGlyphs);
                }
            }
        }

        Map<String, List<String>> readingToSignNames = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : readingToNames.entrySet()) {
            readingToSignNames.put(entry.getKey(), withoutEmpty(entry.getValue()));
        }
        if (supplementaryIndex != null && supplementaryIndex.has("index")) {
            for (Map.Entry<String, JsonElement> entry : supplementaryIndex.getAsJsonObject("index").entrySet()) {
                readingToSignNames.put(entry.getKey(), List.of(entry.getValue().getAsString()));
            }
        }

        Map<String, String> signNameToGlyph = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : nameToGlyphs.entrySet()) {
            List<String> glyphs = withoutEmpty(entry.getValue());
            if (glyphs.size() > 1) {
                multipleGlyphWarnings++;
                err.printf("Sign %s has more than one glyph: %s%n", entry.getKey(), glyphs);
            }
            signNameToGlyph.put(entry.getKey(), glyphs.isEmpty() ? "" : glyphs.get(0));
        }
        return new SignLookup(readingToSignNames, signNameToGlyph);
    }

    public int multipleGlyphWarnings() {
        return multipleGlyphWarnings;
    }

    private static void addEntry(JsonObject entry,
                                 Map<String, Set<String>> readingToNames,
                                 Map<String, Set<String>> nameToGlyphs) {
        String name = unescape(string(entry, "n"));
        String glyph = string(entry, "sl:ucun");
        nameToGlyphs.computeIfAbsent(name, key -> new LinkedHashSet<>()).add(glyph);

        for (JsonElement aka : array(entry, "j:aka")) {
            JsonObject akaObject = aka.getAsJsonObject().getAsJsonObject("sl:aka");
            if (akaObject == null) {
                continue;
            }
            String alias = unescape(string(akaObject, "n"));
            nameToGlyphs.computeIfAbsent(alias, key -> new LinkedHashSet<>()).add(glyph);
        }

        for (JsonElement value : array(entry, "j:values")) {
            JsonObject valueObject = value.getAsJsonObject();
            if (!valueObject.has("sl:v")) {
                continue;
            }
            String reading = string(valueObject.getAsJsonObject("sl:v"), "n");
            if (reading.isEmpty()) {
                continue;
            }
            readingToNames.computeIfAbsent(reading, key -> new LinkedHashSet<>()).add(name);
        }
    }

    private static JsonObject readObject(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return JsonParser.parseReader(reader).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException ex) {
            throw new IOException("Malformed JSON in " + file + ": " + ex.getMessage(), ex);
        }
    }

    private static JsonObject requireObject(JsonObject parent, String key) {
        JsonElement element = parent.get(key);
        if (element == null || !element.isJsonObject()) {
            throw new JsonParseException("Expected object '" + key + "' in sign list");
        }
        return element.getAsJsonObject();
    }

    private static JsonArray array(JsonObject parent, String key) {
        JsonElement element = parent.get(key);
        return element != null && element.isJsonArray() ? element.getAsJsonArray() : new JsonArray();
    }

    private static String string(JsonObject parent, String key) {
        JsonElement element = parent.get(key);
        return element == null || element.isJsonNull() ? "" : element.getAsString();
    }

    private static String unescape(String name) {
        return name.replace("&amp;", "&");
    }

    private static List<String> withoutEmpty(Set<String> values) {
        List<String> result = new ArrayList<>();
        for (String value : values) {
            if (!value.isEmpty()) {
                result.add(value);
            }
        }
        return result;
    }
}
