package com.example.cuneiform.pipeline.cdl;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reads Oracc {@code corpusjson} documents into {@link CdlNode} trees.
 */
public final class CdlParser {

    /**
     * Reads the {@code cdl} array of a text document.
     *
     * @param file path to the JSON document
     * @return top-level nodes in document order
     * @throws IOException         when the file cannot be read or is not valid JSON
     * @throws CdlFormatException  when a node has an unknown kind
     */
    public List<CdlNode> parseFile(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                throw new IOException("Expected a JSON object in " + file);
            }
            return parseDocument(root.getAsJsonObject());
        } catch (JsonParseException ex) {
            throw new IOException("Malformed JSON in " + file + ": " + ex.getMessage(), ex);
        }
    }

    public List<CdlNode> parseDocument(JsonObject document) {
        Objects.requireNonNull(document, "document");
        return parseNodes(document.get("cdl"));
    }

    public CdlNode parseNode(JsonObject node) {
        Objects.requireNonNull(node, "node");
        String discriminator = string(node, "node");
        if (discriminator.isEmpty() && node.has("linkbase")) {
            discriminator = NodeKind.LINKBASE.discriminator();
        }
        NodeKind kind = NodeKind.fromDiscriminator(discriminator);
        switch (kind) {
            case CHUNK:
                return new Chunk(string(node, "id"),
                        ChunkType.fromValue(string(node, "type")),
                        parseNodes(node.get("cdl")));
            case DISCONTINUITY:
                return new Discontinuity(DiscontinuityType.fromValue(string(node, "type")),
                        string(node, "state"),
                        string(node, "scope"));
            case LEMMA:
                return new Lemma(string(node, "id"), string(node, "frag"), parseForm(node.get("f")));
            case LINK_GROUP:
                JsonElement choices = node.get("choices");
                return new LinkGroup(string(node, "id"),
                        choices != null && choices.isJsonArray() ? choices.getAsJsonArray() : null);
            case LINKBASE:
                return new LinkbaseNode(node.get("linkbase"));
            default:
                throw new CdlFormatException("Unsupported node type: " + discriminator);
        }
    }

    private List<CdlNode> parseNodes(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return Collections.emptyList();
        }
        if (!element.isJsonArray()) {
            throw new CdlFormatException("Expected an array of nodes but found: " + element);
        }
        JsonArray array = element.getAsJsonArray();
        List<CdlNode> nodes = new ArrayList<>(array.size());
        for (JsonElement child : array) {
            if (!child.isJsonObject()) {
                throw new CdlFormatException("Expected a node object but found: " + child);
            }
            nodes.add(parseNode(child.getAsJsonObject()));
        }
        return nodes;
    }

    private LemmaForm parseForm(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            return LemmaForm.EMPTY;
        }
        JsonObject form = element.getAsJsonObject();
        List<Grapheme> graphemes = new ArrayList<>();
        JsonElement gdl = form.get("gdl");
        if (gdl != null && gdl.isJsonArray()) {
            for (JsonElement item : gdl.getAsJsonArray()) {
                if (item.isJsonObject()) {
                    graphemes.add(parseGrapheme(item.getAsJsonObject()));
                }
            }
        }
        return new LemmaForm(string(form, "form"), string(form, "lang"), graphemes);
    }

    private Grapheme parseGrapheme(JsonObject item) {
        List<Grapheme> parts = new ArrayList<>();
        for (String key : new String[]{"seq", "group"}) {
            JsonElement nested = item.get(key);
            if (nested == null || !nested.isJsonArray()) {
                continue;
            }
            for (JsonElement part : nested.getAsJsonArray()) {
                if (part.isJsonObject()) {
                    JsonObject partObject = part.getAsJsonObject();
                    parts.add(new Grapheme(flag(partObject, "breakStart"), flag(partObject, "breakEnd"), null));
                }
            }
        }
        return new Grapheme(flag(item, "breakStart"), flag(item, "breakEnd"), parts);
    }

    private static String string(JsonObject object, String key) {
        JsonElement value = object.get(key);
        if (value == null || value.isJsonNull() || !value.isJsonPrimitive()) {
            return "";
        }
        return value.getAsString();
    }

    /**
     * Oracc writes break flags as {@code "1"}; any present, non-empty, non-false value counts.
     */
    private static boolean flag(JsonObject object, String key) {
        JsonElement value = object.get(key);
        if (value == null || value.isJsonNull()) {
            return false;
        }
        if (!value.isJsonPrimitive()) {
            return true;
        }
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return primitive.getAsDouble() != 0d;
        }
        return !primitive.getAsString().isEmpty();
    }
}
