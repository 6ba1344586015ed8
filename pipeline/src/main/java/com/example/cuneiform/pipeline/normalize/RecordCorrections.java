package com.example.cuneiform.pipeline.normalize;

import com.example.cuneiform.pipeline.GlyphPipelineException;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Literal text corrections for individual source records whose notation is too broken for the
 * general rules. Corrections are data, read from {@value #DEFAULT_RESOURCE}.
 */
public final class RecordCorrections {

    public static final String DEFAULT_RESOURCE = "/corrections/record-corrections.json";

    private static final Gson GSON = new Gson();
    private static final RecordCorrections NONE = new RecordCorrections(Collections.emptyList());

    /** JSON shape of a single correction. */
    public static final class Correction {
        public CorrectionStage stage;
        public String id;
        public String from;
        public String to;

        public Correction() {
        }

        public Correction(CorrectionStage stage, String id, String from, String to) {
            this.stage = stage;
            this.id = id;
            this.from = from;
            this.to = to;
        }
    }

    private final List<Correction> corrections;

    public RecordCorrections(List<Correction> corrections) {
        Objects.requireNonNull(corrections, "corrections");
        List<Correction> copy = new ArrayList<>(corrections.size());
        for (Correction correction : corrections) {
            if (correction == null || correction.stage == null || correction.id == null
                    || correction.from == null || correction.from.isEmpty() || correction.to == null) {
                throw new GlyphPipelineException("Incomplete record correction entry");
            }
            copy.add(new Correction(correction.stage, correction.id, correction.from, correction.to));
        }
        this.corrections = Collections.unmodifiableList(copy);
    }

    public static RecordCorrections none() {
        return NONE;
    }

    public static RecordCorrections loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    public static RecordCorrections fromResource(String resource) {
        try (InputStream stream = RecordCorrections.class.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new GlyphPipelineException("Missing record corrections resource: " + resource);
            }
            return read(new InputStreamReader(stream, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new GlyphPipelineException("Failed to read record corrections from " + resource, ex);
        }
    }

    public static RecordCorrections read(Reader reader) {
        Type listType = new TypeToken<List<Correction>>() { }.getType();
        try {
            List<Correction> entries = GSON.fromJson(reader, listType);
            return new RecordCorrections(entries == null ? Collections.emptyList() : entries);
        } catch (JsonParseException ex) {
            throw new GlyphPipelineException("Malformed record corrections: " + ex.getMessage(), ex);
        }
    }

    /**
     * Applies the corrections registered for the stage and record, in file order.
     */
    public String apply(CorrectionStage stage, String recordId, String text) {
        String result = text;
        for (Correction correction : corrections) {
            if (correction.stage == stage && correction.id.equals(recordId)) {
                result = result.replace(correction.from, correction.to);
            }
        }
        return result;
    }

    public int size() {
        return corrections.size();
    }
}
