package com.example.cuneiform.pipeline.corpus;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes processed records as JSON Lines, one object per record.
 */
public final class JsonlRecordWriter {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    public void write(Path file, List<ProcessedRecord> records) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(writer, records);
        }
    }

    public void write(Writer writer, List<ProcessedRecord> records) throws IOException {
        for (ProcessedRecord record : records) {
            writer.write(GSON.toJson(record.toJson()));
            writer.write('\n');
        }
        writer.flush();
    }
}
