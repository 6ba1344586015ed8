package com.example.cuneiform.pipeline.corpus;

import com.example.cuneiform.pipeline.cdl.CdlParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates and parses corpus JSON documents. The record identifier is the file name without its
 * {@code .json} extension.
 */
public final class CorpusReader {

    private static final String EXTENSION = ".json";

    private final CdlParser parser;

    public CorpusReader() {
        this(new CdlParser());
    }

    public CorpusReader(CdlParser parser) {
        this.parser = parser;
    }

    /**
     * Expands files and directories into the sorted list of JSON documents they contain.
     */
    public List<Path> collectInputs(List<Path> inputs) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> stream = Files.walk(input)) {
                    files.addAll(stream
                            .filter(Files::isRegularFile)
                            .filter(CorpusReader::isJson)
                            .sorted(Comparator.comparing(Path::toString))
                            .collect(Collectors.toList()));
                }
            } else if (Files.isRegularFile(input)) {
                files.add(input);
            } else {
                throw new IOException("Input not found: " + input.toAbsolutePath());
            }
        }
        return files;
    }

    public TextRecord read(Path file) throws IOException {
        return new TextRecord(recordId(file), parser.parseFile(file));
    }

    static String recordId(Path file) {
        String name = file.getFileName().toString();
        return isJson(file) ? name.substring(0, name.length() - EXTENSION.length()) : name;
    }

    private static boolean isJson(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION);
    }
}
