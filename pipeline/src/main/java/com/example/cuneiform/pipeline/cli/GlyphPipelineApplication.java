package com.example.cuneiform.pipeline.cli;

import com.example.cuneiform.pipeline.Diagnostics;
import com.example.cuneiform.pipeline.GlyphPipelineException;
import com.example.cuneiform.pipeline.corpus.GlyphPipeline;
import com.example.cuneiform.pipeline.corpus.JsonlRecordWriter;
import com.example.cuneiform.pipeline.glyph.SignLookup;
import com.example.cuneiform.pipeline.normalize.RecordCorrections;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Command line tool that converts corpus JSON documents into JSON Lines records carrying the
 * normalized transliteration, sign names and glyphs of every text. Alongside the records it writes
 * the observed readings per glyph and prints resolution statistics.
 */
public final class GlyphPipelineApplication {

    static final String DEFAULT_OUTPUT = "glyphs.jsonl";
    static final String READINGS_FILE = "glyph_to_observed_readings.json";

    private final PrintStream out;
    private final PrintStream err;

    public GlyphPipelineApplication(PrintStream out, PrintStream err) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        int exitCode = new GlyphPipelineApplication(System.out, System.err).run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    int run(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return 1;
        }

        Path lookupPath = null;
        Path output = Path.of(DEFAULT_OUTPUT);
        Path readingsOutput = null;
        boolean verbose = false;
        List<Path> inputs = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--lookups":
                case "--output":
                case "--readings":
                    if (i + 1 >= args.length) {
                        err.println("Missing value for " + arg);
                        printUsage();
                        return 1;
                    }
                    Path value = Path.of(args[++i]);
                    if ("--lookups".equals(arg)) {
                        lookupPath = value;
                    } else if ("--output".equals(arg)) {
                        output = value;
                    } else {
                        readingsOutput = value;
                    }
                    break;
                case "--verbose":
                    verbose = true;
                    break;
                default:
                    if (arg.startsWith("--")) {
                        err.println("Unknown option: " + arg);
                        printUsage();
                        return 1;
                    }
                    inputs.add(Path.of(arg));
            }
        }
        if (inputs.isEmpty()) {
            printUsage();
            return 1;
        }
        for (Path input : inputs) {
            if (!Files.exists(input)) {
                err.printf("Input not found: %s%n", input);
                return 2;
            }
        }
        if (readingsOutput == null) {
            Path parent = output.toAbsolutePath().getParent();
            readingsOutput = parent == null ? Path.of(READINGS_FILE) : parent.resolve(READINGS_FILE);
        }

        SignLookup lookup;
        try {
            lookup = lookupPath == null ? SignLookup.loadDefault() : SignLookup.load(lookupPath);
        } catch (GlyphPipelineException ex) {
            err.println(ex.getMessage());
            return 2;
        }

        Diagnostics diagnostics = new Diagnostics(err, verbose);
        GlyphPipeline pipeline = new GlyphPipeline(lookup, RecordCorrections.loadDefault(), diagnostics, err);
        GlyphPipeline.BatchResult result;
        try {
            result = pipeline.processAll(inputs);
            new JsonlRecordWriter().write(output, result.records());
            pipeline.observedReadings().write(readingsOutput);
        } catch (IOException ex) {
            err.printf("Processing failed: %s%n", ex.getMessage());
            return 3;
        }

        pipeline.statistics().printReport(out);
        result.printSummary(out);
        out.printf("Notation irregularities reported: %d%n", diagnostics.count());
        out.printf("Records written to %s%n", output.toAbsolutePath());
        out.printf("Observed readings written to %s%n", readingsOutput.toAbsolutePath());

        if (result.failedRecords() > 0) {
            err.printf("Completed with errors (%d records failed).%n", result.failedRecords());
            return 3;
        }
        return 0;
    }

    private void printUsage() {
        err.println("Usage: GlyphPipelineApplication [--lookups PATH] [--output FILE] [--readings FILE] "
                + "[--verbose] <corpus.json|directory>...");
    }
}
