package com.example.cuneiform.pipeline.cli;

import com.example.cuneiform.pipeline.glyph.SignListImporter;
import com.example.cuneiform.pipeline.glyph.SignLookup;
import com.example.cuneiform.pipeline.glyph.SignLookupStore;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Command line tool that builds the sign lookup tables from the Oracc sign list export, optionally
 * overlaid with a supplementary reading index, and writes them as JSON and optionally SQLite.
 */
public final class SignListImporterApplication {

    static final Path DEFAULT_OUTPUT = Path.of("data", "lookups");

    private final PrintStream out;
    private final PrintStream err;

    public SignListImporterApplication(PrintStream out, PrintStream err) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        int exitCode = new SignListImporterApplication(System.out, System.err).run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    int run(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return 1;
        }

        Path signList = null;
        Path index = null;
        Path output = DEFAULT_OUTPUT;
        Path database = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--")) {
                if (i + 1 >= args.length) {
                    err.println("Missing value for " + arg);
                    printUsage();
                    return 1;
                }
                Path value = Path.of(args[++i]);
                switch (arg) {
                    case "--index":
                        index = value;
                        break;
                    case "--output":
                        output = value;
                        break;
                    case "--database":
                        database = value;
                        break;
                    default:
                        err.println("Unknown option: " + arg);
                        printUsage();
                        return 1;
                }
            } else if (signList == null) {
                signList = Path.of(arg);
            } else {
                printUsage();
                return 1;
            }
        }
        if (signList == null) {
            printUsage();
            return 1;
        }
        if (!Files.isRegularFile(signList)) {
            err.printf("Sign list not found: %s%n", signList);
            return 2;
        }
        if (index != null && !Files.isRegularFile(index)) {
            err.printf("Reading index not found: %s%n", index);
            return 2;
        }

        SignListImporter importer = new SignListImporter(err);
        try {
            SignLookup lookup = importer.importSignList(signList, index);
            lookup.writeJson(output);
            out.printf("Readings: %d, sign names: %d, written to %s%n",
                    lookup.readingToSignNames().size(), lookup.signNameToGlyph().size(), output.toAbsolutePath());
            if (database != null) {
                int rows = new SignLookupStore(database).write(lookup);
                out.printf("Stored %d reading rows in %s%n", rows, database.toAbsolutePath());
            }
        } catch (IOException | SQLException ex) {
            err.printf("Import failed: %s%n", ex.getMessage());
            return 3;
        } catch (JsonParseException | IllegalStateException ex) {
            err.printf("Import failed: malformed sign list: %s%n", ex.getMessage());
            return 3;
        }
        if (importer.multipleGlyphWarnings() > 0) {
            out.printf("Sign names with more than one glyph: %d%n", importer.multipleGlyphWarnings());
        }
        return 0;
    }

    private void printUsage() {
        err.println("Usage: SignListImporterApplication <sl.json> [--index epsd2-sl.json] "
                + "[--output DIR] [--database FILE.db]");
    }
}
