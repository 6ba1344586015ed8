package com.example.cuneiform.pipeline;

import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Sink for advisory messages about irregular notation. Messages are printed to the error stream
 * as they arrive and kept so that callers can inspect them afterwards. Rewrite traces are only
 * printed when verbose output was requested and are not kept.
 */
public final class Diagnostics {

    private final PrintStream err;
    private final boolean verbose;
    private final List<String> messages = new ArrayList<>();

    public Diagnostics(PrintStream err, boolean verbose) {
        this.err = Objects.requireNonNull(err, "err");
        this.verbose = verbose;
    }

    /**
     * Diagnostics that only collect messages.
     */
    public static Diagnostics silent() {
        return new Diagnostics(new PrintStream(OutputStream.nullOutputStream(), false, StandardCharsets.UTF_8), false);
    }

    public void report(String recordId, String message) {
        String line = "!!! " + message + " (" + recordId + ")";
        messages.add(line);
        err.println(line);
    }

    public void trace(String recordId, String message) {
        if (verbose) {
            err.println(">> " + message + " (" + recordId + ")");
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public List<String> messages() {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public int count() {
        return messages.size();
    }

    public boolean mentions(String fragment) {
        for (String message : messages) {
            if (message.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
