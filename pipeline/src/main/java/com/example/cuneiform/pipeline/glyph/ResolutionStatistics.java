package com.example.cuneiform.pipeline.glyph;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Counts how well readings map to sign names and sign names to glyphs. Not thread-safe; keep one
 * instance per worker and {@link #merge(ResolutionStatistics)} them afterwards.
 */
public final class ResolutionStatistics {

    static final int REPORT_LIMIT = 20;

    private final Map<UnresolvedKind, Map<String, Integer>> unresolved = new EnumMap<>(UnresolvedKind.class);
    private long resolvedMorphemes;
    private long unresolvedMorphemes;
    private long glyphsFound;

    public ResolutionStatistics() {
        for (UnresolvedKind kind : UnresolvedKind.values()) {
            unresolved.put(kind, new LinkedHashMap<>());
        }
    }

    void record(UnresolvedKind kind, String value) {
        unresolved.get(kind).merge(value, 1, Integer::sum);
    }

    void morphemeResolved(boolean resolved) {
        if (resolved) {
            resolvedMorphemes++;
        } else {
            unresolvedMorphemes++;
        }
    }

    void glyphFound() {
        glyphsFound++;
    }

    public long resolvedMorphemes() {
        return resolvedMorphemes;
    }

    public long unresolvedMorphemes() {
        return unresolvedMorphemes;
    }

    public long glyphsFound() {
        return glyphsFound;
    }

    public long total(UnresolvedKind kind) {
        long total = 0;
        for (int count : unresolved.get(kind).values()) {
            total += count;
        }
        return total;
    }

    public int count(UnresolvedKind kind, String value) {
        return unresolved.get(kind).getOrDefault(value, 0);
    }

    /**
     * Most frequent values of a category, highest count first; ties keep first-seen order.
     */
    public List<Map.Entry<String, Integer>> mostCommon(UnresolvedKind kind, int limit) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(unresolved.get(kind).entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        return entries.size() > limit ? new ArrayList<>(entries.subList(0, limit)) : entries;
    }

    public void merge(ResolutionStatistics other) {
        for (UnresolvedKind kind : UnresolvedKind.values()) {
            Map<String, Integer> target = unresolved.get(kind);
            other.unresolved.get(kind).forEach((value, count) -> target.merge(value, count, Integer::sum));
        }
        resolvedMorphemes += other.resolvedMorphemes;
        unresolvedMorphemes += other.unresolvedMorphemes;
        glyphsFound += other.glyphsFound;
    }

    public void printReport(PrintStream out) {
        long morphemes = resolvedMorphemes + unresolvedMorphemes;
        out.println();
        out.printf("# of morphemes unable to convert: %d (%s%%)%n",
                unresolvedMorphemes, percent(unresolvedMorphemes, morphemes));
        out.printf("# of morphemes successfully converted: %d (%s%%)%n",
                resolvedMorphemes, percent(resolvedMorphemes, morphemes));
        printCategory(out, UnresolvedKind.SIGN_NAME);
        printCategory(out, UnresolvedKind.NUMERAL);
        printCategory(out, UnresolvedKind.OTHER);

        long namesFailed = total(UnresolvedKind.NAME_NOT_IN_TABLE) + total(UnresolvedKind.NAME_WITHOUT_GLYPH);
        long names = namesFailed + glyphsFound;
        out.println();
        out.printf("# of names unable to convert: %d (%s%%)%n", namesFailed, percent(namesFailed, names));
        out.printf("# of names successfully converted: %d (%s%%)%n", glyphsFound, percent(glyphsFound, names));
        printCategory(out, UnresolvedKind.NAME_NOT_IN_TABLE);
        printCategory(out, UnresolvedKind.NAME_WITHOUT_GLYPH);
        out.println();
    }

    private void printCategory(PrintStream out, UnresolvedKind kind) {
        out.println();
        out.println("----- " + kind.title() + " -----");
        for (Map.Entry<String, Integer> entry : mostCommon(kind, REPORT_LIMIT)) {
            out.println(" > " + entry.getKey() + " - " + entry.getValue());
        }
        out.println("Total: " + total(kind));
    }

    private static String percent(long part, long whole) {
        if (whole == 0) {
            return "0.00";
        }
        return String.format(Locale.ROOT, "%.2f", part * 100.0 / whole);
    }
}
