package com.example.cuneiform.pipeline.corpus;

import com.example.cuneiform.pipeline.Diagnostics;
import com.example.cuneiform.pipeline.GlyphPipelineException;
import com.example.cuneiform.pipeline.cdl.TreeWalker;
import com.example.cuneiform.pipeline.glyph.GlyphResolver;
import com.example.cuneiform.pipeline.glyph.ObservedReadings;
import com.example.cuneiform.pipeline.glyph.ResolutionStatistics;
import com.example.cuneiform.pipeline.glyph.ResolvedText;
import com.example.cuneiform.pipeline.glyph.SignLookup;
import com.example.cuneiform.pipeline.glyph.TransliterationReplacements;
import com.example.cuneiform.pipeline.normalize.EnclosureNormalizer;
import com.example.cuneiform.pipeline.normalize.RecordCorrections;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs records through the whole chain: tree walk, enclosure normalization, notation
 * replacements, glyph resolution and output clean-up.
 *
 * <p>Documents that are not valid JSON and records that fail with a {@link GlyphPipelineException}
 * are reported on the error stream and skipped. Records left without text after normalization
 * are dropped.</p>
 */
public final class GlyphPipeline {

    private final TreeWalker walker = new TreeWalker();
    private final CorpusReader reader = new CorpusReader();
    private final EnclosureNormalizer normalizer;
    private final GlyphResolver resolver;
    private final Diagnostics diagnostics;
    private final PrintStream err;

    public GlyphPipeline(SignLookup lookup, RecordCorrections corrections, Diagnostics diagnostics, PrintStream err) {
        Objects.requireNonNull(lookup, "lookup");
        this.normalizer = EnclosureNormalizer.standard(Objects.requireNonNull(corrections, "corrections"));
        this.resolver = new GlyphResolver(lookup);
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.err = Objects.requireNonNull(err, "err");
    }

    public ObservedReadings observedReadings() {
        return resolver.observedReadings();
    }

    public ResolutionStatistics statistics() {
        return resolver.statistics();
    }

    /**
     * Normalized transliteration of a record, before any glyph resolution.
     */
    public String normalize(TextRecord record) {
        String raw = walker.transliteration(record.nodes());
        return normalizer.normalize(record.id(), raw, diagnostics);
    }

    public Optional<ProcessedRecord> process(TextRecord record) {
        TreeWalker.WalkResult walk = walker.walk(record.nodes());
        String normalized = normalizer.normalize(record.id(), walker.transliteration(walk), diagnostics);
        if (EnclosureNormalizer.isEffectivelyEmpty(normalized)) {
            diagnostics.trace(record.id(), "Dropping record without text");
            return Optional.empty();
        }

        String replaced = TransliterationReplacements.apply(normalized);
        ResolvedText resolved = OutputFormatter.format(resolver.resolveText(replaced));
        return Optional.of(new ProcessedRecord(record.id(), walk.languageList(),
                resolved.transliteration(), resolved.signNames(), resolved.glyphs()));
    }

    /**
     * Processes every JSON document under the given files and directories. A document that cannot
     * be read or parsed counts as a failed record; the rest of the batch still runs.
     *
     * @throws IOException when an input cannot be located
     */
    public BatchResult processAll(List<Path> inputs) throws IOException {
        List<ProcessedRecord> records = new ArrayList<>();
        int documents = 0;
        int empty = 0;
        int failed = 0;
        for (Path file : reader.collectInputs(inputs)) {
            documents++;
            String id = CorpusReader.recordId(file);
            try {
                Optional<ProcessedRecord> processed = process(reader.read(file));
                if (processed.isPresent()) {
                    records.add(processed.get());
                } else {
                    empty++;
                }
            } catch (GlyphPipelineException | IOException ex) {
                failed++;
                err.println(id + ": " + ex.getMessage());
            }
        }
        RecordDeduplicator.Result deduplicated = new RecordDeduplicator().deduplicate(records);
        return new BatchResult(deduplicated.records(), documents, empty, failed,
                deduplicated.duplicateTransliterations(), deduplicated.duplicateGlyphs());
    }

    public record BatchResult(List<ProcessedRecord> records,
                              int documents,
                              int emptyRecords,
                              int failedRecords,
                              int duplicateTransliterations,
                              int duplicateGlyphs) {

        public BatchResult {
            records = List.copyOf(records);
        }

        public void printSummary(PrintStream out) {
            out.println("Documents read: " + documents);
            out.println("Records without text: " + emptyRecords);
            out.println("Records failed: " + failedRecords);
            out.println("Rows dropped with identical transliterations: " + duplicateTransliterations);
            out.println("Rows dropped with identical glyphs: " + duplicateGlyphs);
            out.println("Records written: " + records.size());
        }
    }
}
