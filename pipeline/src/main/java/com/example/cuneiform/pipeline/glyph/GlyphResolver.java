package com.example.cuneiform.pipeline.glyph;

import com.example.cuneiform.pipeline.SpecialToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps morphemes of a normalized transliteration to sign names and Unicode glyphs.
 *
 * <p>A morpheme resolves only when exactly one candidate sign name is left. Everything that does
 * not resolve becomes {@code <unk>} in all three outputs. Every produced glyph is recorded in the
 * {@link ObservedReadings} together with the morpheme it was read from.</p>
 *
 * <p>The resolver reads the shared {@link SignLookup} only, but writes to its own statistics and
 * observed readings, so each worker thread needs its own instance.</p>
 */
public final class GlyphResolver {

    static final Pattern NUMERAL = Pattern.compile("^\\d+(/\\d+)?(\\.\\d+)?(\\s*\\([^)]+\\))?$");

    private static final Pattern SPACES = Pattern.compile(" +");
    private static final String NUMERAL_SIGN = "N";

    // Duplicate or variant names whose glyph is registered under another name.
    private static final Map<String, String> SIGN_NAME_SWAPS = Map.of(
            "UN", "KALAM@g",
            "ŠITA₂", "|ŠITA.GIŠ|",
            "DE₂", "|UMUM×KASKAL|",
            "|ŠU₂.3xAN|", "|ŠU₂.3×AN|",
            "|ŠU₂.DUN₃@g@g@s|", "|ŠU₂.DUN₃|",
            "LAK212", "|A.TU.GABA.LIŠ|");

    private final SignLookup lookup;
    private final MorphemeSegmenter segmenter;
    private final ObservedReadings observedReadings;
    private final ResolutionStatistics statistics;

    public GlyphResolver(SignLookup lookup) {
        this(lookup, new ObservedReadings(), new ResolutionStatistics());
    }

    public GlyphResolver(SignLookup lookup, ObservedReadings observedReadings, ResolutionStatistics statistics) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.observedReadings = Objects.requireNonNull(observedReadings, "observedReadings");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.segmenter = new MorphemeSegmenter();
    }

    public ObservedReadings observedReadings() {
        return observedReadings;
    }

    public ResolutionStatistics statistics() {
        return statistics;
    }

    /**
     * Resolves a whole normalized transliteration wordform by wordform. The three fields are the
     * per-wordform joins (morphemes by {@code -}, sign names by a space, glyphs without separator)
     * joined by single spaces.
     */
    public ResolvedText resolveText(String transliteration) {
        String padded = transliteration.replace("\n", " \n ").replace("...", " ... ");
        padded = SPACES.matcher(padded).replaceAll(" ");

        StringBuilder morphemes = new StringBuilder();
        StringBuilder signNames = new StringBuilder();
        StringBuilder glyphs = new StringBuilder();
        for (String wordform : padded.split(" ")) {
            if (wordform.isEmpty() || "|".equals(wordform) || ".|".equals(wordform)) {
                continue;
            }
            List<Resolution> resolutions = resolveWordform(wordform);
            List<String> morphemeParts = new ArrayList<>(resolutions.size());
            List<String> nameParts = new ArrayList<>(resolutions.size());
            StringBuilder glyphParts = new StringBuilder();
            for (Resolution resolution : resolutions) {
                morphemeParts.add(resolution.morpheme());
                nameParts.add(resolution.signName());
                glyphParts.append(resolution.glyph());
            }
            morphemes.append(String.join("-", morphemeParts)).append(' ');
            signNames.append(String.join(" ", nameParts)).append(' ');
            glyphs.append(glyphParts).append(' ');
        }
        return new ResolvedText(morphemes.toString().strip(), signNames.toString().strip(), glyphs.toString().strip());
    }

    /**
     * Resolves one wordform. Special tokens pass through unchanged; a morpheme whose sign is the
     * numeral sign {@code N} produces no output.
     */
    public List<Resolution> resolveWordform(String wordform) {
        if (SpecialToken.isSpecialToken(wordform)) {
            return List.of(Resolution.passThrough(wordform));
        }

        List<Resolution> resolutions = new ArrayList<>();
        for (String morpheme : segmenter.segment(wordform)) {
            Candidates candidates = candidates(morpheme);
            boolean unique = candidates.isUnique();
            statistics.morphemeResolved(unique);
            if (!unique) {
                resolutions.add(Resolution.UNKNOWN);
                continue;
            }

            String signName = candidates.signNames().get(0);
            if (NUMERAL_SIGN.equals(signName)) {
                continue;
            }
            signName = SIGN_NAME_SWAPS.getOrDefault(signName, signName);
            Optional<String> glyph = glyphOf(signName);
            Resolution resolution = glyph.isPresent()
                    ? new Resolution(candidates.display(), signName, glyph.get())
                    : Resolution.UNKNOWN;
            resolutions.add(resolution);
        }

        for (Resolution resolution : resolutions) {
            if (!SpecialToken.isSpecialToken(resolution.morpheme())) {
                observedReadings.record(resolution.glyph(), resolution.morpheme());
            }
        }
        return resolutions;
    }

    /**
     * Candidate sign names of a single morpheme, tried in a fixed order: missing-sign markers,
     * numerals, sign names written inline, plain readings, uppercase readings and finally a reading
     * disambiguated by a parenthetical sign name.
     */
    public Candidates candidates(String morpheme) {
        String reading = "geš₂".equals(morpheme) ? "ŋeš₂" : morpheme;

        if ("x".equals(reading) || "n".equals(reading) || "X".equals(reading) || "N".equals(reading)) {
            return new Candidates(SpecialToken.MISSING.token(), List.of(SpecialToken.MISSING.token()));
        }
        if (NUMERAL.matcher(reading).matches()) {
            return numeralCandidates(reading);
        }
        if (lookup.isSignName(reading)) {
            return new Candidates(SpecialToken.UNKNOWN, List.of(reading));
        }

        String withoutBraces = reading.replace("{", "").replace("}", "");
        if (lookup.hasReading(withoutBraces)) {
            return new Candidates(reading, lookup.signNames(withoutBraces));
        }

        if (isUpperCase(reading)) {
            String lowered = reading.toLowerCase(Locale.ROOT);
            if (lookup.hasReading(lowered)) {
                return new Candidates(SpecialToken.UNKNOWN, lookup.signNames(lowered));
            }
            statistics.record(UnresolvedKind.SIGN_NAME, reading);
            return Candidates.none(SpecialToken.UNKNOWN);
        }

        int open = reading.indexOf('(');
        int close = reading.lastIndexOf(')');
        if (open >= 0 && close > open) {
            String bare = reading.substring(0, open);
            String qualifier = reading.substring(open + 1, close);
            if (lookup.hasReading(bare)) {
                List<String> names = lookup.signNames(bare);
                if (names.size() == 1) {
                    return new Candidates(bare, names);
                }
                if (names.contains(qualifier)) {
                    return new Candidates(bare, List.of(qualifier));
                }
            }
            List<String> readings = lookup.readingsOf(qualifier);
            if (readings.size() == 1) {
                return new Candidates(readings.get(0), List.of(qualifier));
            }
        }

        statistics.record(UnresolvedKind.OTHER, reading);
        return Candidates.none(reading);
    }

    private Candidates numeralCandidates(String numeral) {
        if (lookup.hasReading(numeral)) {
            return new Candidates(numeral, lookup.signNames(numeral));
        }
        String lowered = numeral.toLowerCase(Locale.ROOT);
        if (lookup.hasReading(lowered)) {
            return new Candidates(lowered, lookup.signNames(lowered));
        }
        if (lookup.isSignName(numeral)) {
            return new Candidates(numeral, List.of(numeral));
        }
        statistics.record(UnresolvedKind.NUMERAL, numeral);
        return Candidates.none(numeral);
    }

    private Optional<String> glyphOf(String signName) {
        if (SpecialToken.isSpecialToken(signName)) {
            return Optional.of(signName);
        }
        Optional<String> glyph = lookup.glyph(signName);
        if (glyph.isEmpty()) {
            statistics.record(UnresolvedKind.NAME_NOT_IN_TABLE, signName);
            return Optional.empty();
        }
        if (glyph.get().isEmpty()) {
            statistics.record(UnresolvedKind.NAME_WITHOUT_GLYPH, signName);
            return Optional.empty();
        }
        statistics.glyphFound();
        // Unassigned code blocks are written with a literal X.
        return glyph.get().contains("X") ? Optional.empty() : glyph;
    }

    /**
     * True when the text has at least one cased letter and no lowercase or titlecase letter.
     */
    static boolean isUpperCase(String text) {
        boolean cased = false;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            if (Character.isLowerCase(codePoint) || Character.isTitleCase(codePoint)) {
                return false;
            }
            if (Character.isUpperCase(codePoint)) {
                cased = true;
            }
            i += Character.charCount(codePoint);
        }
        return cased;
    }
}
