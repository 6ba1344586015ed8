package com.example.cuneiform.pipeline.normalize;

import com.example.cuneiform.pipeline.Diagnostics;
import com.example.cuneiform.pipeline.SpecialToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runs the ordered list of rewrite rules that reduce scholarly bracket notation to plain sign text
 * and the structural tokens. The order matters: later rules rely on the text shape left by
 * earlier ones, and the sanity checks in between name what must be gone by then.
 */
public final class EnclosureNormalizer {

    static final List<String> DISALLOWED_AFTER_LITERALS = List.of("<<", ">>", "⸢", "⸣", "{{", "}}");
    static final List<String> DISALLOWED_AFTER_SECONDARY = List.of("<", ">", "(-", "-)", "{-", "-}");
    static final List<String> DISALLOWED_AFTER_MISSING = List.of("[", "]", "$", "...");
    static final List<String> DISALLOWED_FINAL;

    static final int MAX_PASSES = 4;

    static {
        List<String> all = new ArrayList<>();
        all.addAll(DISALLOWED_AFTER_LITERALS);
        all.addAll(DISALLOWED_AFTER_SECONDARY);
        all.addAll(DISALLOWED_AFTER_MISSING);
        all.add(" " + EnclosureRules.MISSING);
        all.add(EnclosureRules.MISSING + " ");
        all.add("\n ");
        all.add(" \n");
        all.add("  ");
        DISALLOWED_FINAL = Collections.unmodifiableList(all);
    }

    /**
     * A named rule in the pipeline.
     */
    public record Stage(String description, RewriteRule rule) {

        public Stage {
            Objects.requireNonNull(description, "description");
            Objects.requireNonNull(rule, "rule");
        }
    }

    private final List<Stage> stages;
    private final RecordCorrections corrections;

    public EnclosureNormalizer(List<Stage> stages, RecordCorrections corrections) {
        this.stages = List.copyOf(stages);
        this.corrections = Objects.requireNonNull(corrections, "corrections");
    }

    /**
     * The standard rule order.
     */
    public static EnclosureNormalizer standard(RecordCorrections corrections) {
        Stage collapse = new Stage("Collapsing whitespace, hyphens and missing markers", EnclosureRules::collapse);
        Stage lonePlaceholders = new Stage("x, o and n -> missing", EnclosureRules::lonePlaceholders);

        List<Stage> stages = new ArrayList<>();
        stages.add(new Stage("Lifting normalised tokens", EnclosureRules::liftTokens));

        // literal-ize the easy cases
        stages.add(new Stage("<<abc>> as plain text", EnclosureRules::doubleAngleBrackets));
        stages.add(new Stage("Half brackets as plain text", EnclosureRules::halfBrackets));
        stages.add(new Stage("Dropping {{glosses}}", EnclosureRules::doubleCurlyBraces));
        stages.add(collapse);
        stages.add(new Stage("First sanity check", new SanityCheck("first", DISALLOWED_AFTER_LITERALS)));

        // enclosures out of order
        stages.add(new Stage("Checking for unmatched brackets", EnclosureRules::checkUnmatchedBrackets));
        stages.add(new Stage("Fixing enclosure order", EnclosureRules::fixEnclosureOrder));

        // secondary markers
        stages.add(new Stage("Dropping <supplied> spans", EnclosureRules::singleAngleBrackets));
        stages.add(new Stage("Semicolons to newlines", EnclosureRules::semicolons));
        stages.add(new Stage("Removing {- and -}", EnclosureRules::determinativeHyphens));
        stages.add(new Stage("Hyphens after |compound| names", EnclosureRules::verticalBars));
        stages.add(new Stage("Hyphens after parentheses", EnclosureRules::parentheses));
        stages.add(collapse);
        stages.add(new Stage("Second sanity check", new SanityCheck("second", DISALLOWED_AFTER_SECONDARY)));

        // reduce to the missing marker
        stages.add(new Stage("[abc] -> missing", EnclosureRules::singleSquareBrackets));
        stages.add(new Stage("Dropping unpaired [ and ]", EnclosureRules::unpairedBrackets));
        stages.add(lonePlaceholders);
        stages.add(lonePlaceholders);
        stages.add(lonePlaceholders);
        stages.add(new Stage("$abc$ -> missing", EnclosureRules::dollarSigns));
        stages.add(new Stage("... -> missing", EnclosureRules::ellipses));
        stages.add(new Stage("Dropping standalone (abc)", EnclosureRules::standaloneParentheses));
        stages.add(collapse);
        stages.add(new Stage("Third sanity check", new SanityCheck("third", DISALLOWED_AFTER_MISSING)));

        // enclosure cleanup
        stages.add(new Stage("(missing) and {missing} -> missing", EnclosureRules::missingAloneInEnclosure));
        stages.add(new Stage("Removing empty {} and ()", EnclosureRules::emptyEnclosures));
        stages.add(collapse);

        // token substitution
        stages.add(new Stage("Final sanity check", new SanityCheck("final", DISALLOWED_FINAL)));
        stages.add(new Stage("Converting special tokens", EnclosureRules::convertSpecialTokens));
        return new EnclosureNormalizer(stages, corrections);
    }

    public List<Stage> stages() {
        return stages;
    }

    /**
     * Runs the stages until the text stops changing, at most {@value #MAX_PASSES} times, so that
     * normalising a normalised text gives it back unchanged. Only the first pass reports.
     */
    public String normalize(String recordId, String text, Diagnostics diagnostics) {
        Objects.requireNonNull(text, "text");
        String result = runStages(new RewriteContext(recordId, diagnostics, corrections), text);
        RewriteContext quiet = new RewriteContext(recordId, Diagnostics.silent(), corrections);
        for (int pass = 1; pass < MAX_PASSES; pass++) {
            String next = runStages(quiet, result);
            if (next.equals(result)) {
                return result;
            }
            diagnostics.trace(recordId, "pass " + (pass + 1) + " changed the text again");
            result = next;
        }
        diagnostics.report(recordId, "Normalisation did not settle after " + MAX_PASSES + " passes");
        return result;
    }

    private String runStages(RewriteContext context, String text) {
        String result = text;
        for (Stage stage : stages) {
            result = stage.rule().apply(result, context);
        }
        return result;
    }

    /**
     * Returns {@code true} when nothing but structural tokens is left of a normalised record.
     */
    public static boolean isEffectivelyEmpty(String normalized) {
        return SpecialToken.withoutTokens(normalized).isBlank();
    }
}
