package com.example.cuneiform.pipeline.normalize;

import com.example.cuneiform.pipeline.SpecialToken;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The individual rewrite rules of the enclosure normaliser. Every rule is a function of the record
 * text; rules that meet something they cannot handle report it and carry on.
 *
 * <p>Notation follows the Oracc ATF conventions: {@code [...]} broken, {@code <...>} supplied,
 * {@code <<...>>} excised, {@code {...}} determinative, {@code {{...}}} gloss, {@code (...)}
 * uncertain or qualifier, {@code |...|} compound sign name.</p>
 */
public final class EnclosureRules {

    /** Internal spelling of the missing marker. */
    public static final String MISSING = SpecialToken.MISSING.placeholder();

    private static final String MISSING_REGEX = Pattern.quote(MISSING);

    private static final Pattern NEWLINE_RUN = Pattern.compile("([ \\-]*\\n[ \\-]*)+");
    private static final Pattern SPACE_RUN = Pattern.compile("(-* -*)+");
    private static final Pattern HYPHEN_RUN = Pattern.compile("-+");
    private static final Pattern MISSING_RUN = Pattern.compile("([ \\-]*" + MISSING_REGEX + "[ \\-]*)+");
    private static final Pattern MISSING_LINES = Pattern.compile("(\\n" + MISSING_REGEX + "(?=\\n))+");

    private static final Pattern GLOSS = Pattern.compile("\\{\\{[^\\n]*?\\}\\}");
    private static final Pattern GLOSS_TAIL = Pattern.compile("\\n[^\\n]*?\\}\\}");

    private static final EnclosureSwap[] ENCLOSURE_SWAPS = {
            // ([x)] -> [(x)]; only x, space and hyphen inside, nested parentheses go wrong otherwise
            new EnclosureSwap(Pattern.compile("\\(\\[[\\- x]*?\\)[\\- x]*?\\]"), "([", "[("),
            // [a(b]) -> [a(b)]
            new EnclosureSwap(Pattern.compile("\\[[^\\n(\\]]*?\\([^\\n)\\]]*?\\]\\)"), "])", ")]"),
            // {[a}b] -> [{a}b]
            new EnclosureSwap(Pattern.compile("\\{\\[[^\\n}\\]]*?\\}[^\\n\\]]*?\\]"), "{[", "[{"),
            // [a{b]} -> [a{b}]
            new EnclosureSwap(Pattern.compile("\\[[^\\n{\\]]*?\\{[^\\n\\]]*?\\]\\}"), "]}", "}]"),
            // <a{b>} -> <a{b}>
            new EnclosureSwap(Pattern.compile("<[^\\n{>]*?\\{[^\\n}>]*?>\\}"), ">}", "}>"),
            // {<a}b> -> <{a}b>
            new EnclosureSwap(Pattern.compile("\\{<[^\\n}>]*?\\}"), "{<", "<{")
    };

    private static final Pattern SUPPLIED = Pattern.compile("<[^\\n]*?>");
    private static final Pattern SUPPLIED_UNCLOSED = Pattern.compile("(<[^\\n>]*?(\\n|$))");
    private static final Pattern SUPPLIED_UNOPENED = Pattern.compile("((\\n|^)[^\\n<]*?>)");

    private static final Pattern COMPOUND_SIGN = Pattern.compile("\\|[^|a-z]*?\\|");
    private static final Pattern HYPHENS_BEFORE_CLOSE_PAREN = Pattern.compile("-+\\)");
    private static final Pattern CLOSE_PAREN_BEFORE_LETTER = Pattern.compile("\\)([a-zA-Z])");

    private static final Pattern BROKEN = Pattern.compile("\\[[^\\[\\]\\n]*?\\]");
    private static final Pattern BROKEN_UNCLOSED = Pattern.compile("\\[[^\\[\\]\\n]*?\\n");
    private static final Pattern BROKEN_UNOPENED = Pattern.compile("\\n[^\\[\\]\\n]*?\\]");

    private static final Pattern LONE_PLACEHOLDER = Pattern.compile("([ \\-\\n])([xXnNo])(?=[ \\-\\n]|$)");
    private static final char[] PLACEHOLDER_CHARS = {'x', 'o', 'n', 'X', 'O', 'N'};

    private static final String[] ERASURES = {"$ traces $", "($erasure$)", "$erasure$"};
    private static final String[] UNCERTAIN_SIGN_PREFIXES = {"$AN", "$MU", "$UŠ", "$KID", "$DI", "$GA₂", "$HAR"};

    private static final Pattern ELLIPSIS = Pattern.compile("\\.{3,}");
    private static final Pattern STANDALONE_PARENS = Pattern.compile("(?:^|\\n| |-)(\\([^\\n)]+\\))(?:$|\\n| |-)");

    private static final Pattern MISSING_IN_PARENS = Pattern.compile("\\([ \\-]*" + MISSING_REGEX + "[ \\-]*\\)");
    private static final Pattern MISSING_IN_BRACES = Pattern.compile("\\{[ \\-]*" + MISSING_REGEX + "[ \\-]*\\}");

    private EnclosureRules() {
    }

    /**
     * Lifts already normalised bracket-tag tokens back to placeholders so that a second pass over
     * normalised text leaves it unchanged.
     */
    public static String liftTokens(String text, RewriteContext context) {
        return SpecialToken.toInternal(text);
    }

    /** {@code <<abc>>}: present but excised for the sense; keep the text. */
    public static String doubleAngleBrackets(String text, RewriteContext context) {
        return text.replace("<<", "").replace(">>", "");
    }

    /** {@code ⸢abc⸣}: partially broken; keep the text. */
    public static String halfBrackets(String text, RewriteContext context) {
        return text.replace("⸢", "").replace("⸣", "");
    }

    /** {@code {{abc}}}: linguistic gloss; drop it, or the tail of a gloss that opened on an earlier line. */
    public static String doubleCurlyBraces(String text, RewriteContext context) {
        String result = text;
        for (String match : findAll(GLOSS, result, 0)) {
            context.trace("gloss " + match);
            result = result.replace(match, "");
        }
        for (String match : findAll(GLOSS_TAIL, result, 0)) {
            context.trace("gloss tail " + match.replace("\n", ""));
            result = result.replace(match, "\n");
        }
        if (result.contains("{{") || result.contains("}}")) {
            context.report("Uncaught gloss braces");
        }
        return result;
    }

    /**
     * Merges separators: hyphens and spaces around a newline become the newline, hyphens around a
     * space become the space, hyphen runs become one hyphen and separators around the missing
     * marker disappear.
     */
    public static String collapse(String text, RewriteContext context) {
        String result = NEWLINE_RUN.matcher(text).replaceAll("\n");
        result = SPACE_RUN.matcher(result).replaceAll(" ");
        result = HYPHEN_RUN.matcher(result).replaceAll("-");
        result = MISSING_RUN.matcher(result).replaceAll(Matcher.quoteReplacement(MISSING));
        result = MISSING_LINES.matcher(result).replaceAll(Matcher.quoteReplacement("\n" + MISSING));
        return result;
    }

    /**
     * Reports lines whose square brackets do not pair up. Source exports drop brackets that sit
     * next to {@code n}, parentheses or vertical bars.
     */
    public static String checkUnmatchedBrackets(String text, RewriteContext context) {
        String result = context.correct(CorrectionStage.UNMATCHED_BRACKETS, text);
        for (String line : result.split("\n", -1)) {
            if (!isBalanced(line)) {
                context.report("Unmatched brackets in line: " + line);
            }
        }
        return result;
    }

    /**
     * Returns {@code true} when removing adjacent {@code []} pairs from the bracket projection of
     * the line leaves nothing.
     */
    public static boolean isBalanced(String line) {
        StringBuilder brackets = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '[' || c == ']') {
                brackets.append(c);
            }
        }
        String sequence = brackets.toString();
        while (sequence.contains("[]")) {
            sequence = sequence.replace("[]", "");
        }
        return sequence.isEmpty();
    }

    /** Swaps mis-nested enclosures back into order, e.g. {@code ([x)]} to {@code [(x)]}. */
    public static String fixEnclosureOrder(String text, RewriteContext context) {
        String result = text;
        for (EnclosureSwap swap : ENCLOSURE_SWAPS) {
            for (String match : findAll(swap.pattern(), result, 0)) {
                String after = match.replace(swap.from(), swap.to());
                context.trace(match + " -> " + after);
                result = result.replace(match, after);
            }
        }
        return context.correct(CorrectionStage.ENCLOSURE_ORDER, result);
    }

    /**
     * {@code <abc>}: must be supplied but is absent; drop it. An unclosed span loses the rest of its
     * line and an unopened one the start of its line, both replaced by the missing marker.
     */
    public static String singleAngleBrackets(String text, RewriteContext context) {
        String result = SUPPLIED.matcher(text).replaceAll("");
        result = SUPPLIED_UNCLOSED.matcher(result).replaceAll(Matcher.quoteReplacement(MISSING + "\n"));
        result = SUPPLIED_UNOPENED.matcher(result).replaceAll(Matcher.quoteReplacement("\n" + MISSING));
        return result;
    }

    /** Semicolons separate lines. */
    public static String semicolons(String text, RewriteContext context) {
        return text.replace(";", "\n");
    }

    /** Hyphens directly inside determinative braces are dropped. */
    public static String determinativeHyphens(String text, RewriteContext context) {
        return text.replace("{-", "{").replace("-}", "}");
    }

    /** A compound sign name {@code |A.B|} is always followed by a morpheme boundary. */
    public static String verticalBars(String text, RewriteContext context) {
        String result = text;
        Set<String> matches = new LinkedHashSet<>(findAll(COMPOUND_SIGN, result, 0));
        for (String match : matches) {
            String name = match;
            if (name.contains("-")) {
                context.report("Uncaught hyphen in vertical bars: " + name);
                name = name.replace("-", "");
            }
            context.trace(name + " -> " + name + "-");
            result = result.replace(name, name + "-");
        }
        return result;
    }

    /**
     * Moves hyphens out of parentheses and separates a closing parenthesis from a following letter:
     * {@code (abc-)def} becomes {@code (abc)-def}.
     */
    public static String parentheses(String text, RewriteContext context) {
        String result = HYPHENS_BEFORE_CLOSE_PAREN.matcher(text).replaceAll(")-");
        result = CLOSE_PAREN_BEFORE_LETTER.matcher(result).replaceAll(")-$1");
        return result.replace("(-", "(");
    }

    /**
     * {@code [abc]}: broken away, conjecturally restored; becomes the missing marker. Runs twice
     * for one level of nesting, then handles spans cut off by a line break on either side.
     */
    public static String singleSquareBrackets(String text, RewriteContext context) {
        String missing = Matcher.quoteReplacement(MISSING);
        String result = BROKEN.matcher(text).replaceAll(missing);
        result = BROKEN.matcher(result).replaceAll(missing);
        result = BROKEN_UNCLOSED.matcher(result).replaceAll(Matcher.quoteReplacement(MISSING + "\n"));
        result = BROKEN_UNOPENED.matcher(result).replaceAll(Matcher.quoteReplacement("\n" + MISSING));
        return result;
    }

    /**
     * Square brackets left once the broken spans are gone had no partner on their line and are
     * dropped.
     */
    public static String unpairedBrackets(String text, RewriteContext context) {
        if (text.indexOf('[') < 0 && text.indexOf(']') < 0) {
            return text;
        }
        context.trace("dropping unpaired brackets");
        return text.replace("[", "").replace("]", "");
    }

    /**
     * Lone {@code x} and {@code o} stand for illegible signs, a lone {@code n} for an undetermined
     * quantity; all become the missing marker.
     */
    public static String lonePlaceholders(String text, RewriteContext context) {
        String result = LONE_PLACEHOLDER.matcher(text).replaceAll("$1" + MISSING);
        for (char c : PLACEHOLDER_CHARS) {
            result = result.replace("(" + c + ")", MISSING);
            result = result.replace("[" + c + "]", MISSING);
            result = result.replace("-" + c + "-", " " + MISSING + " ");
            result = result.replace(" " + c + "-", " " + MISSING + " ");
            result = result.replace("-" + c + " ", " " + MISSING + " ");
            result = result.replace(" " + c + " ", " " + MISSING + " ");
            result = result.replace("\n" + c + " ", "\n" + MISSING + " ");
            result = result.replace(" " + c + "\n", " " + MISSING + "\n");
            result = replaceSuffix(result, " " + c, MISSING);
            result = replaceSuffix(result, "-" + c, MISSING);
            result = result.replace(MISSING + c + " ", MISSING);
            result = result.replace(MISSING + c + "-", MISSING);
            result = result.replace(" " + c + MISSING, MISSING);
            result = result.replace("-" + c + MISSING, MISSING);
        }
        return context.correct(CorrectionStage.PLACEHOLDERS, result);
    }

    /**
     * {@code $erasure$} and {@code $ traces $} become the missing marker. Elsewhere {@code $} marks
     * an uncertain reading in front of a sign name; the sign name already says as much, so only the
     * dollar goes.
     */
    public static String dollarSigns(String text, RewriteContext context) {
        String result = text;
        for (String erasure : ERASURES) {
            result = result.replace(erasure, MISSING);
        }
        for (String prefix : UNCERTAIN_SIGN_PREFIXES) {
            result = result.replace(prefix, prefix.substring(1));
        }
        if (result.contains("$")) {
            context.report("Uncaught $");
        }
        return result;
    }

    /** Three or more dots become the missing marker. */
    public static String ellipses(String text, RewriteContext context) {
        return ELLIPSIS.matcher(text).replaceAll(Matcher.quoteReplacement(MISSING));
    }

    /**
     * {@code (abc)} standing on its own: may be present but is not certain; dropped.
     */
    public static String standaloneParentheses(String text, RewriteContext context) {
        String result = text;
        for (String match : findAll(STANDALONE_PARENS, result, 1)) {
            context.trace("standalone " + match);
            result = result.replace(match, "");
        }
        return result;
    }

    /** {@code (#MISSING#)} and {@code {#MISSING#}} become the bare marker. */
    public static String missingAloneInEnclosure(String text, RewriteContext context) {
        String missing = Matcher.quoteReplacement(MISSING);
        String result = MISSING_IN_PARENS.matcher(text).replaceAll(missing);
        return MISSING_IN_BRACES.matcher(result).replaceAll(missing);
    }

    public static String emptyEnclosures(String text, RewriteContext context) {
        return text.replace("{}", "").replace("()", "");
    }

    /** Placeholders become their external token spellings. */
    public static String convertSpecialTokens(String text, RewriteContext context) {
        return SpecialToken.toExternal(text);
    }

    private static String replaceSuffix(String text, String suffix, String replacement) {
        if (text.endsWith(suffix)) {
            return text.substring(0, text.length() - suffix.length()) + replacement;
        }
        return text;
    }

    private static List<String> findAll(Pattern pattern, String text, int group) {
        List<String> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.group(group));
        }
        return matches;
    }

    private record EnclosureSwap(Pattern pattern, String from, String to) {
    }
}
