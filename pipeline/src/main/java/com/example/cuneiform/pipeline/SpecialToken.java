package com.example.cuneiform.pipeline;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural tokens that survive normalisation. While a record is being rewritten every token is
 * carried as an internal placeholder ({@code #MISSING#}, ...), because the external spellings
 * ({@code ...}, {@code <SURFACE>}, ...) collide with the scholarly notation being cleaned up.
 */
public enum SpecialToken {
    MISSING("#MISSING#", "..."),
    SURFACE("#SURFACE#", "<SURFACE>"),
    COLUMN("#COLUMN#", "<COLUMN>"),
    BLANK_SPACE("#BLANK_SPACE#", "<BLANK_SPACE>"),
    RULING("#RULING#", "<RULING>"),
    NEWLINE("\n", "\n");

    /** Replaces a morpheme, sign name or glyph that could not be resolved. */
    public static final String UNKNOWN = "<unk>";

    private static final Pattern PLACEHOLDER = Pattern.compile("#\\S*?#");

    private static final Set<String> EXTERNAL_TOKENS = Set.of(
            "...", "<SURFACE>", "<COLUMN>", "<BLANK_SPACE>", "<RULING>", "\n", UNKNOWN);

    private final String placeholder;
    private final String token;

    SpecialToken(String placeholder, String token) {
        this.placeholder = placeholder;
        this.token = token;
    }

    public String placeholder() {
        return placeholder;
    }

    public String token() {
        return token;
    }

    /**
     * Returns {@code true} when the value is one of the external token spellings, including the
     * newline and {@link #UNKNOWN}.
     */
    public static boolean isSpecialToken(String value) {
        return value != null && EXTERNAL_TOKENS.contains(value);
    }

    /**
     * Converts every placeholder to its external spelling.
     */
    public static String toExternal(String text) {
        String result = text;
        for (SpecialToken token : values()) {
            result = result.replace(token.placeholder, token.token);
        }
        return result;
    }

    /**
     * Converts the bracket-tag spellings ({@code <SURFACE>}, {@code <COLUMN>}, ...) back to their
     * placeholders. The ellipsis is left alone: in raw text it is notation, not a token.
     */
    public static String toInternal(String text) {
        String result = text;
        for (SpecialToken token : values()) {
            if (token == MISSING || token == NEWLINE) {
                continue;
            }
            result = result.replace(token.token, token.placeholder);
        }
        return result;
    }

    /**
     * Removes placeholders, newlines and spaces, leaving only the text content.
     */
    public static String withoutPlaceholders(String text) {
        return PLACEHOLDER.matcher(text).replaceAll("")
                .replace("\n", "")
                .replace(" ", "");
    }

    /**
     * Removes every external token spelling.
     */
    public static String withoutTokens(String text) {
        String result = text;
        for (SpecialToken token : values()) {
            result = result.replace(token.token, "");
        }
        return result.replace(UNKNOWN, "");
    }
}
