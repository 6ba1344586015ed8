package com.example.cuneiform.pipeline.normalize;

import java.util.List;
import java.util.Objects;

/**
 * Validation hook between phases: reports every forbidden substring that is still present and
 * leaves the text untouched.
 */
public final class SanityCheck implements RewriteRule {

    private final String name;
    private final List<String> disallowed;

    public SanityCheck(String name, List<String> disallowed) {
        this.name = Objects.requireNonNull(name, "name");
        this.disallowed = List.copyOf(disallowed);
    }

    public String name() {
        return name;
    }

    public List<String> disallowed() {
        return disallowed;
    }

    @Override
    public String apply(String text, RewriteContext context) {
        for (String fragment : disallowed) {
            if (text.contains(fragment)) {
                context.report("Disallowed " + printable(fragment) + " after " + name + " check");
            }
        }
        return text;
    }

    private static String printable(String fragment) {
        return "'" + fragment.replace("\n", "\\n") + "'";
    }
}
