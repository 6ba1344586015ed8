package com.example.cuneiform.pipeline.cdl;

import com.example.cuneiform.pipeline.SpecialToken;

import java.util.Objects;
import java.util.Optional;

/**
 * Structural break in the document: a new line, column or surface, or a stretch that is missing,
 * blank or ruled.
 */
public record Discontinuity(DiscontinuityType type, String state, String scope) implements CdlNode {

    public Discontinuity {
        Objects.requireNonNull(type, "type");
        state = state == null ? "" : state;
        scope = scope == null ? "" : scope;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DISCONTINUITY;
    }

    /**
     * Renders the break as text. The node type takes precedence over its state; combinations with
     * no textual meaning yield an empty result.
     */
    public Optional<String> toText() {
        switch (type) {
            case OBJECT:
                return Optional.empty();
            case LINE_START:
                return Optional.of("\n");
            case COLUMN:
                return Optional.of(onOwnLine(SpecialToken.COLUMN));
            case SURFACE:
                return Optional.of(SpecialToken.SURFACE.placeholder());
            default:
                break;
        }
        switch (state) {
            case "missing":
                return Optional.of(onOwnLine(SpecialToken.MISSING));
            case "blank":
                if ("line".equals(scope)) {
                    return Optional.of(onOwnLine(SpecialToken.MISSING));
                }
                if ("space".equals(scope)) {
                    return Optional.of(onOwnLine(SpecialToken.BLANK_SPACE));
                }
                return Optional.empty();
            case "ruling":
                return Optional.of(onOwnLine(SpecialToken.RULING));
            default:
                return Optional.empty();
        }
    }

    private static String onOwnLine(SpecialToken token) {
        return "\n" + token.placeholder() + "\n";
    }
}
