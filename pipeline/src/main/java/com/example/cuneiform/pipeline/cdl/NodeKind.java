package com.example.cuneiform.pipeline.cdl;

/**
 * Discriminator of the five annotation node kinds.
 */
public enum NodeKind {
    CHUNK("c"),
    DISCONTINUITY("d"),
    LEMMA("l"),
    LINK_GROUP("ll"),
    LINKBASE("linkbase");

    private final String discriminator;

    NodeKind(String discriminator) {
        this.discriminator = discriminator;
    }

    public String discriminator() {
        return discriminator;
    }

    public static NodeKind fromDiscriminator(String value) {
        for (NodeKind kind : values()) {
            if (kind.discriminator.equals(value)) {
                return kind;
            }
        }
        throw new CdlFormatException("Unknown node type: " + value);
    }
}
