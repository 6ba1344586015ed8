package com.example.cuneiform.pipeline.cdl;

import java.util.List;
import java.util.Objects;

/**
 * Groups child nodes into a discourse, sentence, phrase or text unit.
 */
public record Chunk(String id, ChunkType type, List<CdlNode> children) implements CdlNode {

    public Chunk {
        Objects.requireNonNull(type, "type");
        id = id == null ? "" : id;
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CHUNK;
    }
}
